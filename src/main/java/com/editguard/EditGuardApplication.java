package com.editguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EditGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(EditGuardApplication.class, args);
    }
}
