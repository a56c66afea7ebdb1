package com.editguard.core.request;

public enum ImpactLevel {
    LOW,
    MEDIUM,
    HIGH
}
