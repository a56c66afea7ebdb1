package com.editguard.core.execution;

import java.time.Duration;

/** Blocking wait used between rate-limited calls. Replaced in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
