package com.clinicflow.backend.global.ratelimit;

import java.time.Duration;

/**
 * Counter shared by every application instance. A key's window starts on its first increment.
 */
public interface SharedCounter {

    long increment(String key, Duration window);

    Duration timeToLive(String key);
}
