package com.imagefan.engine;

import java.time.Duration;

public final class DispatcherConfig {
    public final int maxConcurrency;
    public final Duration workerTimeout;   // null or zero: no deadline

    public DispatcherConfig(int maxConcurrency) {
        this(maxConcurrency, null);
    }

    public DispatcherConfig(int maxConcurrency, Duration workerTimeout) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        if (workerTimeout != null && workerTimeout.isNegative()) {
            throw new IllegalArgumentException("workerTimeout must not be negative");
        }
        this.maxConcurrency = maxConcurrency;
        this.workerTimeout = workerTimeout;
    }

    public boolean hasTimeout() {
        return workerTimeout != null && !workerTimeout.isZero();
    }
}
