package com.imagefan.engine;

@FunctionalInterface
public interface WorkerHandle {
    /** Stops the worker if it is still running. Must be safe to call more than once. */
    void cancel();
}
