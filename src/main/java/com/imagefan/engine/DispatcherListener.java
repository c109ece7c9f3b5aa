package com.imagefan.engine;

/** Observes dispatch. Called on the coordinator thread, so implementations must not block. */
public interface DispatcherListener {

    DispatcherListener NONE = new DispatcherListener() {};

    default void onStart(WorkItem item) {}

    default void onOutcome(WorkOutcome outcome) {}
}
