package com.imagefan.engine;

import java.util.Objects;

public final class WorkOutcome {

    public enum Status { SUCCEEDED, FAILED }

    public final String name;
    public final Status status;
    public final WorkFailure error;
    public final long elapsedMillis;

    private WorkOutcome(String name, Status status, WorkFailure error, long elapsedMillis) {
        this.name = Objects.requireNonNull(name, "name");
        this.status = status;
        this.error = error;
        this.elapsedMillis = elapsedMillis;
    }

    public static WorkOutcome succeeded(String name) {
        return new WorkOutcome(name, Status.SUCCEEDED, null, 0L);
    }

    public static WorkOutcome failed(String name, WorkFailure error) {
        return new WorkOutcome(name, Status.FAILED, Objects.requireNonNull(error, "error"), 0L);
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }

    WorkOutcome withElapsed(long millis) {
        return new WorkOutcome(name, status, error, millis);
    }

    @Override
    public String toString() {
        return succeeded() ? name + " SUCCEEDED" : name + " FAILED " + error;
    }
}
