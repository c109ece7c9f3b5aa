package com.imagefan.engine;

import java.util.Objects;

public final class WorkFailure {
    public final Stage stage;
    public final String variant;   // null when the failure is not tied to one derivative
    public final String message;

    public WorkFailure(Stage stage, String variant, String message) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.variant = variant;
        this.message = message == null ? "" : message;
    }

    public static WorkFailure of(Stage stage, Throwable cause) {
        return new WorkFailure(stage, null, describe(cause));
    }

    static String describe(Throwable t) {
        String m = t.getMessage();
        return m == null || m.isBlank() ? t.getClass().getSimpleName() : m;
    }

    @Override
    public String toString() {
        return variant == null
                ? "[" + stage + "] " + message
                : "[" + stage + "/" + variant + "] " + message;
    }
}
