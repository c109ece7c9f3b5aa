package com.imagefan.engine;

public class StageException extends Exception {
    private final Stage stage;
    private final String variant;

    public StageException(Stage stage, String variant, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.variant = variant;
    }

    public Stage getStage() {
        return stage;
    }

    public String getVariant() {
        return variant;
    }

    public WorkFailure toFailure() {
        String detail = getCause() == null
                ? getMessage()
                : getMessage() + ": " + WorkFailure.describe(getCause());
        return new WorkFailure(stage, variant, detail);
    }
}
