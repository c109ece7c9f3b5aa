package com.imagefan.engine;

public class WorkerStartException extends Exception {
    private final String itemName;

    public WorkerStartException(String itemName, Throwable cause) {
        super("Could not start worker for " + itemName + ": " + WorkFailure.describe(cause), cause);
        this.itemName = itemName;
    }

    public String getItemName() {
        return itemName;
    }
}
