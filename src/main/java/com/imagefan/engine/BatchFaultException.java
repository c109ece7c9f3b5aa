package com.imagefan.engine;

import java.util.List;

/**
 * Whole-batch fault. Completes a batch's future exceptionally; carries whatever
 * outcomes were recorded before the fault, in batch order.
 */
public class BatchFaultException extends RuntimeException {
    private final List<WorkOutcome> partialOutcomes;

    public BatchFaultException(String message, Throwable cause, List<WorkOutcome> partialOutcomes) {
        super(message, cause);
        this.partialOutcomes = List.copyOf(partialOutcomes);
    }

    public List<WorkOutcome> getPartialOutcomes() {
        return partialOutcomes;
    }
}
