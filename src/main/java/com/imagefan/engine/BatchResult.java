package com.imagefan.engine;

import java.util.List;
import java.util.stream.Collectors;

public final class BatchResult {
    public final List<WorkOutcome> outcomes;
    public final long elapsedMillis;

    public BatchResult(List<WorkOutcome> outcomes, long elapsedMillis) {
        this.outcomes = List.copyOf(outcomes);
        this.elapsedMillis = elapsedMillis;
    }

    public static BatchResult empty() {
        return new BatchResult(List.of(), 0L);
    }

    public int size() {
        return outcomes.size();
    }

    public List<WorkOutcome> succeeded() {
        return outcomes.stream().filter(WorkOutcome::succeeded).collect(Collectors.toList());
    }

    public List<WorkOutcome> failed() {
        return outcomes.stream().filter(o -> !o.succeeded()).collect(Collectors.toList());
    }

    public boolean allSucceeded() {
        return outcomes.stream().allMatch(WorkOutcome::succeeded);
    }
}
