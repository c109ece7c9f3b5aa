package com.imagefan.engine;

@FunctionalInterface
public interface ItemProcessor {
    WorkOutcome process(WorkItem item);
}
