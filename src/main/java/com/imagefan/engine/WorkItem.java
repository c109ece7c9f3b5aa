package com.imagefan.engine;

import java.nio.file.Path;
import java.util.Objects;

public final class WorkItem {
    public final Path sourcePath;
    public final String name;      // unique within a batch, namespaces the output

    public WorkItem(Path sourcePath, String name) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath").toAbsolutePath();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("WorkItem name must not be blank");
        }
        this.name = name;
    }

    @Override
    public String toString() {
        return name + " (" + sourcePath + ")";
    }
}
