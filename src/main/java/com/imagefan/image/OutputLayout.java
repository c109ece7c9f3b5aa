package com.imagefan.image;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class OutputLayout {
    private final Path root;

    public OutputLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path itemDir(String itemName) {
        Path dir = root.resolve(itemName).normalize();
        if (dir.getParent() == null || !dir.getParent().equals(root)) {
            throw new IllegalArgumentException("item name escapes the output root: " + itemName);
        }
        return dir;
    }

    /** Creates the item's directory and any missing parents; a no-op when it exists. */
    public Path ensureItemDir(String itemName) throws IOException {
        return Files.createDirectories(itemDir(itemName));
    }

    public Path variantFile(String itemName, Variant variant) {
        return itemDir(itemName).resolve(variant.fileName());
    }
}
