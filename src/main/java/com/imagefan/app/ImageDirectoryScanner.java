package com.imagefan.app;

import com.imagefan.engine.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class ImageDirectoryScanner {
    private static final Logger log = LoggerFactory.getLogger(ImageDirectoryScanner.class);

    public static final Set<String> EXTENSIONS = Set.of("jpg", "jpeg", "png", "webp");

    public List<WorkItem> scan(Path dir) throws EnumerationException {
        if (!Files.isDirectory(dir)) {
            throw new EnumerationException("Input directory not found: " + dir, null);
        }

        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(Files::isRegularFile)
                    .filter(p -> isImage(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new EnumerationException("Cannot list input directory " + dir, e);
        }

        List<WorkItem> items = toWorkItems(files);
        log.info("Found {} image(s) in {}", items.size(), dir);
        return items;
    }

    static boolean isImage(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    // a.jpg + a.png -> a-jpg, a-png
    static List<WorkItem> toWorkItems(List<Path> files) {
        Map<String, Integer> counts = new HashMap<>();
        for (Path p : files) {
            counts.merge(baseName(p.getFileName().toString()), 1, Integer::sum);
        }

        Set<String> used = new HashSet<>();
        List<WorkItem> items = new ArrayList<>(files.size());
        for (Path p : files) {
            String fileName = p.getFileName().toString();
            String name = baseName(fileName);
            if (counts.get(name) > 1) {
                name = name + "-" + extension(fileName);
            }
            // a.JPG next to a.jpg still collides after the suffix
            String candidate = name;
            for (int n = 2; !used.add(candidate); n++) {
                candidate = name + "-" + n;
            }
            if (!candidate.equals(baseName(fileName))) {
                log.warn("{} renamed to '{}' to keep output directories apart", fileName, candidate);
            }
            items.add(new WorkItem(p, candidate));
        }
        return items;
    }
}
