package com.imagefan.app;

import com.imagefan.engine.WorkItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ImageDirectoryScannerTest {

    @TempDir
    Path tmp;

    private final ImageDirectoryScanner scanner = new ImageDirectoryScanner();

    private void touch(String... names) throws IOException {
        for (String n : names) {
            Files.writeString(tmp.resolve(n), "x");
        }
    }

    private static List<String> names(List<WorkItem> items) {
        return items.stream().map(i -> i.name).collect(Collectors.toList());
    }

    @Test
    void keepsOnlyImageExtensionsInAnyCase() throws Exception {
        touch("a.jpg", "b.JPEG", "c.Png", "d.webp", "notes.txt", "e.gif", "noext", ".jpg");

        List<WorkItem> items = scanner.scan(tmp);

        assertEquals(List.of("a", "b", "c", "d"), names(items));
    }

    @Test
    void itemsAreSortedByFileName() throws Exception {
        touch("zebra.png", "apple.jpg", "mango.jpeg");

        assertEquals(List.of("apple", "mango", "zebra"), names(scanner.scan(tmp)));
    }

    @Test
    void nameDropsOnlyTheLastExtension() throws Exception {
        touch("holiday.2024.jpg");

        WorkItem item = scanner.scan(tmp).get(0);

        assertEquals("holiday.2024", item.name);
        assertEquals(tmp.resolve("holiday.2024.jpg").toAbsolutePath(), item.sourcePath);
    }

    @Test
    void collidingBaseNamesAreDisambiguatedByExtension() throws Exception {
        touch("a.jpg", "a.png", "b.jpg");

        assertEquals(List.of("a-jpg", "a-png", "b"), names(scanner.scan(tmp)));
    }

    @Test
    void sameExtensionInDifferentCaseStillGetsDistinctNames() {
        List<WorkItem> items = ImageDirectoryScanner.toWorkItems(
                List.of(tmp.resolve("a.JPG"), tmp.resolve("a.jpg")));

        assertEquals(List.of("a-jpg", "a-jpg-2"), names(items));
    }

    @Test
    void directoriesLookingLikeImagesAreSkipped() throws Exception {
        Files.createDirectory(tmp.resolve("folder.jpg"));
        touch("real.jpg");

        assertEquals(List.of("real"), names(scanner.scan(tmp)));
    }

    @Test
    void emptyDirectoryGivesNoItems() throws Exception {
        assertTrue(scanner.scan(tmp).isEmpty());
    }

    @Test
    void missingDirectoryIsAnEnumerationFailure() {
        EnumerationException e = assertThrows(EnumerationException.class,
                () -> scanner.scan(tmp.resolve("nope")));
        assertTrue(e.getMessage().contains("nope"));
    }

    @Test
    void regularFileInsteadOfDirectoryIsAnEnumerationFailure() throws Exception {
        touch("file.jpg");

        assertThrows(EnumerationException.class, () -> scanner.scan(tmp.resolve("file.jpg")));
    }

    @Test
    void extensionHelpers() {
        assertTrue(ImageDirectoryScanner.isImage("x.WEBP"));
        assertFalse(ImageDirectoryScanner.isImage(".png"));
        assertEquals("x", ImageDirectoryScanner.baseName("x.jpeg"));
        assertEquals("jpeg", ImageDirectoryScanner.extension("x.JPEG"));
    }
}
