package com.imagefan.image;

import com.imagefan.engine.Stage;
import com.imagefan.engine.WorkItem;
import com.imagefan.engine.WorkOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DerivativePipelineTest {

    @TempDir
    Path tmp;

    @Test
    void producesEveryStandardVariantAtItsSize() throws IOException {
        Path src = TestImages.writeJpeg(tmp.resolve("sample-1.jpg"), 320, 200);
        Path out = tmp.resolve("out");

        WorkOutcome outcome = new DerivativePipeline(new OutputLayout(out))
                .process(new WorkItem(src, "sample-1"));

        assertTrue(outcome.succeeded(), () -> "unexpected " + outcome);
        Map<String, int[]> expected = Map.of(
                "thumbnail.jpg", new int[]{150, 150},
                "small.jpg", new int[]{300, 300},
                "medium.jpg", new int[]{600, 600},
                "large.jpg", new int[]{1200, 1200},
                "grayscale.jpg", new int[]{320, 200},
                "blur.jpg", new int[]{320, 200});
        for (Map.Entry<String, int[]> e : expected.entrySet()) {
            BufferedImage img = ImageIO.read(out.resolve("sample-1").resolve(e.getKey()).toFile());
            assertNotNull(img, e.getKey());
            assertEquals(e.getValue()[0], img.getWidth(), e.getKey());
            assertEquals(e.getValue()[1], img.getHeight(), e.getKey());
        }
        try (var files = Files.list(out.resolve("sample-1"))) {
            assertEquals(6, files.count());
        }
    }

    @Test
    void pngSourceIsAccepted() throws IOException {
        Path src = TestImages.writePng(tmp.resolve("pic.png"), 64, 48);

        WorkOutcome outcome = new DerivativePipeline(new OutputLayout(tmp.resolve("out")))
                .process(new WorkItem(src, "pic"));

        assertTrue(outcome.succeeded());
        assertTrue(Files.isRegularFile(tmp.resolve("out/pic/thumbnail.jpg")));
    }

    @Test
    void corruptSourceFailsAtDecode() throws IOException {
        Path src = TestImages.writeCorrupt(tmp.resolve("broken.jpg"));

        WorkOutcome outcome = new DerivativePipeline(new OutputLayout(tmp.resolve("out")))
                .process(new WorkItem(src, "broken"));

        assertFalse(outcome.succeeded());
        assertEquals(Stage.DECODE, outcome.error.stage);
        assertNull(outcome.error.variant);
        assertTrue(outcome.error.message.contains("broken.jpg"));
    }

    @Test
    void missingSourceFailsAtDecode() {
        WorkOutcome outcome = new DerivativePipeline(new OutputLayout(tmp.resolve("out")))
                .process(new WorkItem(tmp.resolve("gone.png"), "gone"));

        assertEquals(Stage.DECODE, outcome.error.stage);
    }

    @Test
    void transformFailureStopsLaterVariantsButKeepsEarlierOnes() throws IOException {
        Path src = TestImages.writePng(tmp.resolve("a.png"), 40, 40);
        Variant broken = new Variant("broken", img -> {
            throw new IllegalStateException("kaboom");
        });
        DerivativePipeline pipeline = new DerivativePipeline(new OutputLayout(tmp.resolve("out")),
                List.of(Variant.THUMBNAIL, broken, Variant.GRAYSCALE));

        WorkOutcome outcome = pipeline.process(new WorkItem(src, "a"));

        assertEquals(Stage.TRANSFORM, outcome.error.stage);
        assertEquals("broken", outcome.error.variant);
        assertTrue(outcome.error.message.contains("kaboom"));
        assertTrue(Files.exists(tmp.resolve("out/a/thumbnail.jpg")));
        assertFalse(Files.exists(tmp.resolve("out/a/grayscale.jpg")));
    }

    @Test
    void transformReturningNothingIsAFailure() throws IOException {
        Path src = TestImages.writePng(tmp.resolve("a.png"), 10, 10);
        DerivativePipeline pipeline = new DerivativePipeline(new OutputLayout(tmp.resolve("out")),
                List.of(new Variant("empty", img -> null)));

        WorkOutcome outcome = pipeline.process(new WorkItem(src, "a"));

        assertEquals(Stage.TRANSFORM, outcome.error.stage);
        assertEquals("empty", outcome.error.variant);
    }

    @Test
    void unusableOutputRootFailsAtPrepare() throws IOException {
        Path src = TestImages.writePng(tmp.resolve("a.png"), 10, 10);
        Path notADir = Files.writeString(tmp.resolve("out"), "occupied");

        WorkOutcome outcome = new DerivativePipeline(new OutputLayout(notADir))
                .process(new WorkItem(src, "a"));

        assertEquals(Stage.PREPARE, outcome.error.stage);
    }

    @Test
    void blockedTargetFailsAtWrite() throws IOException {
        Path src = TestImages.writePng(tmp.resolve("a.png"), 10, 10);
        Path blocker = Files.createDirectories(tmp.resolve("out/a/small.jpg"));
        Files.writeString(blocker.resolve("keep"), "x");

        WorkOutcome outcome = new DerivativePipeline(new OutputLayout(tmp.resolve("out")))
                .process(new WorkItem(src, "a"));

        assertEquals(Stage.WRITE, outcome.error.stage);
        assertEquals("small", outcome.error.variant);
        assertTrue(Files.exists(tmp.resolve("out/a/thumbnail.jpg")));
        assertFalse(Files.exists(tmp.resolve("out/a/small.jpg.part")));
    }

    @Test
    void rerunOverwritesExistingOutputs() throws IOException {
        Path src = TestImages.writePng(tmp.resolve("a.png"), 30, 30);
        DerivativePipeline pipeline = new DerivativePipeline(new OutputLayout(tmp.resolve("out")));

        assertTrue(pipeline.process(new WorkItem(src, "a")).succeeded());
        assertTrue(pipeline.process(new WorkItem(src, "a")).succeeded());
    }

    @Test
    void sourceIsNeverModified() throws IOException {
        Path src = TestImages.writePng(tmp.resolve("a.png"), 30, 30);
        byte[] before = Files.readAllBytes(src);

        new DerivativePipeline(new OutputLayout(tmp.resolve("out"))).process(new WorkItem(src, "a"));

        assertArrayEquals(before, Files.readAllBytes(src));
    }
}
