package com.imagefan.image;

import com.imagefan.engine.ItemProcessor;
import com.imagefan.engine.Stage;
import com.imagefan.engine.StageException;
import com.imagefan.engine.WorkItem;
import com.imagefan.engine.WorkOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A worker's body: decode the source once, then produce each variant in order
 * from that unmodified source. The first failure stops the item; derivatives
 * already written stay on disk.
 */
public class DerivativePipeline implements ItemProcessor {
    private static final Logger log = LoggerFactory.getLogger(DerivativePipeline.class);

    private final OutputLayout layout;
    private final List<Variant> variants;

    public DerivativePipeline(OutputLayout layout) {
        this(layout, Variant.STANDARD);
    }

    public DerivativePipeline(OutputLayout layout, List<Variant> variants) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.variants = List.copyOf(variants);
    }

    @Override
    public WorkOutcome process(WorkItem item) {
        long start = System.currentTimeMillis();
        try {
            produceAll(item);
            log.debug("{} processed in {}ms", item.name, System.currentTimeMillis() - start);
            return WorkOutcome.succeeded(item.name);
        } catch (StageException e) {
            log.warn("{} failed at {}: {}", item.name, e.getStage(), e.getMessage());
            return WorkOutcome.failed(item.name, e.toFailure());
        }
    }

    void produceAll(WorkItem item) throws StageException {
        try {
            layout.ensureItemDir(item.name);
        } catch (IOException | RuntimeException e) {
            throw new StageException(Stage.PREPARE, null, "cannot create output directory", e);
        }

        BufferedImage source;
        try {
            source = ImageTransforms.decode(item.sourcePath);
        } catch (IOException | RuntimeException e) {
            throw new StageException(Stage.DECODE, null, "cannot decode " + item.sourcePath.getFileName(), e);
        }

        for (Variant v : variants) {
            BufferedImage derived;
            try {
                derived = v.apply(source);
            } catch (RuntimeException | OutOfMemoryError e) {
                throw new StageException(Stage.TRANSFORM, v.name, "transform failed", e);
            }
            if (derived == null) {
                throw new StageException(Stage.TRANSFORM, v.name, "transform produced no image", null);
            }

            Path target = layout.variantFile(item.name, v);
            try {
                ImageTransforms.writeJpeg(derived, target);
            } catch (IOException | RuntimeException e) {
                throw new StageException(Stage.WRITE, v.name, "cannot write " + target.getFileName(), e);
            }
        }
    }
}
