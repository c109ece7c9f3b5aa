package com.imagefan.image;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** One named derivative: a transform of the decoded source, saved as {@code <name>.jpg}. */
public final class Variant {

    public static final Variant THUMBNAIL = resize("thumbnail", 150, 150);
    public static final Variant SMALL = resize("small", 300, 300);
    public static final Variant MEDIUM = resize("medium", 600, 600);
    public static final Variant LARGE = resize("large", 1200, 1200);
    public static final Variant GRAYSCALE = new Variant("grayscale", ImageTransforms::grayscale);
    public static final Variant BLUR = new Variant("blur", img -> ImageTransforms.blur(img, 5));

    /** The fixed set every item gets, in the order they are produced. */
    public static final List<Variant> STANDARD = List.of(THUMBNAIL, SMALL, MEDIUM, LARGE, GRAYSCALE, BLUR);

    public final String name;
    private final UnaryOperator<BufferedImage> op;

    public Variant(String name, UnaryOperator<BufferedImage> op) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("variant name must not be blank");
        }
        this.name = name;
        this.op = Objects.requireNonNull(op, "op");
    }

    public static Variant resize(String name, int width, int height) {
        return new Variant(name, img -> ImageTransforms.resize(img, width, height));
    }

    public String fileName() {
        return name + ".jpg";
    }

    public BufferedImage apply(BufferedImage source) {
        return op.apply(source);
    }

    @Override
    public String toString() {
        return name;
    }
}
