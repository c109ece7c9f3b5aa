package com.imagefan.image;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Image operations used by the derivative variants. Every operation returns a new
 * image and leaves its input untouched, so all variants can start from the same
 * decoded source.
 */
public final class ImageTransforms {

    private ImageTransforms() {}

    /**
     * Reads an image with whatever ImageIO readers are installed.
     *
     * @throws IOException if the file cannot be read or no reader recognises it
     */
    public static BufferedImage decode(Path source) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new IOException("not a readable file: " + source);
        }
        BufferedImage img = ImageIO.read(source.toFile());
        if (img == null) {
            throw new IOException("unsupported or corrupt image: " + source.getFileName());
        }
        return img;
    }

    /** Scales to exactly {@code width x height}; aspect ratio is not preserved. */
    public static BufferedImage resize(BufferedImage src, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("invalid resize target " + width + "x" + height);
        }
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(src, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /** Luminance grayscale (Rec. 709 weights), kept as RGB so it encodes as colour JPEG. */
    public static BufferedImage grayscale(BufferedImage src) {
        BufferedImage rgb = toRgb(src);
        int w = rgb.getWidth(), h = rgb.getHeight();
        int[] px = rgb.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < px.length; i++) {
            int p = px[i];
            int r = (p >> 16) & 0xff, g = (p >> 8) & 0xff, b = p & 0xff;
            int y = (int) Math.round(0.2126 * r + 0.7152 * g + 0.0722 * b);
            px[i] = (y << 16) | (y << 8) | y;
        }
        rgb.setRGB(0, 0, w, h, px, 0, w);
        return rgb;
    }

    /** Box blur of the given radius, applied horizontally then vertically; edges clamp. */
    public static BufferedImage blur(BufferedImage src, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("blur radius must be >= 0, got " + radius);
        }
        BufferedImage rgb = toRgb(src);
        if (radius == 0) return rgb;

        int w = rgb.getWidth(), h = rgb.getHeight();
        int[] px = rgb.getRGB(0, 0, w, h, null, 0, w);
        int[] tmp = new int[px.length];
        boxPass(px, tmp, w, h, radius, true);
        boxPass(tmp, px, w, h, radius, false);
        rgb.setRGB(0, 0, w, h, px, 0, w);
        return rgb;
    }

    private static void boxPass(int[] in, int[] out, int w, int h, int r, boolean horizontal) {
        int lines = horizontal ? h : w;
        int len = horizontal ? w : h;
        int span = 2 * r + 1;
        for (int line = 0; line < lines; line++) {
            int sr = 0, sg = 0, sb = 0;
            for (int k = -r; k <= r; k++) {
                int p = in[index(line, clamp(k, len), w, horizontal)];
                sr += (p >> 16) & 0xff;
                sg += (p >> 8) & 0xff;
                sb += p & 0xff;
            }
            for (int i = 0; i < len; i++) {
                out[index(line, i, w, horizontal)] = ((sr / span) << 16) | ((sg / span) << 8) | (sb / span);
                int leaving = in[index(line, clamp(i - r, len), w, horizontal)];
                int entering = in[index(line, clamp(i + r + 1, len), w, horizontal)];
                sr += ((entering >> 16) & 0xff) - ((leaving >> 16) & 0xff);
                sg += ((entering >> 8) & 0xff) - ((leaving >> 8) & 0xff);
                sb += (entering & 0xff) - (leaving & 0xff);
            }
        }
    }

    private static int index(int line, int pos, int w, boolean horizontal) {
        return horizontal ? line * w + pos : pos * w + line;
    }

    private static int clamp(int i, int len) {
        return i < 0 ? 0 : (i >= len ? len - 1 : i);
    }

    /** Fresh opaque RGB copy; transparent areas become white. */
    public static BufferedImage toRgb(BufferedImage src) {
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /** Encodes as JPEG, replacing any existing file. */
    public static void writeJpeg(BufferedImage img, Path target) throws IOException {
        BufferedImage rgb = img.getType() == BufferedImage.TYPE_INT_RGB ? img : toRgb(img);
        Path tmp = target.resolveSibling(target.getFileName() + ".part");
        try {
            if (!ImageIO.write(rgb, "jpg", tmp.toFile())) {
                throw new IOException("no JPEG writer available");
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }
}
