package net.riseadvisor.model.image;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.Arrays;

/**
 * Decoded photograph as a row-major grid of packed {@code 0xRRGGBB} pixels.
 *
 * <p>A grid belongs to the validation call that decoded it and is dropped when
 * that call returns. It is never shared or cached.</p>
 */
public final class PixelGrid {

    private final int width;
    private final int height;
    private final int[] pixels;

    private PixelGrid(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * Creates a grid from packed RGB values (alpha bits are ignored).
     *
     * @param width grid width, may be zero
     * @param height grid height, may be zero
     * @param rgb {@code width * height} packed pixels in row-major order
     * @return a grid holding a copy of {@code rgb}
     */
    public static PixelGrid of(int width, int height, int[] rgb) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Grid dimensions must be non-negative: " + width + "x" + height);
        }
        if (rgb == null || rgb.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " pixels for a "
                + width + "x" + height + " grid");
        }
        int[] copy = Arrays.copyOf(rgb, rgb.length);
        for (int i = 0; i < copy.length; i++) {
            copy[i] &= 0xFFFFFF;
        }
        return new PixelGrid(width, height, copy);
    }

    /**
     * Converts any decoded image to an RGB grid. Images with an alpha channel are
     * flattened onto black, matching a plain RGB redraw.
     */
    public static PixelGrid fromImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();

        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            // Caller still owns this raster
            return of(width, height, ((DataBufferInt) image.getRaster().getDataBuffer()).getData());
        }

        BufferedImage rgbImage = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgbImage.createGraphics();
        g.drawImage(image, 0, 0, null);
        g.dispose();

        // Fresh buffer, adopted without a second copy
        int[] data = ((DataBufferInt) rgbImage.getRaster().getDataBuffer()).getData();
        for (int i = 0; i < data.length; i++) {
            data[i] &= 0xFFFFFF;
        }
        return new PixelGrid(width, height, data);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return pixels.length;
    }

    public boolean isEmpty() {
        return pixels.length == 0;
    }

    public int rgb(int x, int y) {
        return pixels[y * width + x];
    }

    public int red(int x, int y) {
        return (rgb(x, y) >> 16) & 0xFF;
    }

    public int green(int x, int y) {
        return (rgb(x, y) >> 8) & 0xFF;
    }

    public int blue(int x, int y) {
        return rgb(x, y) & 0xFF;
    }

    /**
     * Grayscale plane using ITU-R 601 luma weights, rounded to the nearest integer.
     *
     * @return {@code width * height} intensities in [0, 255], row-major
     */
    public int[] lumaPlane() {
        int[] luma = new int[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            luma[i] = luma(pixels[i]);
        }
        return luma;
    }

    static int luma(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (r * 299 + g * 587 + b * 114 + 500) / 1000;
    }
}
