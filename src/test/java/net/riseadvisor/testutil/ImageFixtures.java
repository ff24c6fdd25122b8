package net.riseadvisor.testutil;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;
import java.util.zip.CRC32;
import javax.imageio.ImageIO;
import net.riseadvisor.model.image.PixelGrid;

/** Synthetic photographs for image quality tests. */
public final class ImageFixtures {

    private ImageFixtures() {
    }

    public static BufferedImage solid(int width, int height, Color color) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int rgb = color.getRGB();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }

    public static BufferedImage gray(int width, int height, int level) {
        return solid(width, height, new Color(level, level, level));
    }

    /**
     * Independent uniform noise per channel in {@code [low, high]}; fixed seed keeps fixtures reproducible.
     */
    public static BufferedImage noise(int width, int height, int low, int high, long seed) {
        Random random = new Random(seed);
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int span = high - low + 1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = low + random.nextInt(span);
                int g = low + random.nextInt(span);
                int b = low + random.nextInt(span);
                img.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return img;
    }

    /** Gray checkerboard alternating between two levels. */
    public static PixelGrid checkerboardGrid(int width, int height, int levelA, int levelB) {
        int[] rgb = new int[width * height];
        int a = (levelA << 16) | (levelA << 8) | levelA;
        int b = (levelB << 16) | (levelB << 8) | levelB;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rgb[y * width + x] = (x + y) % 2 == 0 ? a : b;
            }
        }
        return PixelGrid.of(width, height, rgb);
    }

    public static PixelGrid grayGrid(int width, int height, int level) {
        int[] rgb = new int[width * height];
        Arrays.fill(rgb, (level << 16) | (level << 8) | level);
        return PixelGrid.of(width, height, rgb);
    }

    /**
     * Box blur with the given radius; edge pixels average over the in-bounds part of the window.
     */
    public static BufferedImage boxBlur(BufferedImage source, int radius) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = 0;
                int g = 0;
                int b = 0;
                int n = 0;
                for (int dy = -radius; dy <= radius; dy++) {
                    for (int dx = -radius; dx <= radius; dx++) {
                        int sx = x + dx;
                        int sy = y + dy;
                        if (sx < 0 || sy < 0 || sx >= width || sy >= height) {
                            continue;
                        }
                        int rgb = source.getRGB(sx, sy);
                        r += (rgb >> 16) & 0xFF;
                        g += (rgb >> 8) & 0xFF;
                        b += rgb & 0xFF;
                        n++;
                    }
                }
                out.setRGB(x, y, ((r / n) << 16) | ((g / n) << 8) | (b / n));
            }
        }
        return out;
    }

    public static byte[] png(BufferedImage image) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode PNG fixture", e);
        }
    }

    /**
     * PNG signature, an IHDR chunk declaring {@code width x height} 8-bit RGB, and IEND.
     * There is no IDAT chunk, so any attempt to decode pixels fails.
     */
    public static byte[] pngHeaderOnly(int width, int height) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {
            out.write(new byte[] {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A});

            ByteArrayOutputStream ihdr = new ByteArrayOutputStream();
            DataOutputStream header = new DataOutputStream(ihdr);
            header.writeInt(width);
            header.writeInt(height);
            header.writeByte(8);
            header.writeByte(2);
            header.writeByte(0);
            header.writeByte(0);
            header.writeByte(0);
            writeChunk(out, "IHDR", ihdr.toByteArray());
            writeChunk(out, "IEND", new byte[0]);
            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build PNG header fixture", e);
        }
    }

    private static void writeChunk(DataOutputStream out, String type, byte[] data) throws IOException {
        byte[] typeBytes = type.getBytes(StandardCharsets.US_ASCII);
        CRC32 crc = new CRC32();
        crc.update(typeBytes);
        crc.update(data);
        out.writeInt(data.length);
        out.write(typeBytes);
        out.write(data);
        out.writeInt((int) crc.getValue());
    }
}
