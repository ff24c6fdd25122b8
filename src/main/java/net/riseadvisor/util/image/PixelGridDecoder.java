package net.riseadvisor.util.image;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import net.riseadvisor.exception.ImageDecodeException;
import net.riseadvisor.model.image.ImageRejectionReason;
import net.riseadvisor.model.image.PixelGrid;

/**
 * Decodes upload bytes (JPEG, PNG, or any other format ImageIO can read) into a {@link PixelGrid}.
 *
 * <p>The image header is read first; pixels are only decoded once the declared
 * dimensions are within the pixel limit.</p>
 */
public final class PixelGridDecoder {

    private PixelGridDecoder() {
    }

    /**
     * @param imageBytes raw upload bytes
     * @param maxImageBytes largest accepted upload size
     * @param maxPixels largest accepted {@code width * height}
     * @return the decoded grid
     * @throws ImageDecodeException when the bytes are empty, too large, or not a readable image
     */
    public static PixelGrid decode(byte[] imageBytes, long maxImageBytes, long maxPixels) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageDecodeException(ImageRejectionReason.EMPTY_FILE, "no bytes supplied");
        }
        if (imageBytes.length > maxImageBytes) {
            throw new ImageDecodeException(ImageRejectionReason.FILE_TOO_LARGE,
                "%d bytes exceeds the %d byte limit".formatted(imageBytes.length, maxImageBytes));
        }

        BufferedImage image;
        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(imageBytes))) {
            image = readWithinPixelLimit(iis, maxPixels);
        } catch (IOException e) {
            throw new ImageDecodeException(ImageRejectionReason.UNREADABLE_IMAGE, e.getMessage(), e);
        } catch (ImageDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            // Truncated or malformed streams surface as runtime exceptions from some ImageIO plugins
            throw new ImageDecodeException(ImageRejectionReason.UNREADABLE_IMAGE, e.toString(), e);
        }
        return PixelGrid.fromImage(image);
    }

    private static BufferedImage readWithinPixelLimit(ImageInputStream iis, long maxPixels) throws IOException {
        if (iis == null) {
            throw new ImageDecodeException(ImageRejectionReason.UNREADABLE_IMAGE,
                "no ImageInputStream could be created");
        }
        Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
        if (!readers.hasNext()) {
            throw new ImageDecodeException(ImageRejectionReason.UNREADABLE_IMAGE,
                "no ImageIO reader recognised the format");
        }

        ImageReader reader = readers.next();
        try {
            reader.setInput(iis, true, true);
            int width = reader.getWidth(0);
            int height = reader.getHeight(0);
            long pixels = (long) width * height;
            if (pixels > maxPixels) {
                throw new ImageDecodeException(ImageRejectionReason.FILE_TOO_LARGE,
                    "%dx%d (%d pixels) exceeds the %d pixel limit".formatted(width, height, pixels, maxPixels));
            }

            BufferedImage image = reader.read(0);
            if (image == null) {
                throw new ImageDecodeException(ImageRejectionReason.UNREADABLE_IMAGE,
                    reader.getFormatName() + " reader returned no image");
            }
            return image;
        } finally {
            reader.dispose();
        }
    }
}
