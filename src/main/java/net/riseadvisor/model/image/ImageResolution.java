package net.riseadvisor.model.image;

/**
 * Pixel dimensions of a decoded photograph.
 *
 * @param width width in pixels
 * @param height height in pixels
 */
public record ImageResolution(int width, int height) {
}
