package org.janelia.imagestack.pixel;

import java.util.Arrays;

import org.janelia.imagestack.spec.TileShape;

/**
 * Decoded pixel samples for one tile.
 * Samples are stored in row major order for a (height, width) plane or
 * a thin (depth, height, width) volume.
 *
 * The sample array passed to a constructor is adopted, not copied.
 * Use {@link #copy()} when an independent instance is needed.
 *
 * @author Eric Trautman
 */
public class PixelArray {

    private final int depth;
    private final int height;
    private final int width;
    private final float[] samples;

    public PixelArray(final int height,
                      final int width) {
        this(1, height, width, allocateSamples(1, height, width));
    }

    public PixelArray(final int height,
                      final int width,
                      final float[] samples) {
        this(1, height, width, samples);
    }

    /**
     * @throws IllegalArgumentException
     *   if any dimension is not positive or the number of samples does not match the dimensions.
     */
    public PixelArray(final int depth,
                      final int height,
                      final int width,
                      final float[] samples)
            throws IllegalArgumentException {

        final int expectedLength = getSampleCount(depth, height, width);
        if (samples.length != expectedLength) {
            throw new IllegalArgumentException("pixel array (" + depth + ", " + height + ", " + width +
                                               ") requires " + expectedLength + " samples but " +
                                               samples.length + " were provided");
        }

        this.depth = depth;
        this.height = height;
        this.width = width;
        this.samples = samples;
    }

    public int getDepth() {
        return depth;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    /**
     * @return the (height, width) shape of this array.
     */
    public TileShape getShape() {
        return new TileShape(height, width);
    }

    public float get(final int y,
                     final int x) {
        return samples[(y * width) + x];
    }

    public void set(final int y,
                    final int x,
                    final float value) {
        samples[(y * width) + x] = value;
    }

    /**
     * @return the backing sample array (changes to the returned array are visible in this instance).
     */
    public float[] getSamples() {
        return samples;
    }

    public PixelArray copy() {
        return new PixelArray(depth, height, width, Arrays.copyOf(samples, samples.length));
    }

    /**
     * @return true if every sample in this array is within [min, max].
     */
    public boolean isWithinRange(final float min,
                                 final float max) {
        for (final float sample : samples) {
            if ((sample < min) || (sample > max)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "{depth: " + depth + ", height: " + height + ", width: " + width + '}';
    }

    private static float[] allocateSamples(final int depth,
                                           final int height,
                                           final int width)
            throws IllegalArgumentException {
        return new float[getSampleCount(depth, height, width)];
    }

    private static int getSampleCount(final int depth,
                                      final int height,
                                      final int width)
            throws IllegalArgumentException {

        if ((depth < 1) || (height < 1) || (width < 1)) {
            throw new IllegalArgumentException("invalid pixel array dimensions (" + depth + ", " + height +
                                               ", " + width + "), all dimensions must be positive");
        }

        try {
            return Math.multiplyExact(Math.multiplyExact(depth, height), width);
        } catch (final ArithmeticException e) {
            throw new IllegalArgumentException("pixel array dimensions (" + depth + ", " + height + ", " + width +
                                               ") require too many samples", e);
        }
    }
}
