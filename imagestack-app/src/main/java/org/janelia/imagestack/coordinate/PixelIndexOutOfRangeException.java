package org.janelia.imagestack.coordinate;

/**
 * Thrown when a pixel index falls outside of [0, pixel count) for its axis.
 *
 * @author Eric Trautman
 */
public class PixelIndexOutOfRangeException
        extends IllegalArgumentException {

    private final int pixelIndex;
    private final int pixelCount;

    public PixelIndexOutOfRangeException(final String axisName,
                                         final int pixelIndex,
                                         final int pixelCount) {
        super(axisName + " pixel index " + pixelIndex + " is outside of [0, " + pixelCount + ")");
        this.pixelIndex = pixelIndex;
        this.pixelCount = pixelCount;
    }

    public int getPixelIndex() {
        return pixelIndex;
    }

    public int getPixelCount() {
        return pixelCount;
    }
}
