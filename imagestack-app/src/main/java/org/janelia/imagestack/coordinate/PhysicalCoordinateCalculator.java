package org.janelia.imagestack.coordinate;

import org.janelia.imagestack.spec.Coordinate;
import org.janelia.imagestack.spec.PhysicalBounds;
import org.janelia.imagestack.spec.TileShape;

/**
 * Converts pixel positions within a tile to physical positions using linear interpolation
 * across the tile's physical extent.
 * Pixel 0 maps exactly to an axis minimum and pixel (n - 1) maps exactly to its maximum.
 * Single pixel axes always map to the axis minimum.
 *
 * @author Eric Trautman
 */
public class PhysicalCoordinateCalculator {

    /**
     * @param  min         physical minimum of the axis.
     * @param  max         physical maximum of the axis.
     * @param  pixelCount  number of pixels along the axis.
     * @param  pixelIndex  pixel index to convert.
     *
     * @return physical position of the pixel.
     *
     * @throws PixelIndexOutOfRangeException
     *   if the pixel index is outside of [0, pixelCount).
     */
    public static double getPhysicalCoordinate(final double min,
                                               final double max,
                                               final int pixelCount,
                                               final int pixelIndex)
            throws PixelIndexOutOfRangeException {
        return getPhysicalCoordinate("axis", min, max, pixelCount, pixelIndex);
    }

    /**
     * @param  bounds          physical extent of the tile.
     * @param  tileShape       pixel dimensions of the tile.
     * @param  numberOfZPlanes number of z-planes in the tile's stack (the z "pixel" count).
     * @param  pixelX          x pixel index within the tile.
     * @param  pixelY          y pixel index within the tile.
     * @param  zPlane          ordinal position of the tile's z-plane in its stack.
     *
     * @return physical [x, y, z] position.  The z value is {@link Double#NaN} when the bounds have no z extent.
     *
     * @throws PixelIndexOutOfRangeException
     *   if any index is out of range for its axis.
     */
    public static double[] getPhysicalCoordinates(final PhysicalBounds bounds,
                                                  final TileShape tileShape,
                                                  final int numberOfZPlanes,
                                                  final int pixelX,
                                                  final int pixelY,
                                                  final int zPlane)
            throws PixelIndexOutOfRangeException {

        final double x = getPhysicalCoordinate(bounds, Coordinate.X, tileShape.getWidth(), pixelX);
        final double y = getPhysicalCoordinate(bounds, Coordinate.Y, tileShape.getHeight(), pixelY);

        final double z;
        if (bounds.hasZ()) {
            z = getPhysicalCoordinate(bounds, Coordinate.Z, numberOfZPlanes, zPlane);
        } else {
            z = Double.NaN;
        }

        return new double[] { x, y, z };
    }

    private static double getPhysicalCoordinate(final PhysicalBounds bounds,
                                                final Coordinate coordinate,
                                                final int pixelCount,
                                                final int pixelIndex)
            throws PixelIndexOutOfRangeException {

        final Double min = bounds.getMin(coordinate);
        final Double max = bounds.getMax(coordinate);
        if ((min == null) || (max == null)) {
            throw new IllegalArgumentException(coordinate + " range is not defined for bounds " + bounds);
        }

        return getPhysicalCoordinate(coordinate.name(), min, max, pixelCount, pixelIndex);
    }

    private static double getPhysicalCoordinate(final String axisName,
                                                final double min,
                                                final double max,
                                                final int pixelCount,
                                                final int pixelIndex)
            throws PixelIndexOutOfRangeException {

        if ((pixelIndex < 0) || (pixelIndex >= pixelCount)) {
            throw new PixelIndexOutOfRangeException(axisName, pixelIndex, pixelCount);
        }

        final double physicalCoordinate;
        if (pixelCount == 1) {
            physicalCoordinate = min;
        } else {
            physicalCoordinate = min + (((double) pixelIndex / (pixelCount - 1)) * (max - min));
        }

        return physicalCoordinate;
    }

}
