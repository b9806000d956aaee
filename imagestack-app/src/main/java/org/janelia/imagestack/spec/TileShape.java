package org.janelia.imagestack.spec;

import java.io.Serializable;

/**
 * Pixel dimensions (height, width) of a tile.
 *
 * @author Eric Trautman
 */
public class TileShape
        implements Serializable {

    private final int height;
    private final int width;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TileShape() {
        this.height = 0;
        this.width = 0;
    }

    public TileShape(final int height,
                     final int width) {
        this.height = height;
        this.width = width;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    @Override
    public boolean equals(final Object o) {
        boolean result = true;
        if (this != o) {
            if (o instanceof TileShape) {
                final TileShape that = (TileShape) o;
                result = (this.height == that.height) && (this.width == that.width);
            } else {
                result = false;
            }
        }
        return result;
    }

    @Override
    public int hashCode() {
        return 31 * height + width;
    }

    @Override
    public String toString() {
        return "(" + height + ", " + width + ")";
    }
}
