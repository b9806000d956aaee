package org.janelia.imagestack.pixel;

import org.janelia.imagestack.spec.TileShape;

/**
 * Thrown when decoded or assigned pixels do not have a tile's previously known shape.
 * The tile's metadata and payload are inconsistent, so retrying will not help.
 *
 * @author Eric Trautman
 */
public class TileShapeMismatchException
        extends IllegalStateException {

    private final TileShape expectedShape;
    private final TileShape actualShape;

    public TileShapeMismatchException(final String context,
                                      final TileShape expectedShape,
                                      final TileShape actualShape) {
        super(context + " has shape " + actualShape + " but tile shape is " + expectedShape);
        this.expectedShape = expectedShape;
        this.actualShape = actualShape;
    }

    public TileShape getExpectedShape() {
        return expectedShape;
    }

    public TileShape getActualShape() {
        return actualShape;
    }
}
