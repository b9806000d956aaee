package org.janelia.imagestack.pixel;

/**
 * Thrown when pixels are requested from a tile that has neither a loader nor decoded pixels.
 *
 * @author Eric Trautman
 */
public class MissingPixelDataException
        extends IllegalStateException {

    public MissingPixelDataException(final String message) {
        super(message);
    }
}
