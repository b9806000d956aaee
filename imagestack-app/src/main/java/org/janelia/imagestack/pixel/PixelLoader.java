package org.janelia.imagestack.pixel;

/**
 * Zero argument producer of a tile's decoded pixels.
 * Implementations typically read and decode a file, so calls may be expensive.
 * Any exception thrown by {@link #load} is propagated unmodified to callers of the owning tile.
 *
 * @author Eric Trautman
 */
@FunctionalInterface
public interface PixelLoader {

    PixelArray load();

}
