package org.janelia.imagestack.pixel;

/**
 * Builds loaders for tile files referenced by a tile set manifest.
 * Decoding of the on-disk format is entirely up to the implementation.
 *
 * @author Eric Trautman
 */
@FunctionalInterface
public interface PixelLoaderFactory {

    /**
     * @param  path        absolute path of the tile file.
     * @param  tileFormat  format of the tile file.
     *
     * @return a loader that decodes the specified file when it is invoked.
     *
     * @throws IllegalArgumentException
     *   if the format is not supported.
     */
    PixelLoader build(final String path,
                      final TileFormat tileFormat)
            throws IllegalArgumentException;

}
