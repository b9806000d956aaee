package org.janelia.imagestack.pixel;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Encodes decoded pixels to a destination stream in one specific {@link TileFormat}.
 *
 * @author Eric Trautman
 */
@FunctionalInterface
public interface TileWriter {

    /**
     * Writes the pixels to the stream.  Implementations must not close the stream.
     *
     * @throws IOException
     *   if the pixels cannot be written.
     */
    void write(final OutputStream outputStream,
               final PixelArray pixels)
            throws IOException;

}
