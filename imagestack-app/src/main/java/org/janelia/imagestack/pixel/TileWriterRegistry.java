package org.janelia.imagestack.pixel;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps each supported {@link TileFormat} to the {@link TileWriter} that encodes it.
 *
 * @author Eric Trautman
 */
public class TileWriterRegistry {

    private final Map<TileFormat, TileWriter> formatToWriterMap;

    public TileWriterRegistry() {
        this.formatToWriterMap = new EnumMap<>(TileFormat.class);
    }

    public TileWriterRegistry register(final TileFormat tileFormat,
                                       final TileWriter tileWriter) {
        formatToWriterMap.put(tileFormat, tileWriter);
        return this;
    }

    public boolean supports(final TileFormat tileFormat) {
        return formatToWriterMap.containsKey(tileFormat);
    }

    /**
     * @throws IllegalArgumentException
     *   if no writer has been registered for the specified format.
     */
    public TileWriter getWriter(final TileFormat tileFormat)
            throws IllegalArgumentException {
        final TileWriter tileWriter = formatToWriterMap.get(tileFormat);
        if (tileWriter == null) {
            throw new IllegalArgumentException("no writer registered for " + tileFormat +
                                               " tiles, supported formats are " + formatToWriterMap.keySet());
        }
        return tileWriter;
    }
}
