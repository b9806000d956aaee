package org.janelia.imagestack.spec;

import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.imagestack.json.JsonUtils;
import org.janelia.imagestack.pixel.TileFormat;

/**
 * JSON description of a stack's tiles: index, physical extent, shape, and (optionally) the file holding
 * each tile's encoded pixels.
 *
 * @author Eric Trautman
 */
public class TileSetManifest
        implements Serializable {

    public static final String CURRENT_VERSION = "0.1.0";

    private final String version;
    private final Map<Axis, Integer> shape;
    private final TileShape defaultTileShape;
    private final Map<String, Object> extras;
    private final List<TileEntry> tiles;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TileSetManifest() {
        this(null, null, null);
    }

    public TileSetManifest(final Map<Axis, Integer> shape,
                           final TileShape defaultTileShape,
                           final Map<String, Object> extras) {
        this.version = CURRENT_VERSION;
        this.shape = shape == null ? new EnumMap<>(Axis.class) : new EnumMap<>(shape);
        this.defaultTileShape = defaultTileShape;
        this.extras = extras == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extras);
        this.tiles = new ArrayList<>();
    }

    public String getVersion() {
        return version;
    }

    public Map<Axis, Integer> getShape() {
        return shape;
    }

    public TileShape getDefaultTileShape() {
        return defaultTileShape;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    public List<TileEntry> getTiles() {
        return tiles;
    }

    public void addTile(final TileEntry tileEntry) {
        tiles.add(tileEntry);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static TileSetManifest fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    public static TileSetManifest fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<TileSetManifest> JSON_HELPER =
            new JsonUtils.Helper<>(TileSetManifest.class);

    /**
     * Manifest data for one tile.
     */
    public static class TileEntry
            implements Serializable {

        private final TileKey indices;
        private final PhysicalBounds coordinates;
        private final TileShape tileShape;
        private final String file;
        private final TileFormat tileFormat;
        private final String sha256;
        private final Map<String, Object> extras;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private TileEntry() {
            this(null, null, null, null, null, null, null);
        }

        public TileEntry(final TileKey indices,
                         final PhysicalBounds coordinates,
                         final TileShape tileShape,
                         final String file,
                         final TileFormat tileFormat,
                         final String sha256,
                         final Map<String, Object> extras) {
            this.indices = indices;
            this.coordinates = coordinates;
            this.tileShape = tileShape;
            this.file = file;
            this.tileFormat = tileFormat;
            this.sha256 = sha256;
            this.extras = extras;
        }

        public TileKey getKey() {
            return indices;
        }

        public PhysicalBounds getBounds() {
            return coordinates;
        }

        public TileShape getTileShape() {
            return tileShape;
        }

        public String getFile() {
            return file;
        }

        public TileFormat getTileFormat() {
            return tileFormat;
        }

        public String getSha256() {
            return sha256;
        }

        public Map<String, Object> getExtras() {
            return extras == null ? Collections.emptyMap() : extras;
        }
    }
}
