package org.janelia.imagestack.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.io.Serializable;
import java.util.List;
import java.util.Map;

import org.janelia.imagestack.client.parameter.CommandLineParameters;
import org.janelia.imagestack.client.parameter.TileSetParameters;
import org.janelia.imagestack.spec.Axis;
import org.janelia.imagestack.spec.TileCollection;
import org.janelia.imagestack.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for summarizing the tiles in a tile set manifest:
 * axis sizes, whether the tiles are aligned, and one metadata row per tile.
 *
 * @author Eric Trautman
 */
public class TileMetadataClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public TileSetParameters tileSet = new TileSetParameters();

        @Parameter(
                names = "--toJson",
                description = "JSON file where the summary is to be stored (.json or .gz)",
                required = true)
        public String toJson;
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args, TileMetadataClient.class);

                LOG.info("runClient: entry, parameters={}", parameters);

                final TileMetadataClient client = new TileMetadataClient(parameters);
                FileUtil.saveJsonFile(parameters.toJson, client.buildSummary());
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public TileMetadataClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public TileSetSummary buildSummary()
            throws IOException {
        final TileCollection tileCollection = parameters.tileSet.loadTileCollection();
        return new TileSetSummary(tileCollection.getAxisSizes(),
                                  tileCollection.areTilesAligned(),
                                  tileCollection.getTileMetadata());
    }

    /**
     * Summary data written by this client.
     */
    public static class TileSetSummary implements Serializable {

        private final Map<Axis, Integer> axisSizes;
        private final boolean tilesAligned;
        private final List<Map<String, Object>> tiles;

        public TileSetSummary(final Map<Axis, Integer> axisSizes,
                              final boolean tilesAligned,
                              final List<Map<String, Object>> tiles) {
            this.axisSizes = axisSizes;
            this.tilesAligned = tilesAligned;
            this.tiles = tiles;
        }

        public Map<Axis, Integer> getAxisSizes() {
            return axisSizes;
        }

        public boolean isTilesAligned() {
            return tilesAligned;
        }

        public List<Map<String, Object>> getTiles() {
            return tiles;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileMetadataClient.class);
}
