package org.janelia.imagestack.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;

import org.janelia.imagestack.spec.TileCollection;
import org.janelia.imagestack.spec.TileSetManifest;
import org.janelia.imagestack.util.FileUtil;

/**
 * Parameters for identifying a tile set manifest.
 *
 * @author Eric Trautman
 */
public class TileSetParameters implements Serializable {

    @Parameter(
            names = "--tileSet",
            description = "Tile set manifest JSON file (.json or .gz)",
            required = true)
    public String tileSet;

    /**
     * @return collection described by the manifest.  Tiles are not given pixel loaders,
     *         so the manifest must include the shape of each tile (or a default tile shape).
     *
     * @throws IOException
     *   if the manifest cannot be read.
     */
    public TileCollection loadTileCollection()
            throws IOException {

        final File manifestFile = new File(tileSet).getAbsoluteFile();
        final TileSetManifest manifest;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(manifestFile.getPath())) {
            manifest = TileSetManifest.fromJson(reader);
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to parse " + manifestFile, e);
        }

        return TileCollection.fromManifest(manifest, manifestFile.getParentFile(), null);
    }
}
