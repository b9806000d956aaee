package org.janelia.imagestack.util;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.imagestack.pixel.TileFormat;
import org.janelia.imagestack.pixel.TileWriterRegistry;
import org.janelia.imagestack.spec.Tile;
import org.janelia.imagestack.spec.TileCollection;
import org.janelia.imagestack.spec.TileKey;
import org.janelia.imagestack.spec.TileSetManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link TileCollection} to disk as a JSON manifest plus one encoded file per tile.
 * Tile files are placed next to the manifest and are named
 * <pre>
 *     [manifest base name]-H[round]-C[channel]-Z[z-plane].[format extension]
 * </pre>
 * The SHA-256 of each written tile file is recorded in the manifest,
 * and the collection's processing log is stored in the manifest's stack extras.
 *
 * @author Eric Trautman
 */
public class TileSetExporter {

    private final TileWriterRegistry writerRegistry;
    private final TileFormat tileFormat;

    /**
     * @throws IllegalArgumentException
     *   if the registry does not have a writer for the specified format.
     */
    public TileSetExporter(final TileWriterRegistry writerRegistry,
                           final TileFormat tileFormat)
            throws IllegalArgumentException {
        if (! writerRegistry.supports(tileFormat)) {
            throw new IllegalArgumentException("no writer registered for " + tileFormat + " tiles");
        }
        this.writerRegistry = writerRegistry;
        this.tileFormat = tileFormat;
    }

    /**
     * Decodes (as needed) and writes every tile in the collection followed by the collection's manifest.
     *
     * @param  tileCollection  collection to export.
     * @param  manifestPath    path of the manifest file ('.json' is appended if it is missing).
     *
     * @return the written manifest.
     *
     * @throws IOException
     *   if any file cannot be written.
     */
    public TileSetManifest export(final TileCollection tileCollection,
                                  final String manifestPath)
            throws IOException {

        final String jsonPath = manifestPath.endsWith(".json") ? manifestPath : manifestPath + ".json";
        final File manifestFile = new File(jsonPath).getAbsoluteFile();
        final File directory = manifestFile.getParentFile();
        FileUtil.ensureWritableDirectory(directory);

        final String manifestName = manifestFile.getName();
        final String baseName = manifestName.substring(0, manifestName.length() - ".json".length());

        final Collection<Tile> tiles = tileCollection.getTiles();

        LOG.info("export: entry, writing {} {} tiles to {}", tiles.size(), tileFormat, directory);

        final Map<String, Object> stackExtras = new LinkedHashMap<>(tileCollection.getExtras());
        stackExtras.put(TileCollection.PROCESSING_EXTRAS_KEY,
                        Collections.singletonMap(TileCollection.LOG_KEY, tileCollection.getLog()));

        final TileSetManifest manifest = new TileSetManifest(tileCollection.getAxisSizes(),
                                                             null,
                                                             stackExtras);
        for (final Tile tile : tiles) {
            final String tileFileName = getTileFileName(baseName, tile.getKey(), tileFormat);
            final File tileFile = new File(directory, tileFileName);
            final String sha256 = writeTile(tile, tileFile);
            manifest.addTile(new TileSetManifest.TileEntry(tile.getKey(),
                                                           tile.getBounds(),
                                                           tile.getTileShape(),
                                                           tileFileName,
                                                           tileFormat,
                                                           sha256,
                                                           tile.getExtras()));
        }

        FileUtil.saveJsonFile(manifestFile.getPath(), manifest);

        LOG.info("export: exit, wrote manifest {}", manifestFile);

        return manifest;
    }

    public static String getTileFileName(final String baseName,
                                         final TileKey key,
                                         final TileFormat tileFormat) {
        return baseName + "-H" + key.getRound() + "-C" + key.getChannel() + "-Z" + key.getZPlane() + "." +
               tileFormat.getFileExtension();
    }

    private String writeTile(final Tile tile,
                             final File tileFile)
            throws IOException {

        final MessageDigest messageDigest;
        try {
            messageDigest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("failed to create SHA-256 message digest for tile files", e);
        }

        try (final OutputStream outputStream =
                     new DigestOutputStream(new BufferedOutputStream(new FileOutputStream(tileFile)),
                                            messageDigest)) {
            tile.write(outputStream, tileFormat, writerRegistry);
        } catch (final IOException e) {
            throw new IOException("failed to write tile " + tile.getKey() + " to " + tileFile, e);
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("writeTile: wrote {}", tileFile);
        }

        // zero padded hex string that matches output generated by tools like sha256sum
        return String.format("%064x", new BigInteger(1, messageDigest.digest()));
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileSetExporter.class);
}
