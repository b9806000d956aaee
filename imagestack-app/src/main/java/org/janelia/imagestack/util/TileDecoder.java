package org.janelia.imagestack.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.janelia.imagestack.spec.Tile;
import org.janelia.imagestack.spec.TileCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes every tile in a collection using a pool of worker threads.
 * Each tile guards its own decode, so tiles that are already decoded (or being decoded elsewhere)
 * are not decoded again.
 *
 * @author Eric Trautman
 */
public class TileDecoder {

    private final int numberOfThreads;
    private final long decodeTimeoutMilliseconds;

    /**
     * @param  numberOfThreads            number of worker threads.
     * @param  decodeTimeoutMilliseconds  maximum time to wait for any single tile to be decoded.
     */
    public TileDecoder(final int numberOfThreads,
                       final long decodeTimeoutMilliseconds) {
        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("numberOfThreads must be positive");
        }
        if (decodeTimeoutMilliseconds < 1) {
            throw new IllegalArgumentException("decodeTimeoutMilliseconds must be positive");
        }
        this.numberOfThreads = numberOfThreads;
        this.decodeTimeoutMilliseconds = decodeTimeoutMilliseconds;
    }

    /**
     * Decodes all tiles in the collection, waiting for each one to finish.
     *
     * @throws IllegalStateException
     *   if any tile takes longer than the decode timeout.
     *
     * @throws RuntimeException
     *   the (unmodified) exception thrown by the first tile that failed to decode.
     *
     * @throws InterruptedException
     *   if the calling thread is interrupted while waiting.
     */
    public void decodeAll(final TileCollection tileCollection)
            throws IllegalStateException, InterruptedException {

        final List<Tile> tiles = new ArrayList<>(tileCollection.getTiles());

        LOG.info("decodeAll: entry, decoding {} tiles with {} threads", tiles.size(), numberOfThreads);

        final ExecutorService executorService = Executors.newFixedThreadPool(numberOfThreads);
        try {
            final List<Future<?>> futures = new ArrayList<>(tiles.size());
            for (final Tile tile : tiles) {
                futures.add(executorService.submit(tile::getPixels));
            }

            for (int i = 0; i < futures.size(); i++) {
                final Tile tile = tiles.get(i);
                try {
                    futures.get(i).get(decodeTimeoutMilliseconds, TimeUnit.MILLISECONDS);
                } catch (final TimeoutException e) {
                    throw new IllegalStateException("decode of tile " + tile.getKey() + " did not complete within " +
                                                    decodeTimeoutMilliseconds + " milliseconds", e);
                } catch (final ExecutionException e) {
                    final Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    } else if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    throw new IllegalStateException("failed to decode tile " + tile.getKey(), cause);
                }
            }

        } finally {
            executorService.shutdownNow();
        }

        LOG.info("decodeAll: exit, decoded {} tiles", tiles.size());
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileDecoder.class);
}
