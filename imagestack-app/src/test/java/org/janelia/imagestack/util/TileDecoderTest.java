package org.janelia.imagestack.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.janelia.imagestack.pixel.PixelArray;
import org.janelia.imagestack.spec.PhysicalBounds;
import org.janelia.imagestack.spec.Tile;
import org.janelia.imagestack.spec.TileCollection;
import org.janelia.imagestack.spec.TileKey;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link TileDecoder} class.
 *
 * @author Eric Trautman
 */
public class TileDecoderTest {

    @Test
    public void testDecodeAll() throws Exception {

        final AtomicInteger loadCount = new AtomicInteger(0);
        final List<Tile> tiles = new ArrayList<>();
        for (int channel = 0; channel < 6; channel++) {
            final Tile tile = buildTile(channel);
            tile.setPixelLoader(() -> {
                loadCount.incrementAndGet();
                return new PixelArray(4, 4);
            });
            tiles.add(tile);
        }
        final TileCollection tileCollection = new TileCollection(tiles, null);

        final TileDecoder decoder = new TileDecoder(3, 10000);
        decoder.decodeAll(tileCollection);

        Assert.assertEquals("every tile should be decoded once", 6, loadCount.get());
        for (final Tile tile : tiles) {
            Assert.assertEquals("invalid state for " + tile.getKey(), Tile.PayloadState.DECODED, tile.getPayloadState());
        }

        decoder.decodeAll(tileCollection);
        Assert.assertEquals("decoded tiles should not be decoded again", 6, loadCount.get());
    }

    @Test
    public void testTimeout() throws Exception {

        final CountDownLatch releaseLatch = new CountDownLatch(1);
        final Tile tile = buildTile(0);
        tile.setPixelLoader(() -> {
            try {
                releaseLatch.await();
            } catch (final InterruptedException e) {
                throw new IllegalStateException("interrupted", e);
            }
            return new PixelArray(4, 4);
        });

        final List<Tile> tiles = new ArrayList<>();
        tiles.add(tile);

        try {
            new TileDecoder(1, 50).decodeAll(new TileCollection(tiles, null));
            Assert.fail("slow decode should cause exception");
        } catch (final IllegalStateException e) {
            Assert.assertTrue("message should identify tile " + e.getMessage(),
                              e.getMessage().contains(tile.getKey().toString()));
        } finally {
            releaseLatch.countDown();
        }
    }

    @Test
    public void testFailureIsPropagated() throws Exception {

        final IllegalArgumentException loaderException = new IllegalArgumentException("corrupt tile");
        final Tile tile = buildTile(0);
        tile.setPixelLoader(() -> {
            throw loaderException;
        });

        final List<Tile> tiles = new ArrayList<>();
        tiles.add(tile);

        try {
            new TileDecoder(2, 10000).decodeAll(new TileCollection(tiles, null));
            Assert.fail("loader failure should be propagated");
        } catch (final IllegalArgumentException e) {
            Assert.assertSame("loader exception should not be wrapped", loaderException, e);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTimeout() {
        new TileDecoder(1, 0);
    }

    private static Tile buildTile(final int channel) {
        return new Tile(new TileKey(0, channel, 0), new PhysicalBounds(0.0, 10.0, 0.0, 10.0));
    }
}
