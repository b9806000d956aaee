package org.janelia.imagestack.client;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;

import org.janelia.imagestack.spec.Axis;
import org.janelia.imagestack.spec.TileCollection;
import org.janelia.imagestack.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link TileMetadataClient} class.
 *
 * @author Eric Trautman
 */
public class TileMetadataClientTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = Files.createTempDirectory("imagestack-metadata-test").toFile();
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testBuildSummary() throws Exception {

        final File manifestFile = new File(testDirectory, "fov.json");
        FileUtil.saveJsonFile(manifestFile.getPath(), AnnotateFeaturesClientTest.buildManifest());

        final TileMetadataClient.Parameters parameters = new TileMetadataClient.Parameters();
        parameters.tileSet.tileSet = manifestFile.getPath();
        parameters.toJson = new File(testDirectory, "summary.json").getPath();

        final TileMetadataClient.TileSetSummary summary = new TileMetadataClient(parameters).buildSummary();

        Assert.assertEquals("invalid round count", Integer.valueOf(1), summary.getAxisSizes().get(Axis.ROUND));
        Assert.assertEquals("invalid channel count", Integer.valueOf(2), summary.getAxisSizes().get(Axis.CHANNEL));
        Assert.assertEquals("invalid z-plane count", Integer.valueOf(2), summary.getAxisSizes().get(Axis.ZPLANE));
        Assert.assertFalse("tiles with different x offsets should not be aligned", summary.isTilesAligned());
        Assert.assertEquals("invalid number of rows", 3, summary.getTiles().size());

        final Map<String, Object> lastRow = summary.getTiles().get(2);
        Assert.assertEquals("invalid z", 1, lastRow.get("z"));
        // ((z * numRounds) + r) * numChannels + c = ((1 * 1) + 0) * 2 + 0
        Assert.assertEquals("invalid barcode index", 2, lastRow.get(TileCollection.BARCODE_INDEX_KEY));
    }

    @Test(expected = IOException.class)
    public void testInvalidManifest() throws Exception {

        final File manifestFile = new File(testDirectory, "broken.json");
        Files.write(manifestFile.toPath(), "{ \"tiles\": [".getBytes("UTF-8"));

        final TileMetadataClient.Parameters parameters = new TileMetadataClient.Parameters();
        parameters.tileSet.tileSet = manifestFile.getPath();

        new TileMetadataClient(parameters).buildSummary();
    }
}
