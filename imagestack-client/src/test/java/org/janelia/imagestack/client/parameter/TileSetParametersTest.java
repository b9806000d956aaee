package org.janelia.imagestack.client.parameter;

import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.nio.file.Files;

import org.janelia.imagestack.spec.PhysicalBounds;
import org.janelia.imagestack.spec.TileCollection;
import org.janelia.imagestack.spec.TileKey;
import org.janelia.imagestack.spec.TileSetManifest;
import org.janelia.imagestack.spec.TileShape;
import org.janelia.imagestack.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link TileSetParameters} class.
 *
 * @author Eric Trautman
 */
public class TileSetParametersTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = Files.createTempDirectory("imagestack-parameters-test").toFile();
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testLoadCompressedManifest() throws Exception {

        final TileSetManifest manifest = new TileSetManifest(null, new TileShape(8, 9), null);
        manifest.addTile(new TileSetManifest.TileEntry(new TileKey(2, 1, 0),
                                                       new PhysicalBounds(0.0, 1.0, 0.0, 1.0),
                                                       null,
                                                       null,
                                                       null,
                                                       null,
                                                       null));

        final File manifestFile = new File(testDirectory, "fov.json.gz");
        FileUtil.saveJsonFile(manifestFile.getPath(), manifest);

        final CommandLineParametersWithTileSet parameters = new CommandLineParametersWithTileSet();
        Assert.assertTrue("arguments should be parsed",
                          parameters.parse(new String[] { "--tileSet", manifestFile.getPath() },
                                           TileSetParametersTest.class,
                                           false));

        final TileCollection tileCollection = parameters.tileSet.loadTileCollection();

        Assert.assertEquals("invalid number of tiles", 1, tileCollection.size());
        Assert.assertEquals("default tile shape should be applied",
                            new TileShape(8, 9), tileCollection.getTile(2, 1, 0).getTileShape());
        Assert.assertTrue("parameters should be rendered as JSON " + parameters,
                          parameters.toString().contains(manifestFile.getName()));
    }

    public static class CommandLineParametersWithTileSet extends CommandLineParameters {
        @ParametersDelegate
        public TileSetParameters tileSet = new TileSetParameters();
    }
}
