package org.janelia.imagestack.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.List;

import org.janelia.imagestack.client.parameter.CommandLineParameters;
import org.janelia.imagestack.client.parameter.TileSetParameters;
import org.janelia.imagestack.coordinate.AnnotatedFeature;
import org.janelia.imagestack.coordinate.FeatureCoordinateAnnotator;
import org.janelia.imagestack.coordinate.FeatureTable;
import org.janelia.imagestack.coordinate.PhysicalCoordinateTable;
import org.janelia.imagestack.spec.TileCollection;
import org.janelia.imagestack.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for resolving the physical coordinates of detected features.
 * Features are read from a JSON array and written back out with their physical x, y, z values
 * and a flag indicating whether a tile was found for each feature.
 *
 * @author Eric Trautman
 */
public class AnnotateFeaturesClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public TileSetParameters tileSet = new TileSetParameters();

        @Parameter(
                names = "--features",
                description = "JSON file containing an array of features (.json or .gz)",
                required = true)
        public String features;

        @Parameter(
                names = "--toJson",
                description = "JSON file where annotated features are to be stored (.json or .gz)",
                required = true)
        public String toJson;

        @Parameter(
                names = "--numberOfThreads",
                description = "Number of threads to use for annotation")
        public int numberOfThreads = 1;

        public void validateInputAndOutput() throws IllegalArgumentException {

            File file = new File(features).getAbsoluteFile();
            if (! file.canRead()) {
                throw new IllegalArgumentException("--features " + file.getAbsolutePath() + " must be readable");
            }

            file = new File(toJson).getAbsoluteFile();
            if (! file.exists()) {
                file = file.getParentFile();
            }
            if (! file.canWrite()) {
                throw new IllegalArgumentException("--toJson " + file.getAbsolutePath() + " must be writeable");
            }

            if (numberOfThreads < 1) {
                throw new IllegalArgumentException("--numberOfThreads must be positive");
            }
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args, AnnotateFeaturesClient.class);
                parameters.validateInputAndOutput();

                LOG.info("runClient: entry, parameters={}", parameters);

                final AnnotateFeaturesClient client = new AnnotateFeaturesClient(parameters);
                client.annotateAndSave();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public AnnotateFeaturesClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public List<AnnotatedFeature> annotate()
            throws IOException, InterruptedException {

        final TileCollection tileCollection = parameters.tileSet.loadTileCollection();
        final FeatureTable featureTable = loadFeatureTable(parameters.features);

        final FeatureCoordinateAnnotator annotator = new FeatureCoordinateAnnotator(tileCollection,
                                                                                    parameters.numberOfThreads);
        final PhysicalCoordinateTable coordinateTable = annotator.annotate(featureTable);

        final List<Integer> missingRows = coordinateTable.getMissingRows();
        if (missingRows.size() > 0) {
            LOG.warn("annotate: no tile found for feature rows {}", missingRows);
        }

        return coordinateTable.toAnnotatedFeatures(featureTable);
    }

    public void annotateAndSave()
            throws IOException, InterruptedException {
        FileUtil.saveJsonFile(parameters.toJson, annotate());
    }

    static FeatureTable loadFeatureTable(final String path)
            throws IOException {

        final FeatureTable featureTable;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path)) {
            featureTable = FeatureTable.fromJson(reader);
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to parse " + path, e);
        }

        LOG.info("loadFeatureTable: loaded {} features from {}", featureTable.size(), path);

        return featureTable;
    }

    private static final Logger LOG = LoggerFactory.getLogger(AnnotateFeaturesClient.class);
}
