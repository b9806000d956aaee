package org.janelia.imagestack.coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.imagestack.spec.Axis;
import org.janelia.imagestack.spec.Tile;
import org.janelia.imagestack.spec.TileCollection;
import org.janelia.imagestack.spec.TileShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the physical position of every feature in a {@link FeatureTable} using the bounds and shape
 * of the tile that owns each feature.
 *
 * Features are processed in (round, channel) groups.  Each group's occupied grid cells are scanned
 * in z-plane, y, x order and every row in a cell is resolved against the tile for
 * (round, channel, z-plane).  Once a row has been resolved it is never overwritten.
 * A z-plane's physical position is interpolated by its ordinal position among the stack's sorted z-plane labels.
 *
 * Rows whose tile cannot be found keep zero coordinates, are flagged as not found in the result,
 * and are logged.
 *
 * @author Eric Trautman
 */
public class FeatureCoordinateAnnotator {

    private final TileCollection tileCollection;
    private final int numberOfThreads;

    public FeatureCoordinateAnnotator(final TileCollection tileCollection) {
        this(tileCollection, 1);
    }

    /**
     * @param  tileCollection   tiles that own the features.
     * @param  numberOfThreads  number of threads used to process (round, channel) groups.
     */
    public FeatureCoordinateAnnotator(final TileCollection tileCollection,
                                      final int numberOfThreads) {
        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("numberOfThreads must be positive");
        }
        this.tileCollection = tileCollection;
        this.numberOfThreads = numberOfThreads;
    }

    /**
     * @return physical coordinates for every row in the feature table.
     *
     * @throws PixelIndexOutOfRangeException
     *   if any feature lies outside of its tile.
     *
     * @throws InterruptedException
     *   if the calling thread is interrupted while waiting for worker threads.
     */
    public PhysicalCoordinateTable annotate(final FeatureTable featureTable)
            throws PixelIndexOutOfRangeException, InterruptedException {

        final PhysicalCoordinateTable coordinateTable = new PhysicalCoordinateTable(featureTable.size());
        final List<FeatureGroup> groups = featureTable.groupByRoundAndChannel();
        final SortedSet<Integer> zPlaneLabels = tileCollection.getAxisLabels(Axis.ZPLANE);

        LOG.info("annotate: entry, resolving {} features in {} groups with {} thread(s)",
                 featureTable.size(), groups.size(), numberOfThreads);

        if ((numberOfThreads > 1) && (groups.size() > 1)) {
            annotateInParallel(groups, zPlaneLabels, coordinateTable);
        } else {
            for (final FeatureGroup group : groups) {
                annotateGroup(group, zPlaneLabels, coordinateTable);
            }
        }

        final int missingCount = coordinateTable.size() - coordinateTable.getFoundCount();
        if (missingCount > 0) {
            LOG.warn("annotate: {} of {} features have no matching tile and were left with zero coordinates",
                     missingCount, coordinateTable.size());
        }

        LOG.info("annotate: exit, resolved {} of {} features",
                 coordinateTable.getFoundCount(), coordinateTable.size());

        return coordinateTable;
    }

    private void annotateInParallel(final List<FeatureGroup> groups,
                                    final SortedSet<Integer> zPlaneLabels,
                                    final PhysicalCoordinateTable coordinateTable)
            throws InterruptedException {

        final ExecutorService executorService = Executors.newFixedThreadPool(numberOfThreads);
        try {
            final List<Future<?>> futures = new ArrayList<>(groups.size());
            for (final FeatureGroup group : groups) {
                // each feature belongs to exactly one group, so tasks write disjoint rows
                futures.add(executorService.submit(() -> annotateGroup(group, zPlaneLabels, coordinateTable)));
            }
            for (final Future<?> future : futures) {
                try {
                    future.get();
                } catch (final ExecutionException e) {
                    final Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    } else if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    throw new IllegalStateException("failed to annotate feature group", cause);
                }
            }
        } finally {
            executorService.shutdownNow();
        }
    }

    private void annotateGroup(final FeatureGroup group,
                               final SortedSet<Integer> zPlaneLabels,
                               final PhysicalCoordinateTable coordinateTable)
            throws PixelIndexOutOfRangeException {

        int missingRowCount = 0;

        for (final Map.Entry<OccupancyGrid.Cell, List<Integer>> entry : group.getGrid().getOccupiedCells().entrySet()) {

            final OccupancyGrid.Cell cell = entry.getKey();
            final List<Integer> rows = entry.getValue();

            final Tile tile = tileCollection.getTile(group.getRound(), group.getChannel(), cell.getZPlane());
            if (tile == null) {
                missingRowCount += rows.size();
                continue;
            }

            final TileShape tileShape = tile.inferTileShape();
            final double[] physicalCoordinates =
                    PhysicalCoordinateCalculator.getPhysicalCoordinates(tile.getBounds(),
                                                                        tileShape,
                                                                        zPlaneLabels.size(),
                                                                        cell.getX(),
                                                                        cell.getY(),
                                                                        zPlaneLabels.headSet(cell.getZPlane()).size());
            for (final Integer row : rows) {
                if (! coordinateTable.isFound(row)) {
                    coordinateTable.set(row, physicalCoordinates);
                }
            }
        }

        if (missingRowCount > 0) {
            LOG.warn("annotateGroup: no tile found for {} feature(s) in group {}", missingRowCount, group);
        } else if (LOG.isDebugEnabled()) {
            LOG.debug("annotateGroup: resolved all features in group {}", group);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FeatureCoordinateAnnotator.class);
}
