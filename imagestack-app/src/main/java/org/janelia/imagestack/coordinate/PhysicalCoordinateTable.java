package org.janelia.imagestack.coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Physical x, y, and z columns for a feature table, keyed by the table's row indexes.
 * All values start at zero.  Rows without a matching tile keep the zero values and
 * are reported as not found.  A found row whose tile has no z range has a z value of
 * {@link Double#NaN}, so z should be checked with {@link Double#isNaN} rather than compared to zero.
 *
 * Concurrent writers are safe as long as each writer owns a disjoint set of rows.
 *
 * @author Eric Trautman
 */
public class PhysicalCoordinateTable {

    private final double[] x;
    private final double[] y;
    private final double[] z;
    private final boolean[] found;

    public PhysicalCoordinateTable(final int numberOfRows) {
        this.x = new double[numberOfRows];
        this.y = new double[numberOfRows];
        this.z = new double[numberOfRows];
        this.found = new boolean[numberOfRows];
    }

    public int size() {
        return found.length;
    }

    public void set(final int row,
                    final double[] physicalCoordinates) {
        x[row] = physicalCoordinates[0];
        y[row] = physicalCoordinates[1];
        z[row] = physicalCoordinates[2];
        found[row] = true;
    }

    public double getX(final int row) {
        return x[row];
    }

    public double getY(final int row) {
        return y[row];
    }

    public double getZ(final int row) {
        return z[row];
    }

    public boolean isFound(final int row) {
        return found[row];
    }

    public int getFoundCount() {
        int count = 0;
        for (final boolean rowFound : found) {
            if (rowFound) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return indexes of rows that were not matched to a tile.
     */
    public List<Integer> getMissingRows() {
        final List<Integer> missingRows = new ArrayList<>();
        for (int row = 0; row < found.length; row++) {
            if (! found[row]) {
                missingRows.add(row);
            }
        }
        return missingRows;
    }

    /**
     * @return each feature in the table combined with its physical coordinates.
     *
     * @throws IllegalArgumentException
     *   if the feature table size differs from this table's size.
     */
    public List<AnnotatedFeature> toAnnotatedFeatures(final FeatureTable featureTable)
            throws IllegalArgumentException {

        if (featureTable.size() != size()) {
            throw new IllegalArgumentException("feature table has " + featureTable.size() +
                                               " rows but coordinate table has " + size() + " rows");
        }

        final List<AnnotatedFeature> annotatedFeatures = new ArrayList<>(size());
        for (int row = 0; row < size(); row++) {
            annotatedFeatures.add(new AnnotatedFeature(featureTable.getFeature(row),
                                                       x[row], y[row], z[row], found[row]));
        }
        return annotatedFeatures;
    }
}
