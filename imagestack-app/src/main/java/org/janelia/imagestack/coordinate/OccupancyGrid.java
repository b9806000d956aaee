package org.janelia.imagestack.coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sparse (z-plane, y, x) grid of pixel cells for one round and channel,
 * where each occupied cell lists the feature table rows located at that pixel.
 * Only occupied cells are stored.  Cells are visited in z-plane, y, x order.
 *
 * @author Eric Trautman
 */
public class OccupancyGrid {

    private final TreeMap<Cell, List<Integer>> cellToRowsMap;

    public OccupancyGrid() {
        this.cellToRowsMap = new TreeMap<>();
    }

    public void addFeature(final int zPlane,
                           final int y,
                           final int x,
                           final int row) {
        cellToRowsMap.computeIfAbsent(new Cell(zPlane, y, x), c -> new ArrayList<>()).add(row);
    }

    public int getOccupiedCellCount() {
        return cellToRowsMap.size();
    }

    /**
     * @return occupied cells mapped to their feature rows, in z-plane, y, x order.
     */
    public Map<Cell, List<Integer>> getOccupiedCells() {
        return Collections.unmodifiableMap(cellToRowsMap);
    }

    /**
     * Location of one pixel within a stack.
     */
    public static class Cell
            implements Comparable<Cell> {

        private final int zPlane;
        private final int y;
        private final int x;

        public Cell(final int zPlane,
                    final int y,
                    final int x) {
            this.zPlane = zPlane;
            this.y = y;
            this.x = x;
        }

        public int getZPlane() {
            return zPlane;
        }

        public int getY() {
            return y;
        }

        public int getX() {
            return x;
        }

        @Override
        public int compareTo(final Cell that) {
            return COMPARATOR.compare(this, that);
        }

        @Override
        public boolean equals(final Object o) {
            boolean result = true;
            if (this != o) {
                if (o instanceof Cell) {
                    final Cell that = (Cell) o;
                    result = (this.zPlane == that.zPlane) && (this.y == that.y) && (this.x == that.x);
                } else {
                    result = false;
                }
            }
            return result;
        }

        @Override
        public int hashCode() {
            int result = zPlane;
            result = 31 * result + y;
            result = 31 * result + x;
            return result;
        }

        @Override
        public String toString() {
            return "(" + zPlane + ", " + y + ", " + x + ")";
        }

        private static final Comparator<Cell> COMPARATOR =
                Comparator.comparingInt(Cell::getZPlane)
                        .thenComparingInt(Cell::getY)
                        .thenComparingInt(Cell::getX);
    }
}
