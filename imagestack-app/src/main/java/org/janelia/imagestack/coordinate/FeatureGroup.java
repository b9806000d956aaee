package org.janelia.imagestack.coordinate;

/**
 * Features that share a round and channel, located on an occupancy grid.
 *
 * @author Eric Trautman
 */
public class FeatureGroup {

    private final int round;
    private final int channel;
    private final OccupancyGrid grid;

    public FeatureGroup(final int round,
                        final int channel) {
        this.round = round;
        this.channel = channel;
        this.grid = new OccupancyGrid();
    }

    public int getRound() {
        return round;
    }

    public int getChannel() {
        return channel;
    }

    public OccupancyGrid getGrid() {
        return grid;
    }

    @Override
    public String toString() {
        return "{r: " + round + ", c: " + channel + ", occupiedCellCount: " + grid.getOccupiedCellCount() + '}';
    }
}
