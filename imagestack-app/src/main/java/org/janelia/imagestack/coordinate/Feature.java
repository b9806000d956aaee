package org.janelia.imagestack.coordinate;

import java.io.Serializable;

/**
 * A detected signal location recorded in the pixel space of one tile.
 *
 * @author Eric Trautman
 */
public class Feature
        implements Serializable {

    private final int x;
    private final int y;
    private final int z;
    private final int round;
    private final int channel;
    private final String target;
    private final Double radius;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private Feature() {
        this(0, 0, 0, 0, 0, null, null);
    }

    /**
     * @param  x        x pixel index within the owning tile.
     * @param  y        y pixel index within the owning tile.
     * @param  z        z-plane index of the owning tile.
     * @param  round    round index of the owning tile.
     * @param  channel  channel index of the owning tile.
     * @param  target   (optional) decoded target label.
     * @param  radius   (optional) feature radius in pixels.
     */
    public Feature(final int x,
                   final int y,
                   final int z,
                   final int round,
                   final int channel,
                   final String target,
                   final Double radius) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.round = round;
        this.channel = channel;
        this.target = target;
        this.radius = radius;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getZ() {
        return z;
    }

    public int getRound() {
        return round;
    }

    public int getChannel() {
        return channel;
    }

    public String getTarget() {
        return target;
    }

    public Double getRadius() {
        return radius;
    }

    @Override
    public String toString() {
        return "{x: " + x + ", y: " + y + ", z: " + z + ", r: " + round + ", c: " + channel +
               ", target: " + target + '}';
    }
}
