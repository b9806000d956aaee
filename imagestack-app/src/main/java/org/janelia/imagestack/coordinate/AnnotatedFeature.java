package org.janelia.imagestack.coordinate;

import java.io.Serializable;

/**
 * A feature along with its resolved physical position.
 * When no tile was found for the feature, the physical values are zero and found is false.
 *
 * @author Eric Trautman
 */
public class AnnotatedFeature
        implements Serializable {

    private final Feature feature;
    private final double physicalX;
    private final double physicalY;
    private final double physicalZ;
    private final boolean found;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private AnnotatedFeature() {
        this(null, 0, 0, 0, false);
    }

    public AnnotatedFeature(final Feature feature,
                            final double physicalX,
                            final double physicalY,
                            final double physicalZ,
                            final boolean found) {
        this.feature = feature;
        this.physicalX = physicalX;
        this.physicalY = physicalY;
        this.physicalZ = physicalZ;
        this.found = found;
    }

    public Feature getFeature() {
        return feature;
    }

    public double getPhysicalX() {
        return physicalX;
    }

    public double getPhysicalY() {
        return physicalY;
    }

    public double getPhysicalZ() {
        return physicalZ;
    }

    public boolean isFound() {
        return found;
    }
}
