package org.janelia.imagestack.spec;

/**
 * Index axes used to address tiles within a stack.
 *
 * @author Eric Trautman
 */
public enum Axis {

    ROUND("r"),
    CHANNEL("c"),
    ZPLANE("z");

    private final String label;

    Axis(final String label) {
        this.label = label;
    }

    /**
     * @return short label used for this axis in manifests and metadata tables.
     */
    public String getLabel() {
        return label;
    }

    /**
     * @throws IllegalArgumentException
     *   if the label does not identify an axis.
     */
    public static Axis fromLabel(final String label)
            throws IllegalArgumentException {
        for (final Axis axis : values()) {
            if (axis.label.equals(label)) {
                return axis;
            }
        }
        throw new IllegalArgumentException("unknown axis label '" + label + "'");
    }
}
