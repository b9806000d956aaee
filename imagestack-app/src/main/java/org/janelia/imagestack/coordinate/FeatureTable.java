package org.janelia.imagestack.coordinate;

import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.janelia.imagestack.json.JsonUtils;

/**
 * Row indexed table of detected features.  A feature's row index is its position in the table.
 *
 * @author Eric Trautman
 */
public class FeatureTable {

    private final List<Feature> features;

    public FeatureTable(final List<Feature> features) {
        this.features = new ArrayList<>(features);
    }

    public int size() {
        return features.size();
    }

    public Feature getFeature(final int row) {
        return features.get(row);
    }

    public List<Feature> getFeatures() {
        return Collections.unmodifiableList(features);
    }

    /**
     * @return one group for each distinct (round, channel) pair, ordered by round and then channel,
     *         with every feature row placed on its group's grid at the feature's (z, y, x) position.
     */
    public List<FeatureGroup> groupByRoundAndChannel() {

        final Map<Long, FeatureGroup> keyToGroupMap = new TreeMap<>();

        for (int row = 0; row < features.size(); row++) {
            final Feature feature = features.get(row);
            final long groupKey = (((long) feature.getRound()) << 32) | (feature.getChannel() & 0xffffffffL);
            final FeatureGroup group = keyToGroupMap.computeIfAbsent(
                    groupKey, k -> new FeatureGroup(feature.getRound(), feature.getChannel()));
            group.getGrid().addFeature(feature.getZ(), feature.getY(), feature.getX(), row);
        }

        return new ArrayList<>(keyToGroupMap.values());
    }

    public static FeatureTable fromJson(final Reader json) {
        return new FeatureTable(JSON_HELPER.fromJsonArray(json));
    }

    private static final JsonUtils.Helper<Feature> JSON_HELPER = new JsonUtils.Helper<>(Feature.class);
}
