package com.moodsentinel.core.source;

import com.moodsentinel.core.model.FeatureSnapshot;

import java.util.List;

/**
 * Supplies feature snapshots to the alerting pipeline.
 *
 * @since 1.0.0
 */
public interface FeatureSource {

    /**
     * Return up to {@code limit} snapshots.
     *
     * @param limit maximum number of snapshots; must be positive
     * @return snapshots in source order, possibly empty
     * @throws SourceException if the source cannot be read
     */
    List<FeatureSnapshot> extract(int limit);

    /**
     * @return short human-readable description for logs
     */
    String describe();
}
