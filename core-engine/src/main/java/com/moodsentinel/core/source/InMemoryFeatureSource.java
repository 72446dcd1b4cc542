package com.moodsentinel.core.source;

import com.moodsentinel.core.model.FeatureSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Queue-backed source; {@link #extract(int)} drains what has been offered.
 */
public class InMemoryFeatureSource implements FeatureSource {

    private final ConcurrentLinkedQueue<FeatureSnapshot> queue = new ConcurrentLinkedQueue<>();

    public InMemoryFeatureSource() {
    }

    public InMemoryFeatureSource(Collection<FeatureSnapshot> snapshots) {
        queue.addAll(snapshots);
    }

    public void offer(FeatureSnapshot snapshot) {
        queue.add(snapshot);
    }

    @Override
    public List<FeatureSnapshot> extract(int limit) {
        List<FeatureSnapshot> drained = new ArrayList<>();
        FeatureSnapshot next;
        while (drained.size() < limit && (next = queue.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    @Override
    public String describe() {
        return "memory";
    }
}
