package org.checkpulse.registry;

import java.util.List;

/**
 * Names affected by one reconcile, each list sorted.
 */
public record RegistryDiff(List<String> added, List<String> removed, List<String> changed, List<String> unchanged) {

    public RegistryDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        changed = List.copyOf(changed);
        unchanged = List.copyOf(unchanged);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }

    @Override
    public String toString() {
        return "added=" + added + ", removed=" + removed + ", changed=" + changed + ", unchanged=" + unchanged.size();
    }
}
