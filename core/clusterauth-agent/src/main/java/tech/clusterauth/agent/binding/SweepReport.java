package tech.clusterauth.agent.binding;

import java.util.Map;
import java.util.Set;

/**
 * Objects deleted by one sweep, counted per kind. Kinds whose listing failed
 * are absent from {@code deleted} and named in {@code unlisted}.
 */
public record SweepReport(Map<String, Integer> deleted, Set<String> unlisted) {

    public SweepReport {
        deleted = Map.copyOf(deleted);
        unlisted = Set.copyOf(unlisted);
    }

    public int total() {
        return deleted.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int deleted(String kind) {
        return deleted.getOrDefault(kind, 0);
    }
}
