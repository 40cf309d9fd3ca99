package com.brigade.vacuum.cluster;

import com.brigade.vacuum.core.model.BuildLabels;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Equality-based label selector. An empty selector matches every resource.
 */
public record LabelSelector(Map<String, String> labels) {

    /** Selects the records Brigade creates for builds. */
    public static final LabelSelector BUILD_RECORDS = new LabelSelector(Map.of(
            BuildLabels.COMPONENT, "build",
            BuildLabels.HERITAGE, "brigade"));

    public static final LabelSelector EVERYTHING = new LabelSelector(Map.of());

    public LabelSelector {
        labels = Map.copyOf(labels);
    }

    public boolean isEverything() {
        return labels.isEmpty();
    }

    public boolean matches(Map<String, String> resourceLabels) {
        return labels.entrySet().stream()
                .allMatch(e -> e.getValue().equals(resourceLabels.get(e.getKey())));
    }

    /** Renders the selector in Kubernetes syntax, e.g. {@code component=build,heritage=brigade}. */
    @Override
    public String toString() {
        return new TreeMap<>(labels).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }
}
