package com.brigade.vacuum.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * Label keys shared by build records and workers.
 */
public final class BuildLabels {

    /** Correlation label; its value is the build ID. */
    public static final String BUILD = "build";

    public static final String COMPONENT = "component";
    public static final String HERITAGE = "heritage";

    private BuildLabels() {}

    public static Optional<String> buildId(Map<String, String> labels) {
        return Optional.ofNullable(labels.get(BUILD));
    }
}
