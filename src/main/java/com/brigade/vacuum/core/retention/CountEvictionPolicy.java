package com.brigade.vacuum.core.retention;

import com.brigade.vacuum.core.model.BuildRecord;
import com.brigade.vacuum.core.model.CountLimit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the {@code max} newest builds and evicts the rest.
 */
public class CountEvictionPolicy implements EvictionPolicy {

    private static final Logger log = LoggerFactory.getLogger(CountEvictionPolicy.class);

    private final CountLimit limit;

    public CountEvictionPolicy(CountLimit limit) {
        this.limit = limit;
    }

    @Override
    public String name() {
        return "count";
    }

    @Override
    public boolean isEnabled() {
        return limit instanceof CountLimit.AtMost;
    }

    @Override
    public List<String> selectVictims(ClusterSnapshot snapshot) {
        if (!(limit instanceof CountLimit.AtMost atMost)) {
            return List.of();
        }
        int max = atMost.max();
        int total = snapshot.candidates().size();
        if (total <= max) {
            log.info("Skipping count-based eviction. {} is <= max {}", total, max);
            return List.of();
        }

        var sorted = new ArrayList<>(snapshot.candidates());
        sorted.sort(CreationOrder.NEWEST_FIRST);

        var victims = new LinkedHashSet<String>();
        for (BuildRecord record : sorted.subList(max, total)) {
            Optional<String> buildId = record.buildId();
            if (buildId.isEmpty()) {
                log.warn("Build record {} has no build ID. Skipping.", record.name());
                continue;
            }
            victims.add(buildId.get());
        }
        log.info("{} build records exceed max {}; evicting {} builds", total - max, max, victims.size());
        return List.copyOf(victims);
    }
}
