package com.brigade.vacuum.core.retention;

import com.brigade.vacuum.core.model.AgeLimit;
import com.brigade.vacuum.core.model.BuildRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Evicts every build whose record was created before the cutoff.
 */
public class AgeEvictionPolicy implements EvictionPolicy {

    private static final Logger log = LoggerFactory.getLogger(AgeEvictionPolicy.class);

    private final AgeLimit limit;

    public AgeEvictionPolicy(AgeLimit limit) {
        this.limit = limit;
    }

    @Override
    public String name() {
        return "age";
    }

    @Override
    public boolean isEnabled() {
        return limit instanceof AgeLimit.Before;
    }

    @Override
    public List<String> selectVictims(ClusterSnapshot snapshot) {
        if (!(limit instanceof AgeLimit.Before before)) {
            return List.of();
        }
        log.info("Pruning records older than {}", before.cutoff());

        var victims = new LinkedHashSet<String>();
        for (BuildRecord record : snapshot.candidates()) {
            Optional<String> buildId = record.buildId();
            if (buildId.isEmpty()) {
                log.warn("Build record {} has no build ID. Skipping.", record.name());
                continue;
            }
            if (before.isExpired(record.createdAt())) {
                victims.add(buildId.get());
            }
        }
        log.info("{} of {} build records are older than {}",
                victims.size(), snapshot.candidates().size(), before.cutoff());
        return List.copyOf(victims);
    }
}
