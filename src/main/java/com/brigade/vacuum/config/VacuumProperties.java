package com.brigade.vacuum.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Defaults for a vacuum pass. Bound from {@code vacuum.*} properties and the
 * matching environment variables (VACUUM_AGE, VACUUM_MAX_BUILDS, ...).
 */
@Component
@ConfigurationProperties(prefix = "vacuum")
public class VacuumProperties {

    /** Maximum build age, e.g. {@code 720h}. Zero or unset disables age-based eviction. */
    private Duration age = Duration.ZERO;

    /** Number of builds to keep; -1 keeps all. */
    private int maxBuilds = -1;

    private boolean skipRunningBuilds = false;

    private String namespace = "default";

    public Duration getAge() { return age; }
    public void setAge(Duration age) { this.age = age; }
    public int getMaxBuilds() { return maxBuilds; }
    public void setMaxBuilds(int maxBuilds) { this.maxBuilds = maxBuilds; }
    public boolean isSkipRunningBuilds() { return skipRunningBuilds; }
    public void setSkipRunningBuilds(boolean skipRunningBuilds) { this.skipRunningBuilds = skipRunningBuilds; }
    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }

    /**
     * Resolves these properties into settings for a pass starting now.
     *
     * @throws IllegalArgumentException for a negative age or max-builds below -1
     */
    public VacuumSettings toSettings(Clock clock) {
        return VacuumSettings.resolve(age, maxBuilds, skipRunningBuilds, namespace, clock);
    }
}
