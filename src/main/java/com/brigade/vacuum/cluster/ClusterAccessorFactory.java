package com.brigade.vacuum.cluster;

/**
 * Creates a {@link ClusterAccessor} scoped to a namespace chosen at run time.
 */
@FunctionalInterface
public interface ClusterAccessorFactory {
    ClusterAccessor forNamespace(String namespace);
}
