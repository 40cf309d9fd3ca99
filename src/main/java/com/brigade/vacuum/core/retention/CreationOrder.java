package com.brigade.vacuum.core.retention;

import com.brigade.vacuum.core.model.BuildRecord;

import java.util.Comparator;

/**
 * Orders build records newest first by creation timestamp.
 * Records created at the same instant compare as equal; their relative order is not guaranteed.
 */
public final class CreationOrder implements Comparator<BuildRecord> {

    public static final CreationOrder NEWEST_FIRST = new CreationOrder();

    private CreationOrder() {}

    @Override
    public int compare(BuildRecord a, BuildRecord b) {
        if (a.createdAt().isAfter(b.createdAt())) {
            return -1;
        }
        if (b.createdAt().isAfter(a.createdAt())) {
            return 1;
        }
        return 0;
    }
}
