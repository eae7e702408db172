package com.familyledger.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equality matches on recognized fields for {@code list}. Tombstoned and dangling records are
 * skipped unless {@code includeTombstoned} is set.
 */
public record EntityFilter(Map<String, Object> matches, boolean includeTombstoned) {

    public EntityFilter {
        matches = Map.copyOf(matches);
    }

    public static EntityFilter live() {
        return new EntityFilter(Map.of(), false);
    }

    public static EntityFilter withTombstoned() {
        return new EntityFilter(Map.of(), true);
    }

    public EntityFilter and(String field, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(matches);
        next.put(field, value);
        return new EntityFilter(next, includeTombstoned);
    }

    public static EntityFilter where(String field, Object value) {
        return live().and(field, value);
    }
}
