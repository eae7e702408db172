package com.familyledger.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A stored row of any kind. {@code fields} holds only the non-null recognized fields, keyed by
 * field name and sorted, so two records with the same values compare equal.
 */
public record EntityRecord(
    EntityKind kind,
    long id,
    long accountId,
    long version,
    boolean deleted,
    Map<String, Object> fields,
    Instant createdAt,
    Instant updatedAt
) {
    public EntityRecord {
        fields = Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Long getLong(String field) {
        return (Long) fields.get(field);
    }

    public String getString(String field) {
        return (String) fields.get(field);
    }

    public EntityRecord withoutField(String field) {
        if (!fields.containsKey(field)) {
            return this;
        }
        Map<String, Object> remaining = new TreeMap<>(fields);
        remaining.remove(field);
        return new EntityRecord(kind, id, accountId, version, deleted, remaining, createdAt, updatedAt);
    }

    public EntityRef ref() {
        return new EntityRef(kind, id);
    }
}
