package com.familyledger.model;

import java.time.Instant;
import java.util.Map;

/**
 * One committed mutation. {@code diff} maps each changed field (plus the {@code deleted}
 * pseudo-field for tombstones) to its before and after values.
 */
public record Revision(
    Long id,
    long accountId,
    EntityKind entityKind,
    long entityId,
    RevisionOperation operation,
    String author,
    Map<String, FieldChange> diff,
    Instant recordedAt
) {
    public static final String DELETED_FIELD = "deleted";
}
