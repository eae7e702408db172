package com.familyledger.model;

import java.time.Instant;
import java.util.Map;

/**
 * An entity's state rebuilt from the revision ledger as of a point in time. {@code fields}
 * follows the same shape as {@link EntityRecord#fields()}.
 */
public record RecordSnapshot(
    EntityKind kind,
    long id,
    Map<String, Object> fields,
    long version,
    boolean deleted,
    boolean purged,
    Instant asOf
) {}
