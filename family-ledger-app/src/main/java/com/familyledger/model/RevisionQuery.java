package com.familyledger.model;

import java.time.Instant;

/** Audit filter; any component may be null to leave that dimension open. Bounds are inclusive. */
public record RevisionQuery(EntityKind kind, Long entityId, Instant from, Instant to) {

    public static RevisionQuery all() {
        return new RevisionQuery(null, null, null, null);
    }

    public static RevisionQuery forEntity(EntityKind kind, long entityId) {
        return new RevisionQuery(kind, entityId, null, null);
    }

    public RevisionQuery between(Instant from, Instant to) {
        return new RevisionQuery(kind, entityId, from, to);
    }
}
