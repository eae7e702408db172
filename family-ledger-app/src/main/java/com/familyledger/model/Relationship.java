package com.familyledger.model;

import java.time.LocalDate;

public record Relationship(
    Long id,
    Long person1Id,
    Long person2Id,
    RelationshipType type,
    String details,
    LocalDate startDate,
    LocalDate endDate
) {
    public static Relationship from(EntityRecord record) {
        return new Relationship(
            record.id(),
            record.getLong("person1Id"),
            record.getLong("person2Id"),
            RelationshipType.fromValue(record.getString("type"))
                .orElseThrow(() -> new IllegalStateException(
                    "Relationship " + record.id() + " has unknown type " + record.get("type"))),
            record.getString("details"),
            (LocalDate) record.get("startDate"),
            (LocalDate) record.get("endDate")
        );
    }

    public boolean involves(long personId) {
        return person1Id == personId || person2Id == personId;
    }

    /** The endpoint opposite {@code personId}; symmetric edges read the same from either side. */
    public long otherEnd(long personId) {
        return person1Id == personId ? person2Id : person1Id;
    }
}
