package com.familyledger.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Relationship edge types. Symmetric types are stored once with the smaller person id as
 * {@code person1Id}; directed types keep caller orientation ({@code person1Id} is the parent
 * or guardian).
 */
public enum RelationshipType {
    PARENT(false),
    GUARDIAN(false),
    SPOUSE(true),
    PARTNER(true),
    SIBLING(true),
    HALF_SIBLING(true);

    private final boolean symmetric;

    RelationshipType(boolean symmetric) {
        this.symmetric = symmetric;
    }

    public boolean isSymmetric() {
        return symmetric;
    }

    public String value() {
        return name().toLowerCase();
    }

    public static Optional<RelationshipType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(t -> t.value().equals(value))
            .findFirst();
    }
}
