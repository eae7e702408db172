package com.familyledger.model;

import java.time.LocalDate;
import java.util.Comparator;

public record Person(
    Long id,
    Long accountId,
    String givenName,
    String familyName,
    String otherNames,
    String gender,
    LocalDate birthDate,
    String birthPlace,
    LocalDate deathDate,
    String deathPlace,
    String bio,
    String privacy,
    String relation
) {
    /** Birth date first (unknown dates last), then id, so equal dates never reorder between runs. */
    public static final Comparator<Person> BY_BIRTH =
        Comparator.comparing(Person::birthDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Person::id);

    public static Person from(EntityRecord record) {
        return new Person(
            record.id(),
            record.accountId(),
            record.getString("givenName"),
            record.getString("familyName"),
            record.getString("otherNames"),
            record.getString("gender"),
            (LocalDate) record.get("birthDate"),
            record.getString("birthPlace"),
            (LocalDate) record.get("deathDate"),
            record.getString("deathPlace"),
            record.getString("bio"),
            record.getString("privacy"),
            record.getString("relation")
        );
    }
}
