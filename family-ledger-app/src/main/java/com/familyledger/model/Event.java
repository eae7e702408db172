package com.familyledger.model;

import java.time.LocalDate;
import java.util.Comparator;

public record Event(
    Long id,
    String title,
    LocalDate eventDate,
    String place,
    String description,
    Long createdBy
) {
    public static final Comparator<Event> BY_DATE =
        Comparator.comparing(Event::eventDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Event::id);

    public static Event from(EntityRecord record) {
        return new Event(
            record.id(),
            record.getString("title"),
            (LocalDate) record.get("eventDate"),
            record.getString("place"),
            record.getString("description"),
            record.getLong("createdBy")
        );
    }
}
