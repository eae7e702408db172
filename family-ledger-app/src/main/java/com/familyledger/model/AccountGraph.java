package com.familyledger.model;

import java.util.List;

/**
 * The live graph of one account in export order. GEDCOM writers and the JSON projection both
 * read this, so they always agree on membership and ordering.
 */
public record AccountGraph(
    long accountId,
    List<EntityRecord> people,
    List<EntityRecord> relationships,
    List<EntityRecord> events,
    List<EntityRecord> eventPeople,
    List<EntityRecord> media,
    List<EntityRecord> mediaLinks,
    List<EntityRecord> sources,
    List<EntityRecord> sourceLinks
) {
    public List<Person> persons() {
        return people.stream().map(Person::from).toList();
    }

    public List<Relationship> edges() {
        return relationships.stream().map(Relationship::from).toList();
    }
}
