package com.familyledger.model;

import com.familyledger.exception.NotFoundException;
import com.familyledger.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.familyledger.model.FieldSpec.choice;
import static com.familyledger.model.FieldSpec.date;
import static com.familyledger.model.FieldSpec.id;
import static com.familyledger.model.FieldSpec.requiredText;
import static com.familyledger.model.FieldSpec.text;

/**
 * Every kind of record the entity store keeps, with its table, API path and recognized field
 * set. Fields not listed here are rejected on create and update.
 */
public enum EntityKind {

    PERSON("person", "people", List.of(
        requiredText("givenName", "given_name", 200),
        requiredText("familyName", "family_name", 200),
        text("otherNames", "other_names", 400),
        text("gender", "gender", 20),
        date("birthDate", "birth_date"),
        text("birthPlace", "birth_place", 400),
        date("deathDate", "death_date"),
        text("deathPlace", "death_place", 400),
        text("bio", "bio"),
        choice("privacy", "privacy", false, Privacy.allValues()),
        text("relation", "relation", 100)
    )),

    RELATIONSHIP("relationship", "relationships", List.of(
        id("person1Id", "person1_id", true),
        id("person2Id", "person2_id", true),
        requiredText("type", "type", 30),
        text("details", "details"),
        date("startDate", "start_date"),
        date("endDate", "end_date")
    )),

    EVENT("event", "events", List.of(
        requiredText("title", "title", 400),
        date("eventDate", "event_date"),
        text("place", "place", 400),
        text("description", "description"),
        id("createdBy", "created_by", false)
    )),

    EVENT_PERSON("event_person", "event-people", List.of(
        id("eventId", "event_id", true),
        id("personId", "person_id", true),
        text("role", "role", 100)
    )),

    MEDIA("media", "media", List.of(
        text("filename", "filename", 400),
        text("url", "url", 2000),
        text("mimeType", "mime_type", 100),
        text("caption", "caption"),
        text("metadataJson", "metadata_json")
    )),

    MEDIA_LINK("media_link", "media-links", List.of(
        id("mediaId", "media_id", true),
        choice("entityType", "entity_type", true, LinkTargets.VALUES),
        id("entityId", "entity_id", true),
        text("role", "role", 100)
    )),

    SOURCE("source", "sources", List.of(
        requiredText("title", "title", 400),
        text("url", "url", 2000),
        text("citationText", "citation_text")
    )),

    SOURCE_LINK("source_link", "source-links", List.of(
        id("sourceId", "source_id", true),
        choice("entityType", "entity_type", true, LinkTargets.VALUES),
        id("entityId", "entity_id", true),
        text("note", "note")
    ));

    private final String key;
    private final String path;
    private final List<FieldSpec> fields;

    EntityKind(String key, String path, List<FieldSpec> fields) {
        this.key = key;
        this.path = path;
        this.fields = fields;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String path() {
        return path;
    }

    public String table() {
        return key;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public Optional<FieldSpec> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public FieldSpec requireField(String name) {
        return field(name).orElseThrow(() ->
            new ValidationException("Unknown field '" + name + "' for " + key));
    }

    /** Kinds that media and source links may point at. */
    public boolean isLinkTarget() {
        return this == PERSON || this == RELATIONSHIP || this == EVENT;
    }

    /** Links carrying a generic {@code (entityType, entityId)} target. */
    public boolean hasGenericTarget() {
        return this == MEDIA_LINK || this == SOURCE_LINK;
    }

    /**
     * Foreign references whose target must stay live for a record of this kind to be live.
     * Generic link targets are resolved separately through {@link EntityRef}.
     */
    public List<Reference> references() {
        return switch (this) {
            case RELATIONSHIP -> List.of(new Reference("person1Id", PERSON), new Reference("person2Id", PERSON));
            case EVENT_PERSON -> List.of(new Reference("eventId", EVENT), new Reference("personId", PERSON));
            case MEDIA_LINK -> List.of(new Reference("mediaId", MEDIA));
            case SOURCE_LINK -> List.of(new Reference("sourceId", SOURCE));
            default -> List.of();
        };
    }

    /**
     * References that record who did something rather than what the record is about. The
     * record stays live when the target is tombstoned; live views drop the reference instead.
     */
    public List<Reference> attributions() {
        return this == EVENT ? List.of(new Reference("createdBy", PERSON)) : List.of();
    }

    public static EntityKind fromKey(String key) {
        return Arrays.stream(values())
            .filter(k -> k.key.equals(key))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown entity kind '" + key + "'"));
    }

    public static EntityKind fromPath(String path) {
        return Arrays.stream(values())
            .filter(k -> k.path.equals(path))
            .findFirst()
            .orElseThrow(() -> new NotFoundException("No collection named '" + path + "'"));
    }

    public record Reference(String field, EntityKind target) {}

    private static final class LinkTargets {
        static final Set<String> VALUES = Set.of("person", "relationship", "event");
    }
}
