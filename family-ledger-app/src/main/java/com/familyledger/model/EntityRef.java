package com.familyledger.model;

import com.familyledger.exception.ValidationException;

/**
 * A typed pointer to one entity. Media and source links store the pair as
 * {@code (entity_type, entity_id)} instead of a foreign key, so the kind travels with the id.
 */
public record EntityRef(EntityKind kind, long id) {

    public static EntityRef link(String entityType, long entityId) {
        EntityKind kind = EntityKind.fromKey(entityType);
        if (!kind.isLinkTarget()) {
            throw new ValidationException("Links cannot target entity type '" + entityType + "'");
        }
        return new EntityRef(kind, entityId);
    }

    /** The generic target of a media or source link record. */
    public static EntityRef targetOf(EntityRecord link) {
        return link(link.getString("entityType"), link.getLong("entityId"));
    }

    @Override
    public String toString() {
        return kind.key() + "#" + id;
    }
}
