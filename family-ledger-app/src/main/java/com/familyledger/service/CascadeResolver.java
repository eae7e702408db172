package com.familyledger.service;

import com.familyledger.model.EntityKind;
import com.familyledger.model.EntityRecord;
import com.familyledger.model.EntityRef;
import com.familyledger.repository.EntityRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides what tombstones and purges mean for dependent rows.
 *
 * <p>Tombstoning never touches dependents. A row is live when it is not tombstoned and every
 * row it references is live; a relationship to a tombstoned person, or a media link to that
 * relationship, is dangling-soft and only shows up in history views.
 *
 * <p>Attributions such as an event's {@code createdBy} do not affect liveness. Live views of
 * the record leave out an attribution whose target is no longer live.
 *
 * <p>Hard purge is the only path that removes rows, and it removes exactly the dependents
 * that cannot exist without the purged row.
 */
@Component
public class CascadeResolver {

    private final EntityRepository entityRepository;

    public CascadeResolver(EntityRepository entityRepository) {
        this.entityRepository = entityRepository;
    }

    public boolean isLive(EntityRecord record) {
        return newLiveness().isLive(record);
    }

    public EntityRecord liveView(EntityRecord record) {
        return newLiveness().liveView(record);
    }

    /** A liveness check that remembers what it has already resolved; use one per read. */
    public Liveness newLiveness() {
        return new Liveness();
    }

    /**
     * Everything a purge of {@code target} physically removes, dependents first and
     * {@code target} last.
     */
    public List<EntityRecord> purgePlan(EntityRecord target) {
        Map<EntityRef, EntityRecord> plan = new LinkedHashMap<>();
        collectDependents(target, plan);
        plan.put(target.ref(), target);
        return new ArrayList<>(plan.values());
    }

    /**
     * Events attributed to a person being purged. They survive the purge with their
     * {@code createdBy} cleared.
     */
    public List<EntityRecord> attributionsOf(EntityRecord target) {
        if (target.kind() != EntityKind.PERSON) {
            return List.of();
        }
        return entityRepository.findReferencing(EntityKind.EVENT, "createdBy", target.id());
    }

    private void collectDependents(EntityRecord record, Map<EntityRef, EntityRecord> plan) {
        switch (record.kind()) {
            case PERSON -> {
                for (EntityRecord relationship : relationshipsOf(record.id())) {
                    collectDependents(relationship, plan);
                    plan.putIfAbsent(relationship.ref(), relationship);
                }
                addAll(plan, entityRepository.findReferencing(EntityKind.EVENT_PERSON, "personId", record.id()));
                addLinksTo(record.ref(), plan);
            }
            case RELATIONSHIP -> addLinksTo(record.ref(), plan);
            case EVENT -> {
                addAll(plan, entityRepository.findReferencing(EntityKind.EVENT_PERSON, "eventId", record.id()));
                addLinksTo(record.ref(), plan);
            }
            case MEDIA -> addAll(plan, entityRepository.findReferencing(EntityKind.MEDIA_LINK, "mediaId", record.id()));
            case SOURCE -> addAll(plan, entityRepository.findReferencing(EntityKind.SOURCE_LINK, "sourceId", record.id()));
            default -> {
                // link rows have no dependents
            }
        }
    }

    private List<EntityRecord> relationshipsOf(long personId) {
        List<EntityRecord> relationships = new ArrayList<>(
            entityRepository.findReferencing(EntityKind.RELATIONSHIP, "person1Id", personId));
        relationships.addAll(entityRepository.findReferencing(EntityKind.RELATIONSHIP, "person2Id", personId));
        return relationships;
    }

    private void addLinksTo(EntityRef target, Map<EntityRef, EntityRecord> plan) {
        addAll(plan, entityRepository.findLinksTo(EntityKind.MEDIA_LINK, target));
        addAll(plan, entityRepository.findLinksTo(EntityKind.SOURCE_LINK, target));
    }

    private static void addAll(Map<EntityRef, EntityRecord> plan, List<EntityRecord> records) {
        for (EntityRecord record : records) {
            plan.putIfAbsent(record.ref(), record);
        }
    }

    /**
     * Resolves liveness recursively through references. References form a shallow, acyclic
     * chain (link → relationship → person), so the recursion depth is at most three.
     */
    public final class Liveness {

        private final Map<EntityRef, Boolean> resolved = new HashMap<>();

        private Liveness() {
        }

        public boolean isLive(EntityRecord record) {
            Boolean known = resolved.get(record.ref());
            if (known != null) {
                return known;
            }
            boolean live = !record.deleted() && referencesLive(record);
            resolved.put(record.ref(), live);
            return live;
        }

        /** The record as live reads show it, without attributions to records that are gone. */
        public EntityRecord liveView(EntityRecord record) {
            EntityRecord view = record;
            for (EntityKind.Reference attribution : record.kind().attributions()) {
                Long targetId = record.getLong(attribution.field());
                if (targetId != null && !isLive(new EntityRef(attribution.target(), targetId))) {
                    view = view.withoutField(attribution.field());
                }
            }
            return view;
        }

        public boolean isLive(EntityRef ref) {
            Boolean known = resolved.get(ref);
            if (known != null) {
                return known;
            }
            Optional<EntityRecord> record = entityRepository.findById(ref.kind(), ref.id());
            if (record.isEmpty()) {
                resolved.put(ref, false);
                return false;
            }
            return isLive(record.get());
        }

        private boolean referencesLive(EntityRecord record) {
            for (EntityKind.Reference reference : record.kind().references()) {
                Long targetId = record.getLong(reference.field());
                if (targetId != null && !isLive(new EntityRef(reference.target(), targetId))) {
                    return false;
                }
            }
            if (record.kind().hasGenericTarget()) {
                return isLive(EntityRef.targetOf(record));
            }
            return true;
        }
    }
}
