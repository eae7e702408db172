package com.familyledger.service;

import com.familyledger.exception.CycleDetectedException;
import com.familyledger.exception.DuplicateRelationshipException;
import com.familyledger.exception.ForbiddenException;
import com.familyledger.exception.InvalidRelationshipException;
import com.familyledger.exception.NotFoundException;
import com.familyledger.exception.ValidationException;
import com.familyledger.model.AccountContext;
import com.familyledger.model.EntityKind;
import com.familyledger.model.EntityRecord;
import com.familyledger.model.EntityRef;
import com.familyledger.model.ParentEdge;
import com.familyledger.model.RelationshipType;
import com.familyledger.repository.EntityRepository;
import com.familyledger.repository.RelationshipRepository;
import com.familyledger.repository.RelationshipRepository.EdgeInterval;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a record's references before it is written. Relationships get the full graph
 * rules (self-loop, tenancy, duplicates, parent acyclicity); links and events get
 * existence, ownership and liveness checks on what they point at.
 *
 * <p>Callers must hold the account lock for any write that references another record.
 * Otherwise two concurrent parent inserts can each pass the acyclicity walk and together close
 * a cycle, and a reference can pass its liveness check while its target is being tombstoned.
 */
@Component
public class GraphInvariantChecker {

    private final EntityRepository entityRepository;
    private final RelationshipRepository relationshipRepository;
    private final CascadeResolver cascadeResolver;

    public GraphInvariantChecker(EntityRepository entityRepository,
                                 RelationshipRepository relationshipRepository,
                                 CascadeResolver cascadeResolver) {
        this.entityRepository = entityRepository;
        this.relationshipRepository = relationshipRepository;
        this.cascadeResolver = cascadeResolver;
    }

    /**
     * Checks the complete would-be state of a record and returns it in canonical form.
     *
     * <p>Attributions are only checked when they are set or changed, so a record attributed to
     * someone since tombstoned can still be edited.
     *
     * @param state   every field of the record after the mutation
     * @param current the record being updated, or null on create
     */
    public Map<String, Object> check(AccountContext ctx, EntityKind kind, Map<String, Object> state,
                                     EntityRecord current) {
        for (EntityKind.Reference attribution : kind.attributions()) {
            Long target = (Long) state.get(attribution.field());
            Long previous = current == null ? null : current.getLong(attribution.field());
            if (target != null && !target.equals(previous)) {
                requireLive(ctx, new EntityRef(attribution.target(), target));
            }
        }
        switch (kind) {
            case RELATIONSHIP -> {
                return checkRelationship(ctx, state, current == null ? null : current.id());
            }
            case EVENT_PERSON -> {
                requireLive(ctx, new EntityRef(EntityKind.EVENT, (Long) state.get("eventId")));
                requireLive(ctx, new EntityRef(EntityKind.PERSON, (Long) state.get("personId")));
            }
            case MEDIA_LINK -> {
                requireLive(ctx, new EntityRef(EntityKind.MEDIA, (Long) state.get("mediaId")));
                requireLive(ctx, EntityRef.link((String) state.get("entityType"), (Long) state.get("entityId")));
            }
            case SOURCE_LINK -> {
                requireLive(ctx, new EntityRef(EntityKind.SOURCE, (Long) state.get("sourceId")));
                requireLive(ctx, EntityRef.link((String) state.get("entityType"), (Long) state.get("entityId")));
            }
            default -> {
                // people, events, media and sources reference nothing beyond attributions
            }
        }
        return state;
    }

    private Map<String, Object> checkRelationship(AccountContext ctx, Map<String, Object> state, Long selfId) {
        String typeValue = (String) state.get("type");
        RelationshipType type = RelationshipType.fromValue(typeValue)
            .orElseThrow(() -> new InvalidRelationshipException("Unknown relationship type '" + typeValue + "'"));
        long person1Id = (Long) state.get("person1Id");
        long person2Id = (Long) state.get("person2Id");

        if (person1Id == person2Id) {
            throw new InvalidRelationshipException("A person cannot be related to themselves (" + person1Id + ")");
        }
        EntityRecord person1 = requireEndpoint(ctx, person1Id);
        EntityRecord person2 = requireEndpoint(ctx, person2Id);
        requireLiveEndpoint(person1);
        requireLiveEndpoint(person2);

        LocalDate startDate = (LocalDate) state.get("startDate");
        LocalDate endDate = (LocalDate) state.get("endDate");
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new ValidationException("startDate " + startDate + " is after endDate " + endDate);
        }

        Map<String, Object> canonical = new HashMap<>(state);
        if (type.isSymmetric() && person1Id > person2Id) {
            canonical.put("person1Id", person2Id);
            canonical.put("person2Id", person1Id);
            long swap = person1Id;
            person1Id = person2Id;
            person2Id = swap;
        }

        requireNoDuplicate(ctx, person1Id, person2Id, type, startDate, endDate, selfId);
        if (type == RelationshipType.PARENT) {
            requireAcyclic(ctx, person1Id, person2Id, selfId);
        }
        return canonical;
    }

    private EntityRecord requireEndpoint(AccountContext ctx, long personId) {
        EntityRecord person = entityRepository.findById(EntityKind.PERSON, personId)
            .orElseThrow(() -> new NotFoundException("person " + personId + " not found"));
        if (person.accountId() != ctx.accountId()) {
            throw new InvalidRelationshipException("person " + personId + " belongs to another account");
        }
        return person;
    }

    private static void requireLiveEndpoint(EntityRecord person) {
        if (person.deleted()) {
            throw new NotFoundException("person " + person.id() + " not found");
        }
    }

    private void requireNoDuplicate(AccountContext ctx, long person1Id, long person2Id, RelationshipType type,
                                    LocalDate startDate, LocalDate endDate, Long selfId) {
        for (EdgeInterval existing : relationshipRepository.findEdges(ctx.accountId(), person1Id, person2Id, type.value())) {
            if (selfId != null && existing.id() == selfId) {
                continue;
            }
            if (overlaps(existing.startDate(), existing.endDate(), startDate, endDate)) {
                throw new DuplicateRelationshipException(existing.id());
            }
        }
    }

    static boolean overlaps(LocalDate s1, LocalDate e1, LocalDate s2, LocalDate e2) {
        LocalDate start1 = s1 != null ? s1 : LocalDate.MIN;
        LocalDate end1 = e1 != null ? e1 : LocalDate.MAX;
        LocalDate start2 = s2 != null ? s2 : LocalDate.MIN;
        LocalDate end2 = e2 != null ? e2 : LocalDate.MAX;
        return !start1.isAfter(end2) && !start2.isAfter(end1);
    }

    /**
     * Adding "parentId is a parent of childId" closes a cycle exactly when parentId is already
     * a descendant of childId. Walks down from childId over the account's parent edges; the
     * walk visits each person at most once, so it is bounded by the account's head count.
     */
    private void requireAcyclic(AccountContext ctx, long parentId, long childId, Long selfId) {
        Map<Long, List<Long>> childrenOf = new HashMap<>();
        for (ParentEdge edge : relationshipRepository.findParentEdges(ctx.accountId())) {
            if (selfId != null && edge.relationshipId() == selfId) {
                continue;
            }
            childrenOf.computeIfAbsent(edge.parentId(), k -> new ArrayList<>()).add(edge.childId());
        }
        long bound = relationshipRepository.countPeople(ctx.accountId());

        Deque<Long> pending = new ArrayDeque<>();
        Set<Long> visited = new HashSet<>();
        pending.push(childId);
        while (!pending.isEmpty()) {
            long current = pending.pop();
            if (current == parentId) {
                throw new CycleDetectedException(parentId, childId);
            }
            if (!visited.add(current)) {
                continue;
            }
            if (visited.size() > bound) {
                throw new IllegalStateException("Parent walk in account " + ctx.accountId()
                    + " visited more people than the account holds");
            }
            for (Long child : childrenOf.getOrDefault(current, List.of())) {
                pending.push(child);
            }
        }
    }

    /** Existence, ownership and liveness of a referenced entity. */
    public EntityRecord requireLive(AccountContext ctx, EntityRef ref) {
        EntityRecord record = entityRepository.findById(ref.kind(), ref.id())
            .orElseThrow(() -> new NotFoundException(ref.kind().key() + " " + ref.id() + " not found"));
        if (record.accountId() != ctx.accountId()) {
            throw new ForbiddenException(ref.kind().key() + " " + ref.id() + " belongs to another account");
        }
        if (!cascadeResolver.isLive(record)) {
            throw new NotFoundException(ref.kind().key() + " " + ref.id() + " not found");
        }
        return record;
    }
}
