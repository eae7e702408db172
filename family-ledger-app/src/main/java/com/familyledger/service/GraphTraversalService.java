package com.familyledger.service;

import com.familyledger.config.EngineConfig;
import com.familyledger.exception.ValidationException;
import com.familyledger.model.AccountContext;
import com.familyledger.model.AncestryEntry;
import com.familyledger.model.EntityFilter;
import com.familyledger.model.EntityKind;
import com.familyledger.model.EntityRecord;
import com.familyledger.model.Event;
import com.familyledger.model.Person;
import com.familyledger.model.Relationship;
import com.familyledger.model.RelationshipType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-side walks over the live family graph of one account. Every result is ordered by its
 * primary key (generation, birth date or event date) with entity id breaking ties, so repeated
 * reads of the same state return the same sequence.
 */
@Service
public class GraphTraversalService {

    private final EntityStore entityStore;
    private final UnitOfWork unitOfWork;
    private final EngineConfig config;

    public GraphTraversalService(EntityStore entityStore, UnitOfWork unitOfWork, EngineConfig config) {
        this.entityStore = entityStore;
        this.unitOfWork = unitOfWork;
        this.config = config;
    }

    // ========== ANCESTORS / DESCENDANTS ==========

    public List<AncestryEntry> ancestors(AccountContext ctx, long personId, Integer maxDepth) {
        return unitOfWork.read(() -> {
            entityStore.get(ctx, EntityKind.PERSON, personId);
            FamilyGraph graph = loadGraph(ctx);
            return walk(graph, personId, depth(maxDepth), graph::parentsOf);
        });
    }

    public List<AncestryEntry> descendants(AccountContext ctx, long personId, Integer maxDepth) {
        return unitOfWork.read(() -> {
            entityStore.get(ctx, EntityKind.PERSON, personId);
            FamilyGraph graph = loadGraph(ctx);
            return walk(graph, personId, depth(maxDepth), graph::childrenOf);
        });
    }

    /**
     * Breadth-first by generation. A person reachable along several lines (pedigree collapse)
     * is reported once, at the nearest generation. Meeting the start person again means the
     * stored parent graph has a cycle, which the invariant checker never admits.
     */
    private List<AncestryEntry> walk(FamilyGraph graph, long startId, int maxDepth,
                                     Function<Long, List<Long>> next) {
        List<AncestryEntry> result = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        seen.add(startId);
        List<Long> frontier = List.of(startId);

        for (int generation = 1; generation <= maxDepth && !frontier.isEmpty(); generation++) {
            List<Person> reached = new ArrayList<>();
            for (Long id : frontier) {
                for (Long relative : next.apply(id)) {
                    if (relative == startId) {
                        throw new IllegalStateException("Parent cycle through person " + startId);
                    }
                    if (seen.add(relative)) {
                        reached.add(graph.person(relative));
                    }
                }
            }
            reached.sort(Person.BY_BIRTH);
            for (Person person : reached) {
                result.add(new AncestryEntry(person, generation));
            }
            frontier = reached.stream().map(Person::id).toList();
        }
        return result;
    }

    private int depth(Integer requested) {
        int depth = requested != null ? requested : config.getDefaultTraversalDepth();
        if (depth < 1 || depth > config.getMaxTraversalDepth()) {
            throw new ValidationException("maxDepth must be between 1 and " + config.getMaxTraversalDepth());
        }
        return depth;
    }

    // ========== IMMEDIATE FAMILY ==========

    public List<Person> parents(AccountContext ctx, long personId) {
        return immediate(ctx, personId, (graph) -> graph.parentsOf(personId));
    }

    public List<Person> children(AccountContext ctx, long personId) {
        return immediate(ctx, personId, (graph) -> graph.childrenOf(personId));
    }

    /** Spouses and partners, whichever way the edge was stored. */
    public List<Person> spouses(AccountContext ctx, long personId) {
        return immediate(ctx, personId, (graph) -> graph.symmetricOf(personId,
            Set.of(RelationshipType.SPOUSE, RelationshipType.PARTNER)));
    }

    /** Explicit sibling edges plus people sharing at least one parent. */
    public List<Person> siblings(AccountContext ctx, long personId) {
        return immediate(ctx, personId, (graph) -> {
            Set<Long> ids = new HashSet<>(graph.symmetricOf(personId,
                Set.of(RelationshipType.SIBLING, RelationshipType.HALF_SIBLING)));
            for (Long parent : graph.parentsOf(personId)) {
                ids.addAll(graph.childrenOf(parent));
            }
            ids.remove(personId);
            return new ArrayList<>(ids);
        });
    }

    private List<Person> immediate(AccountContext ctx, long personId, Function<FamilyGraph, List<Long>> select) {
        return unitOfWork.read(() -> {
            entityStore.get(ctx, EntityKind.PERSON, personId);
            FamilyGraph graph = loadGraph(ctx);
            return select.apply(graph).stream()
                .distinct()
                .map(graph::person)
                .sorted(Person.BY_BIRTH)
                .toList();
        });
    }

    // ========== TIMELINE ==========

    /** Events the person takes part in or created, by event date then id. */
    public List<Event> timeline(AccountContext ctx, long personId) {
        return unitOfWork.read(() -> {
            entityStore.get(ctx, EntityKind.PERSON, personId);
            Map<Long, Event> events = new HashMap<>();
            for (EntityRecord link : entityStore.list(ctx, EntityKind.EVENT_PERSON, EntityFilter.where("personId", personId))) {
                EntityRecord event = entityStore.get(ctx, EntityKind.EVENT, link.getLong("eventId"));
                events.put(event.id(), Event.from(event));
            }
            for (EntityRecord event : entityStore.list(ctx, EntityKind.EVENT, EntityFilter.where("createdBy", personId))) {
                events.put(event.id(), Event.from(event));
            }
            return events.values().stream().sorted(Event.BY_DATE).toList();
        });
    }

    // ========== GRAPH ==========

    FamilyGraph loadGraph(AccountContext ctx) {
        Map<Long, Person> people = new LinkedHashMap<>();
        for (EntityRecord record : entityStore.list(ctx, EntityKind.PERSON, EntityFilter.live())) {
            people.put(record.id(), Person.from(record));
        }
        List<Relationship> edges = entityStore.list(ctx, EntityKind.RELATIONSHIP, EntityFilter.live()).stream()
            .map(Relationship::from)
            .toList();
        return new FamilyGraph(people, edges);
    }

    /** Live people and live edges of one account, indexed for walking. */
    static final class FamilyGraph {

        private final Map<Long, Person> people;
        private final Map<Long, List<Long>> parents = new HashMap<>();
        private final Map<Long, List<Long>> children = new HashMap<>();
        private final List<Relationship> edges;

        FamilyGraph(Map<Long, Person> people, List<Relationship> edges) {
            this.people = people;
            this.edges = edges;
            for (Relationship edge : edges) {
                if (edge.type() == RelationshipType.PARENT) {
                    parents.computeIfAbsent(edge.person2Id(), k -> new ArrayList<>()).add(edge.person1Id());
                    children.computeIfAbsent(edge.person1Id(), k -> new ArrayList<>()).add(edge.person2Id());
                }
            }
        }

        Person person(long id) {
            Person person = people.get(id);
            if (person == null) {
                throw new IllegalStateException("Live edge references person " + id + " outside the live graph");
            }
            return person;
        }

        List<Long> parentsOf(long id) {
            return parents.getOrDefault(id, List.of());
        }

        List<Long> childrenOf(long id) {
            return children.getOrDefault(id, List.of());
        }

        List<Long> symmetricOf(long id, Set<RelationshipType> types) {
            return edges.stream()
                .filter(edge -> types.contains(edge.type()) && edge.involves(id))
                .map(edge -> edge.otherEnd(id))
                .toList();
        }
    }
}
