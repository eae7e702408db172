package com.familyledger.service;

import com.familyledger.model.AccountContext;
import com.familyledger.model.AccountGraph;
import com.familyledger.model.EntityFilter;
import com.familyledger.model.EntityKind;
import com.familyledger.model.EntityRecord;
import com.familyledger.model.Relationship;
import com.familyledger.model.RelationshipType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the export view of an account: every live entity, no revision history, in a fixed
 * order. The JSON projection is rendered from the same {@link AccountGraph} a GEDCOM writer
 * consumes, so the two can never disagree on membership or order.
 */
@Service
public class ExportService {

    private static final Comparator<EntityRecord> BY_BIRTH = Comparator
        .comparing((EntityRecord r) -> (LocalDate) r.get("birthDate"), Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparingLong(EntityRecord::id);

    private static final Comparator<EntityRecord> BY_EVENT_DATE = Comparator
        .comparing((EntityRecord r) -> (LocalDate) r.get("eventDate"), Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparingLong(EntityRecord::id);

    private static final Comparator<EntityRecord> BY_EDGE = Comparator
        .comparing((EntityRecord r) -> r.getString("type"))
        .thenComparing(r -> r.getLong("person1Id"))
        .thenComparing(r -> r.getLong("person2Id"))
        .thenComparing(r -> (LocalDate) r.get("startDate"), Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparingLong(EntityRecord::id);

    private static final Comparator<EntityRecord> BY_ID = Comparator.comparingLong(EntityRecord::id);

    private final EntityStore entityStore;
    private final UnitOfWork unitOfWork;
    private final ObjectMapper exportMapper = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();

    public ExportService(EntityStore entityStore, UnitOfWork unitOfWork) {
        this.entityStore = entityStore;
        this.unitOfWork = unitOfWork;
    }

    /** The ordered live graph, read in one transaction. */
    public AccountGraph export(AccountContext ctx) {
        return unitOfWork.read(() -> {
            AccountGraph graph = new AccountGraph(
                ctx.accountId(),
                sorted(ctx, EntityKind.PERSON, BY_BIRTH),
                sorted(ctx, EntityKind.RELATIONSHIP, BY_EDGE),
                sorted(ctx, EntityKind.EVENT, BY_EVENT_DATE),
                sorted(ctx, EntityKind.EVENT_PERSON, BY_ID),
                sorted(ctx, EntityKind.MEDIA, BY_ID),
                sorted(ctx, EntityKind.MEDIA_LINK, BY_ID),
                sorted(ctx, EntityKind.SOURCE, BY_ID),
                sorted(ctx, EntityKind.SOURCE_LINK, BY_ID)
            );
            requireAcyclic(graph);
            return graph;
        });
    }

    /** Flat JSON projection of {@link #export}; byte-identical for an unchanged account. */
    public String exportJson(AccountContext ctx) {
        AccountGraph graph = export(ctx);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("accountId", graph.accountId());
        document.put("people", flatten(graph.people()));
        document.put("relationships", flatten(graph.relationships()));
        document.put("events", flatten(graph.events()));
        document.put("eventPeople", flatten(graph.eventPeople()));
        document.put("media", flatten(graph.media()));
        document.put("mediaLinks", flatten(graph.mediaLinks()));
        document.put("sources", flatten(graph.sources()));
        document.put("sourceLinks", flatten(graph.sourceLinks()));
        try {
            return exportMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Export of account " + ctx.accountId() + " failed", e);
        }
    }

    private List<EntityRecord> sorted(AccountContext ctx, EntityKind kind, Comparator<EntityRecord> order) {
        List<EntityRecord> records = new ArrayList<>(entityStore.list(ctx, kind, EntityFilter.live()));
        records.sort(order);
        return List.copyOf(records);
    }

    private static List<Map<String, Object>> flatten(List<EntityRecord> records) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (EntityRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", record.id());
            row.putAll(record.fields());
            rows.add(row);
        }
        return rows;
    }

    /**
     * Kahn's algorithm over the exported parent edges. Leftover nodes mean the stored graph has
     * a cycle: corrupted data, reported rather than exported.
     */
    private static void requireAcyclic(AccountGraph graph) {
        Map<Long, Integer> inDegree = new HashMap<>();
        Map<Long, List<Long>> childrenOf = new HashMap<>();
        for (Relationship edge : graph.edges()) {
            if (edge.type() != RelationshipType.PARENT) {
                continue;
            }
            childrenOf.computeIfAbsent(edge.person1Id(), k -> new ArrayList<>()).add(edge.person2Id());
            inDegree.merge(edge.person2Id(), 1, Integer::sum);
            inDegree.putIfAbsent(edge.person1Id(), 0);
        }
        Deque<Long> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        int processed = 0;
        while (!ready.isEmpty()) {
            long id = ready.poll();
            processed++;
            for (Long child : childrenOf.getOrDefault(id, List.of())) {
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    ready.add(child);
                }
            }
        }
        if (processed != inDegree.size()) {
            throw new IllegalStateException("Parent cycle in account " + graph.accountId() + " detected during export");
        }
    }
}
