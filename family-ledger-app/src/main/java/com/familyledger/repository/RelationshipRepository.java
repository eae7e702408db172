package com.familyledger.repository;

import com.familyledger.model.ParentEdge;
import com.familyledger.model.RelationshipType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Graph-shaped queries over the relationship table that the invariant checker needs in bulk.
 */
@Repository
public class RelationshipRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<ParentEdge> PARENT_EDGE_MAPPER = (rs, rowNum) -> new ParentEdge(
        rs.getLong("id"),
        rs.getLong("person1_id"),
        rs.getLong("person2_id")
    );

    public RelationshipRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * The account's whole directed parent subgraph. Edges touching tombstoned people are
     * included: hiding them could let a new edge close a cycle through a tombstone.
     */
    public List<ParentEdge> findParentEdges(long accountId) {
        return jdbc.query(
            "SELECT id, person1_id, person2_id FROM relationship "
                + "WHERE account_id = ? AND type = ? AND deleted = FALSE ORDER BY id",
            PARENT_EDGE_MAPPER,
            accountId, RelationshipType.PARENT.value()
        );
    }

    /** Non-deleted edges with exactly this stored orientation and type. */
    public List<EdgeInterval> findEdges(long accountId, long person1Id, long person2Id, String type) {
        return jdbc.query(
            "SELECT id, start_date, end_date FROM relationship "
                + "WHERE account_id = ? AND person1_id = ? AND person2_id = ? AND type = ? AND deleted = FALSE "
                + "ORDER BY id",
            (rs, rowNum) -> new EdgeInterval(
                rs.getLong("id"),
                rs.getObject("start_date", LocalDate.class),
                rs.getObject("end_date", LocalDate.class)
            ),
            accountId, person1Id, person2Id, type
        );
    }

    /** Upper bound for any walk over the account's people, tombstoned ones included. */
    public long countPeople(long accountId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM person WHERE account_id = ?",
            Long.class,
            accountId
        );
        return count != null ? count : 0L;
    }

    public record EdgeInterval(long id, LocalDate startDate, LocalDate endDate) {}
}
