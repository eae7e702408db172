package com.familyledger.repository;

import com.familyledger.model.EntityKind;
import com.familyledger.model.FieldChange;
import com.familyledger.model.Revision;
import com.familyledger.model.RevisionOperation;
import com.familyledger.model.RevisionQuery;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Storage for the revision ledger. Insert and select only; nothing updates or deletes revision
 * rows.
 */
@Repository
public class RevisionRepository {

    private static final TypeReference<TreeMap<String, FieldChange>> DIFF_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<Revision> revisionMapper;

    public RevisionRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.revisionMapper = (rs, rowNum) -> new Revision(
            rs.getLong("id"),
            rs.getLong("account_id"),
            EntityKind.fromKey(rs.getString("entity_type")),
            rs.getLong("entity_id"),
            RevisionOperation.fromValue(rs.getString("operation")),
            rs.getString("author"),
            readDiff(rs.getString("change_json")),
            rs.getObject("recorded_at", OffsetDateTime.class).toInstant()
        );
    }

    public long insert(Revision revision) {
        String changeJson = writeDiff(revision.diff());
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                "INSERT INTO revision (account_id, entity_type, entity_id, operation, author, change_json, recorded_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                Statement.RETURN_GENERATED_KEYS
            );
            ps.setLong(1, revision.accountId());
            ps.setString(2, revision.entityKind().key());
            ps.setLong(3, revision.entityId());
            ps.setString(4, revision.operation().value());
            ps.setString(5, revision.author());
            ps.setString(6, changeJson);
            ps.setObject(7, JdbcSupport.utc(revision.recordedAt()));
            return ps;
        }, keys);
        return JdbcSupport.generatedId(keys);
    }

    /** Revisions of one account matching the query, in commit order. */
    public List<Revision> find(long accountId, RevisionQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM revision WHERE account_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(accountId);

        if (query.kind() != null) {
            sql.append(" AND entity_type = ?");
            params.add(query.kind().key());
        }
        if (query.entityId() != null) {
            sql.append(" AND entity_id = ?");
            params.add(query.entityId());
        }
        if (query.from() != null) {
            sql.append(" AND recorded_at >= ?");
            params.add(JdbcSupport.utc(query.from()));
        }
        if (query.to() != null) {
            sql.append(" AND recorded_at <= ?");
            params.add(JdbcSupport.utc(query.to()));
        }
        sql.append(" ORDER BY id");

        return jdbc.query(sql.toString(), revisionMapper, params.toArray());
    }

    /** The account that owns an entity's history, even after the entity itself was purged. */
    public List<Long> findOwningAccounts(EntityKind kind, long entityId) {
        return jdbc.queryForList(
            "SELECT DISTINCT account_id FROM revision WHERE entity_type = ? AND entity_id = ?",
            Long.class,
            kind.key(), entityId
        );
    }

    private String writeDiff(Map<String, FieldChange> diff) {
        try {
            return objectMapper.writeValueAsString(new TreeMap<>(diff));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Revision diff is not serializable", e);
        }
    }

    private Map<String, FieldChange> readDiff(String json) {
        try {
            return objectMapper.readValue(json, DIFF_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt revision payload: " + json, e);
        }
    }
}
