package com.familyledger.repository;

import com.familyledger.model.EntityKind;
import com.familyledger.model.EntityRecord;
import com.familyledger.model.EntityRef;
import com.familyledger.model.FieldSpec;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row storage for every {@link EntityKind}. Table and column names come from the kind's field
 * specs, never from caller input, so the SQL is assembled from constants only.
 */
@Repository
public class EntityRepository {

    private final JdbcTemplate jdbc;
    private final Map<EntityKind, RowMapper<EntityRecord>> mappers = new EnumMap<>(EntityKind.class);

    public EntityRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        for (EntityKind kind : EntityKind.values()) {
            mappers.put(kind, mapperFor(kind));
        }
    }

    private static RowMapper<EntityRecord> mapperFor(EntityKind kind) {
        return (rs, rowNum) -> {
            Map<String, Object> fields = new HashMap<>();
            for (FieldSpec spec : kind.fields()) {
                Object value = spec.type().read(rs, spec.column());
                if (value != null) {
                    fields.put(spec.name(), value);
                }
            }
            return new EntityRecord(
                kind,
                rs.getLong("id"),
                rs.getLong("account_id"),
                rs.getLong("version"),
                rs.getBoolean("deleted"),
                fields,
                rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                rs.getObject("updated_at", OffsetDateTime.class).toInstant()
            );
        };
    }

    /**
     * Inserts a new row at version 1 and returns its generated id.
     *
     * @param fields recognized field names to typed values; absent or null fields stay NULL
     */
    public long insert(EntityKind kind, long accountId, Map<String, Object> fields, Instant now) {
        List<String> columns = new ArrayList<>(List.of("account_id", "created_at", "updated_at"));
        List<Object> args = new ArrayList<>(List.of(accountId, JdbcSupport.utc(now), JdbcSupport.utc(now)));
        for (FieldSpec spec : kind.fields()) {
            Object value = fields.get(spec.name());
            if (value != null) {
                columns.add(spec.column());
                args.add(value);
            }
        }
        String sql = "INSERT INTO " + kind.table() + " (" + String.join(", ", columns) + ") VALUES ("
            + String.join(", ", columns.stream().map(c -> "?").toList()) + ")";

        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }
            return ps;
        }, keys);
        return JdbcSupport.generatedId(keys);
    }

    /** Any row with this id, tombstoned or not. */
    public Optional<EntityRecord> findById(EntityKind kind, long id) {
        List<EntityRecord> results = jdbc.query(
            "SELECT * FROM " + kind.table() + " WHERE id = ?",
            mappers.get(kind),
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /** Like {@link #findById} but holds a row lock until the surrounding transaction ends. */
    public Optional<EntityRecord> findByIdForUpdate(EntityKind kind, long id) {
        List<EntityRecord> results = jdbc.query(
            "SELECT * FROM " + kind.table() + " WHERE id = ? FOR UPDATE",
            mappers.get(kind),
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Rows of one account matching every equality in {@code matches}, ordered by id.
     *
     * @param matches field names to typed values; a null value matches NULL
     */
    public List<EntityRecord> findByAccount(EntityKind kind, long accountId, Map<String, Object> matches,
                                            boolean includeDeleted) {
        StringBuilder sql = new StringBuilder("SELECT * FROM " + kind.table() + " WHERE account_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(accountId);

        if (!includeDeleted) {
            sql.append(" AND deleted = FALSE");
        }
        matches.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(match -> {
                String column = kind.requireField(match.getKey()).column();
                if (match.getValue() == null) {
                    sql.append(" AND ").append(column).append(" IS NULL");
                } else {
                    sql.append(" AND ").append(column).append(" = ?");
                    params.add(match.getValue());
                }
            });
        sql.append(" ORDER BY id");

        return jdbc.query(sql.toString(), mappers.get(kind), params.toArray());
    }

    /** Every row, tombstoned or not, whose {@code field} points at {@code targetId}. */
    public List<EntityRecord> findReferencing(EntityKind kind, String field, long targetId) {
        return jdbc.query(
            "SELECT * FROM " + kind.table() + " WHERE " + kind.requireField(field).column() + " = ? ORDER BY id",
            mappers.get(kind),
            targetId
        );
    }

    /** Every media or source link row, tombstoned or not, whose generic target is {@code target}. */
    public List<EntityRecord> findLinksTo(EntityKind linkKind, EntityRef target) {
        return jdbc.query(
            "SELECT * FROM " + linkKind.table() + " WHERE entity_type = ? AND entity_id = ? ORDER BY id",
            mappers.get(linkKind),
            target.kind().key(), target.id()
        );
    }

    /**
     * Writes changed columns and bumps the version, provided the row is still at
     * {@code expectedVersion} and not tombstoned.
     *
     * @return rows updated, 0 when the guard failed
     */
    public int update(EntityKind kind, long id, long expectedVersion, Map<String, Object> changes, Instant now) {
        StringBuilder sql = new StringBuilder("UPDATE " + kind.table() + " SET version = version + 1, updated_at = ?");
        List<Object> params = new ArrayList<>();
        params.add(JdbcSupport.utc(now));
        for (FieldSpec spec : kind.fields()) {
            if (changes.containsKey(spec.name())) {
                sql.append(", ").append(spec.column()).append(" = ?");
                params.add(changes.get(spec.name()));
            }
        }
        sql.append(" WHERE id = ? AND version = ? AND deleted = FALSE");
        params.add(id);
        params.add(expectedVersion);
        return jdbc.update(sql.toString(), params.toArray());
    }

    /** Tombstones the row if it is still live at {@code expectedVersion}. */
    public int markDeleted(EntityKind kind, long id, long expectedVersion, Instant now) {
        return jdbc.update(
            "UPDATE " + kind.table() + " SET deleted = TRUE, version = version + 1, updated_at = ? "
                + "WHERE id = ? AND version = ? AND deleted = FALSE",
            JdbcSupport.utc(now), id, expectedVersion
        );
    }

    /**
     * Nulls one reference column regardless of tombstone state and bumps the version. Used when
     * the referenced row is purged but the referencing row survives.
     */
    public int clearReference(EntityKind kind, long id, String field, Instant now) {
        return jdbc.update(
            "UPDATE " + kind.table() + " SET " + kind.requireField(field).column() + " = NULL, "
                + "version = version + 1, updated_at = ? WHERE id = ?",
            JdbcSupport.utc(now), id
        );
    }

    /** Physically removes the row. Only hard purge calls this. */
    public int delete(EntityKind kind, long id) {
        return jdbc.update("DELETE FROM " + kind.table() + " WHERE id = ?", id);
    }
}
