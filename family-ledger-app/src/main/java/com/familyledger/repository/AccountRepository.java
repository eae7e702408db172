package com.familyledger.repository;

import com.familyledger.model.Account;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class AccountRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Account> ACCOUNT_MAPPER = (rs, rowNum) -> new Account(
        rs.getLong("id"),
        rs.getString("username"),
        rs.getString("password_hash"),
        rs.getString("display_name"),
        rs.getObject("created_at", OffsetDateTime.class).toInstant()
    );

    public AccountRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Account> findById(long id) {
        List<Account> results = jdbc.query("SELECT * FROM account WHERE id = ?", ACCOUNT_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<Account> findByUsername(String username) {
        List<Account> results = jdbc.query("SELECT * FROM account WHERE username = ?", ACCOUNT_MAPPER, username);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(String username, String passwordHash, String displayName, Instant createdAt) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                "INSERT INTO account (username, password_hash, display_name, created_at) VALUES (?, ?, ?, ?)",
                Statement.RETURN_GENERATED_KEYS
            );
            ps.setString(1, username);
            ps.setString(2, passwordHash);
            ps.setString(3, displayName);
            ps.setObject(4, JdbcSupport.utc(createdAt));
            return ps;
        }, keys);
        return JdbcSupport.generatedId(keys);
    }

    /**
     * Takes the per-account mutation lock. Held until the surrounding transaction ends, it
     * serializes relationship writes within one account and leaves other accounts alone.
     */
    public void lockForUpdate(long accountId) {
        List<Long> locked = jdbc.queryForList("SELECT id FROM account WHERE id = ? FOR UPDATE", Long.class, accountId);
        if (locked.isEmpty()) {
            throw new IllegalStateException("Account " + accountId + " does not exist");
        }
    }
}
