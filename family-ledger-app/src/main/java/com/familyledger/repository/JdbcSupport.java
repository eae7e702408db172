package com.familyledger.repository;

import org.springframework.jdbc.support.KeyHolder;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

final class JdbcSupport {

    private JdbcSupport() {
    }

    static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    // PostgreSQL hands back every column of the inserted row, H2 only the identity.
    static long generatedId(KeyHolder keys) {
        for (Map<String, Object> row : keys.getKeyList()) {
            for (Map.Entry<String, Object> entry : row.entrySet()) {
                if ("id".equalsIgnoreCase(entry.getKey())) {
                    return ((Number) entry.getValue()).longValue();
                }
            }
        }
        throw new IllegalStateException("Insert did not return a generated id");
    }
}
