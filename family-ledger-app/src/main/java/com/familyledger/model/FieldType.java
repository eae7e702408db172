package com.familyledger.model;

import com.familyledger.exception.ValidationException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Storage types for entity fields. Each type normalizes caller input, reads its column, and
 * converts to and from the JSON values kept in revision diffs.
 */
public enum FieldType {

    TEXT {
        @Override
        Object coerce(String field, Object raw) {
            if (raw instanceof String s) {
                return s;
            }
            throw new ValidationException("Field '" + field + "' must be a string");
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            return rs.getString(column);
        }
    },

    DATE {
        @Override
        Object coerce(String field, Object raw) {
            if (raw instanceof LocalDate date) {
                return date;
            }
            if (raw instanceof String s) {
                try {
                    return LocalDate.parse(s.trim());
                } catch (DateTimeParseException e) {
                    throw new ValidationException("Field '" + field + "' must be an ISO date (yyyy-MM-dd): " + s);
                }
            }
            throw new ValidationException("Field '" + field + "' must be an ISO date string");
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            return rs.getObject(column, LocalDate.class);
        }

        @Override
        public Object toJson(Object value) {
            return value == null ? null : value.toString();
        }

        @Override
        public Object fromJson(Object json) {
            return json == null ? null : LocalDate.parse((String) json);
        }
    },

    ID {
        @Override
        Object coerce(String field, Object raw) {
            long id;
            if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
                id = ((Number) raw).longValue();
            } else if (raw instanceof String s && s.matches("\\d{1,18}")) {
                id = Long.parseLong(s);
            } else {
                throw new ValidationException("Field '" + field + "' must be an integer identifier");
            }
            if (id <= 0) {
                throw new ValidationException("Field '" + field + "' must be a positive identifier");
            }
            return id;
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            return rs.getObject(column) != null ? rs.getLong(column) : null;
        }

        @Override
        public Object fromJson(Object json) {
            return json == null ? null : ((Number) json).longValue();
        }
    };

    abstract Object coerce(String field, Object raw);

    public abstract Object read(ResultSet rs, String column) throws SQLException;

    /** Converts a stored value to the form written into revision diffs. */
    public Object toJson(Object value) {
        return value;
    }

    /** Inverse of {@link #toJson(Object)}. */
    public Object fromJson(Object json) {
        return json;
    }
}
