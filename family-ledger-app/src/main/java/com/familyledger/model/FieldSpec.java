package com.familyledger.model;

import com.familyledger.exception.ValidationException;

import java.util.Set;

/**
 * One recognized field of an entity kind: the name callers use, the column it is stored in,
 * and how values are checked.
 *
 * @param maxLength the column's character limit, or null for unbounded text
 */
public record FieldSpec(
    String name,
    String column,
    FieldType type,
    boolean required,
    Set<String> allowedValues,
    Integer maxLength
) {

    public static FieldSpec text(String name, String column) {
        return new FieldSpec(name, column, FieldType.TEXT, false, Set.of(), null);
    }

    public static FieldSpec text(String name, String column, int maxLength) {
        return new FieldSpec(name, column, FieldType.TEXT, false, Set.of(), maxLength);
    }

    public static FieldSpec requiredText(String name, String column, int maxLength) {
        return new FieldSpec(name, column, FieldType.TEXT, true, Set.of(), maxLength);
    }

    public static FieldSpec date(String name, String column) {
        return new FieldSpec(name, column, FieldType.DATE, false, Set.of(), null);
    }

    public static FieldSpec id(String name, String column, boolean required) {
        return new FieldSpec(name, column, FieldType.ID, required, Set.of(), null);
    }

    public static FieldSpec choice(String name, String column, boolean required, Set<String> allowedValues) {
        return new FieldSpec(name, column, FieldType.TEXT, required, Set.copyOf(allowedValues), null);
    }

    /**
     * Normalizes a caller-supplied value. {@code null} passes through so patches can clear
     * optional fields.
     */
    public Object normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        Object value = type.coerce(name, raw);
        if (maxLength != null && value instanceof String text && text.codePointCount(0, text.length()) > maxLength) {
            throw new ValidationException("Field '" + name + "' must be at most " + maxLength + " characters");
        }
        if (!allowedValues.isEmpty() && !allowedValues.contains(value)) {
            throw new ValidationException("Field '" + name + "' must be one of " + allowedValues.stream().sorted().toList()
                + " but was '" + value + "'");
        }
        return value;
    }
}
