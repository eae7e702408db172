package com.familyledger.service;

import com.familyledger.model.EntityKind;
import com.familyledger.model.FieldChange;
import com.familyledger.model.FieldSpec;
import com.familyledger.model.Revision;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds revision diffs: only fields whose value changed, each as before/after in JSON form.
 */
final class Diffs {

    private Diffs() {
    }

    static Map<String, FieldChange> between(EntityKind kind, Map<String, Object> before, Map<String, Object> after) {
        Map<String, FieldChange> diff = new TreeMap<>();
        for (FieldSpec spec : kind.fields()) {
            Object oldValue = before.get(spec.name());
            Object newValue = after.get(spec.name());
            if (!Objects.equals(oldValue, newValue)) {
                diff.put(spec.name(), new FieldChange(spec.type().toJson(oldValue), spec.type().toJson(newValue)));
            }
        }
        return diff;
    }

    static Map<String, FieldChange> tombstone() {
        return Map.of(Revision.DELETED_FIELD, new FieldChange(false, true));
    }

    /** Every remaining field goes to null. */
    static Map<String, FieldChange> purge(EntityKind kind, Map<String, Object> fields) {
        return between(kind, fields, Map.of());
    }
}
