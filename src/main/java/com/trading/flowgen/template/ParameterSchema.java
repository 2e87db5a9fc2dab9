package com.trading.flowgen.template;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of typed parameter fields declared by a node template.
 */
public final class ParameterSchema {
    private static final ParameterSchema EMPTY = new ParameterSchema(Map.of());

    private final Map<String, ParameterField> fields;

    private ParameterSchema(Map<String, ParameterField> fields) {
        this.fields = fields;
    }

    public static ParameterSchema empty() {
        return EMPTY;
    }

    public static ParameterSchema of(ParameterField... fields) {
        return of(List.of(fields));
    }

    public static ParameterSchema of(Collection<ParameterField> fields) {
        Map<String, ParameterField> byName = new LinkedHashMap<>();
        for (ParameterField f : fields) {
            if (byName.put(f.name(), f) != null)
                throw new IllegalArgumentException("Duplicate parameter field: " + f.name());
        }
        return new ParameterSchema(Collections.unmodifiableMap(byName));
    }

    public ParameterField field(String name) {
        return fields.get(name);
    }

    public Collection<ParameterField> fields() {
        return fields.values();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public List<String> requiredFields() {
        return fields.values().stream()
                .filter(ParameterField::required)
                .map(ParameterField::name)
                .toList();
    }

    /** Declared default values, in declaration order. Fields without a default are omitted. */
    public Map<String, Object> defaults() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (ParameterField f : fields.values()) {
            if (f.defaultValue() != null)
                out.put(f.name(), f.defaultValue());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParameterSchema other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ParameterSchema" + fields.keySet();
    }
}
