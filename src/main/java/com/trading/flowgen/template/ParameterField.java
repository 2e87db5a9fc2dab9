package com.trading.flowgen.template;

import java.util.List;

/**
 * A single typed field of a {@link ParameterSchema}.
 *
 * @param minimum    inclusive lower bound for numeric fields, or null
 * @param maximum    inclusive upper bound for numeric fields, or null
 * @param enumValues allowed values for string fields; empty when unrestricted
 */
public record ParameterField(
        String name,
        ValueType type,
        Double minimum,
        Double maximum,
        List<String> enumValues,
        boolean required,
        Object defaultValue,
        String description) {

    public ParameterField {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Parameter field requires a name");
        if (type == null)
            throw new IllegalArgumentException("Parameter field '" + name + "' requires a type");
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    }

    public static ParameterField integer(String name, Double minimum, Double maximum, Object defaultValue) {
        return new ParameterField(name, ValueType.INTEGER, minimum, maximum, List.of(), false, defaultValue, null);
    }

    public static ParameterField number(String name, Double minimum, Double maximum, Object defaultValue) {
        return new ParameterField(name, ValueType.NUMBER, minimum, maximum, List.of(), false, defaultValue, null);
    }

    public static ParameterField string(String name, List<String> enumValues, Object defaultValue) {
        return new ParameterField(name, ValueType.STRING, null, null, enumValues, false, defaultValue, null);
    }

    public static ParameterField bool(String name, Object defaultValue) {
        return new ParameterField(name, ValueType.BOOLEAN, null, null, List.of(), false, defaultValue, null);
    }

    public ParameterField asRequired() {
        return new ParameterField(name, type, minimum, maximum, enumValues, true, defaultValue, description);
    }

    public boolean hasEnum() {
        return !enumValues.isEmpty();
    }
}
