package com.trading.flowgen.template;

/**
 * Named input or output of a node template.
 *
 * @param dataType declared value type (e.g. {@code Series}, {@code bool}); may be null
 */
public record Port(String name, String dataType) {

    public Port {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Port requires a name");
    }
}
