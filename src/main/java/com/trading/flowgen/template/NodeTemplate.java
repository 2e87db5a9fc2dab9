package com.trading.flowgen.template;

import com.trading.flowgen.api.NodeKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable catalog entry describing a reusable strategy building block.
 */
@Value
@Builder(toBuilder = true)
public class NodeTemplate {
    @NonNull
    String id;
    String name;
    String displayName;
    @NonNull
    NodeKind kind;
    String category;
    @Builder.Default
    ParameterSchema parameterSchema = ParameterSchema.empty();
    @Singular
    List<Port> inputPorts;
    @Singular
    List<Port> outputPorts;
    CodeTemplate codeTemplate;
    boolean systemTemplate;
    String ownerId;
    @Builder.Default
    String version = "1.0.0";

    /** Name shown in generated comments; falls back to the template name, then the id. */
    public String label() {
        if (displayName != null && !displayName.isBlank())
            return displayName;
        return name != null && !name.isBlank() ? name : id;
    }

    public Map<String, Object> defaultParameters() {
        return parameterSchema == null ? Map.of() : parameterSchema.defaults();
    }

    public Optional<Port> inputPort(String portName) {
        return findPort(inputPorts, portName);
    }

    public Optional<Port> outputPort(String portName) {
        return findPort(outputPorts, portName);
    }

    private static Optional<Port> findPort(List<Port> ports, String portName) {
        if (portName == null) {
            // Unnamed connection: only unambiguous for single-port templates
            return ports.size() == 1 ? Optional.of(ports.get(0)) : Optional.empty();
        }
        return ports.stream().filter(p -> p.name().equals(portName)).findFirst();
    }
}
