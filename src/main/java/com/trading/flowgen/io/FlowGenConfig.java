package com.trading.flowgen.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Library settings, read from {@code flowgen.json} on the classpath.
 * Missing file or missing keys fall back to the defaults below.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FlowGenConfig {
    public static final String RESOURCE = "flowgen.json";

    private String templateCatalog = "node_templates.json";
    private String securityPolicy = "security_policy.json";
    private int maxNodes = 500;
    private int maxEdges = 2000;
    /** Generation ring buffer size; must be a power of two. */
    private int ringBufferSize = 256;
    private String strategyClassName = "GeneratedStrategy";
    /** Reject flows that break the signal, position and stop-loss rules. */
    private boolean enforceStrategyRules;

    public static FlowGenConfig load() {
        return load(RESOURCE);
    }

    public static FlowGenConfig load(String resource) {
        try (InputStream in = FlowGenConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                return new FlowGenConfig();
            return new ObjectMapper().readValue(in, FlowGenConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + resource, e);
        }
    }
}
