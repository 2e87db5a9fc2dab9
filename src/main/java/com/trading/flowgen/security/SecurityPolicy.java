package com.trading.flowgen.security;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Allow- and deny-lists consulted by {@link SecurityValidator}.
 *
 * <p>
 * Call lists hold fully-qualified names; an entry ending in {@code .*} matches
 * every attribute of that module, e.g. {@code subprocess.*}.
 */
public final class SecurityPolicy {
    public static final String DEFAULT_RESOURCE = "security_policy.json";

    private final Set<String> allowedImports;
    private final Set<String> forbiddenImports;
    private final Set<String> dangerousFunctions;
    private final Set<String> processCalls;
    private final Set<String> forbiddenAttributes;

    private SecurityPolicy(Builder b) {
        this.allowedImports = Set.copyOf(b.allowedImports);
        this.forbiddenImports = Set.copyOf(b.forbiddenImports);
        this.dangerousFunctions = Set.copyOf(b.dangerousFunctions);
        this.processCalls = Set.copyOf(b.processCalls);
        this.forbiddenAttributes = Set.copyOf(b.forbiddenAttributes);
    }

    /** JSON shape of a policy file. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Definition {
        private List<String> allowedImports = List.of();
        private List<String> forbiddenImports = List.of();
        private List<String> dangerousFunctions = List.of();
        private List<String> processCalls = List.of();
        private List<String> forbiddenAttributes = List.of();
    }

    /** Loads the policy bundled on the classpath. */
    public static SecurityPolicy defaults() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static SecurityPolicy fromResource(String resource) {
        try (InputStream in = SecurityPolicy.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalStateException("Security policy resource not found: " + resource);
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read security policy " + resource, e);
        }
    }

    public static SecurityPolicy fromJson(InputStream in) throws IOException {
        Definition def = new ObjectMapper().readValue(in, Definition.class);
        return builder()
                .allowImports(def.getAllowedImports())
                .forbidImports(def.getForbiddenImports())
                .dangerousFunctions(def.getDangerousFunctions())
                .processCalls(def.getProcessCalls())
                .forbiddenAttributes(def.getForbiddenAttributes())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .allowImports(allowedImports)
                .forbidImports(forbiddenImports)
                .dangerousFunctions(dangerousFunctions)
                .processCalls(processCalls)
                .forbiddenAttributes(forbiddenAttributes);
    }

    /** Deny-list match on the top-level package, e.g. {@code os} for {@code os.path}. */
    public boolean isForbiddenImport(String module) {
        return forbiddenImports.contains(topLevel(module));
    }

    /** Exact allow-list match, or a sub-module of an allowed package. */
    public boolean isAllowedImport(String module) {
        if (allowedImports.contains(module))
            return true;
        for (String allowed : allowedImports)
            if (module.startsWith(allowed + "."))
                return true;
        return false;
    }

    public boolean isDangerousFunction(String name) {
        return dangerousFunctions.contains(name);
    }

    public boolean isProcessCall(String name) {
        if (processCalls.contains(name))
            return true;
        for (String p : processCalls)
            if (p.endsWith(".*") && name.startsWith(p.substring(0, p.length() - 1)))
                return true;
        return false;
    }

    public boolean isForbiddenAttribute(String attr) {
        return forbiddenAttributes.contains(attr);
    }

    public Set<String> allowedImports() {
        return allowedImports;
    }

    public Set<String> forbiddenImports() {
        return forbiddenImports;
    }

    static String topLevel(String module) {
        int dot = module.indexOf('.');
        return dot < 0 ? module : module.substring(0, dot);
    }

    public static final class Builder {
        private final Set<String> allowedImports = new LinkedHashSet<>();
        private final Set<String> forbiddenImports = new LinkedHashSet<>();
        private final Set<String> dangerousFunctions = new LinkedHashSet<>();
        private final Set<String> processCalls = new LinkedHashSet<>();
        private final Set<String> forbiddenAttributes = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder allowImports(Iterable<String> modules) {
            modules.forEach(allowedImports::add);
            return this;
        }

        public Builder allowImport(String module) {
            allowedImports.add(module);
            return this;
        }

        public Builder forbidImports(Iterable<String> modules) {
            modules.forEach(forbiddenImports::add);
            return this;
        }

        public Builder forbidImport(String module) {
            forbiddenImports.add(module);
            return this;
        }

        public Builder dangerousFunctions(Iterable<String> names) {
            names.forEach(dangerousFunctions::add);
            return this;
        }

        public Builder processCalls(Iterable<String> names) {
            names.forEach(processCalls::add);
            return this;
        }

        public Builder forbiddenAttributes(Iterable<String> names) {
            names.forEach(forbiddenAttributes::add);
            return this;
        }

        public SecurityPolicy build() {
            return new SecurityPolicy(this);
        }
    }
}
