package com.trading.flowgen.template;

import com.trading.flowgen.api.NodeKind;
import com.trading.flowgen.api.TemplateLookup;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog of node templates keyed by template id.
 * <p>
 * Adding a custom template yields a new registry; system templates can never
 * be replaced.
 */
public final class NodeTemplateRegistry implements TemplateLookup {
    private final Map<String, NodeTemplate> templates;

    private NodeTemplateRegistry(Map<String, NodeTemplate> templates) {
        this.templates = Collections.unmodifiableMap(templates);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static NodeTemplateRegistry of(NodeTemplate... templates) {
        Builder b = builder();
        for (NodeTemplate t : templates)
            b.register(t);
        return b.build();
    }

    @Override
    public Optional<NodeTemplate> getTemplate(String templateId) {
        if (templateId == null)
            return Optional.empty();
        return Optional.ofNullable(templates.get(templateId));
    }

    public int size() {
        return templates.size();
    }

    public Collection<NodeTemplate> templates() {
        return templates.values();
    }

    public List<NodeTemplate> templatesOfKind(NodeKind kind) {
        return templates.values().stream().filter(t -> t.getKind() == kind).toList();
    }

    /**
     * Returns a registry that additionally contains the given user template.
     *
     * @throws IllegalArgumentException if the template is flagged as a system
     *                                  template, has no owner, or would replace
     *                                  a system template or another owner's
     *                                  template
     */
    public NodeTemplateRegistry withCustomTemplate(NodeTemplate template) {
        if (template.isSystemTemplate())
            throw new IllegalArgumentException("Custom template cannot be flagged as system: " + template.getId());
        if (template.getOwnerId() == null || template.getOwnerId().isBlank())
            throw new IllegalArgumentException("Custom template requires an owner: " + template.getId());
        NodeTemplate existing = templates.get(template.getId());
        if (existing != null) {
            if (existing.isSystemTemplate())
                throw new IllegalArgumentException("Cannot modify system template: " + template.getId());
            if (!existing.getOwnerId().equals(template.getOwnerId()))
                throw new IllegalArgumentException(
                        "Template " + template.getId() + " belongs to another owner");
        }
        Map<String, NodeTemplate> copy = new LinkedHashMap<>(templates);
        copy.put(template.getId(), template);
        return new NodeTemplateRegistry(copy);
    }

    /** Accumulates templates; duplicate ids are rejected. */
    public static final class Builder {
        private final Map<String, NodeTemplate> templates = new LinkedHashMap<>();

        public Builder register(NodeTemplate template) {
            if (templates.putIfAbsent(template.getId(), template) != null)
                throw new IllegalArgumentException("Duplicate template id: " + template.getId());
            return this;
        }

        public Builder registerAll(Collection<NodeTemplate> all) {
            all.forEach(this::register);
            return this;
        }

        public NodeTemplateRegistry build() {
            return new NodeTemplateRegistry(new LinkedHashMap<>(templates));
        }
    }
}
