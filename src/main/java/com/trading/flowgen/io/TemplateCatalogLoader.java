package com.trading.flowgen.io;

import com.trading.flowgen.api.NodeKind;
import com.trading.flowgen.template.CodeTemplate;
import com.trading.flowgen.template.NodeTemplate;
import com.trading.flowgen.template.NodeTemplateRegistry;
import com.trading.flowgen.template.ParameterField;
import com.trading.flowgen.template.ParameterSchema;
import com.trading.flowgen.template.Port;
import com.trading.flowgen.template.ValueType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Reads the system template catalog from JSON.
 *
 * <pre>
 * { "templates": [ { "id": "sma", "kind": "INDICATOR",
 *     "parameters": { "period": { "type": "integer", "minimum": 1, "default": 20 } },
 *     "inputs": [ { "name": "price", "type": "series" } ],
 *     "outputs": [ { "name": "value", "type": "series" } ],
 *     "code_template": { "snippet": "...", "imports": [] } } ] }
 * </pre>
 */
@Log4j2
public final class TemplateCatalogLoader {
    private final ObjectMapper mapper = new ObjectMapper();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CatalogDef {
        private List<TemplateDef> templates = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TemplateDef {
        private String id, name, kind, category, version;
        @JsonProperty("display_name")
        private String displayName;
        private Map<String, FieldDef> parameters = new LinkedHashMap<>();
        private List<PortDef> inputs = new ArrayList<>();
        private List<PortDef> outputs = new ArrayList<>();
        @JsonProperty("code_template")
        private CodeDef codeTemplate;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FieldDef {
        private String type, description;
        private Double minimum, maximum;
        @JsonProperty("enum")
        private List<String> enumValues;
        private boolean required;
        @JsonProperty("default")
        private Object defaultValue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PortDef {
        private String name, type;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CodeDef {
        private String snippet;
        private List<String> imports = new ArrayList<>();
    }

    /** The bundled system catalog. */
    public static NodeTemplateRegistry systemCatalog() {
        return new TemplateCatalogLoader().loadResource(FlowGenConfig.load().getTemplateCatalog());
    }

    public NodeTemplateRegistry loadResource(String resource) {
        try (InputStream in = TemplateCatalogLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalStateException("Template catalog not found: " + resource);
            NodeTemplateRegistry registry = NodeTemplateRegistry.builder().registerAll(load(in)).build();
            log.info("Loaded {} system template(s) from {}", registry.size(), resource);
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template catalog " + resource, e);
        }
    }

    public List<NodeTemplate> load(InputStream in) throws IOException {
        CatalogDef catalog = mapper.readValue(in, CatalogDef.class);
        List<NodeTemplate> out = new ArrayList<>();
        for (TemplateDef def : catalog.getTemplates())
            out.add(toTemplate(def));
        return out;
    }

    private static NodeTemplate toTemplate(TemplateDef def) {
        if (def.getId() == null || def.getKind() == null)
            throw new IllegalArgumentException("Catalog entry requires id and kind: " + def);
        List<ParameterField> fields = new ArrayList<>();
        def.getParameters().forEach((name, f) -> fields.add(new ParameterField(name, ValueType.fromString(f.getType()),
                f.getMinimum(), f.getMaximum(), f.getEnumValues(), f.isRequired(), f.getDefaultValue(),
                f.getDescription())));

        NodeTemplate.NodeTemplateBuilder b = NodeTemplate.builder()
                .id(def.getId())
                .name(def.getName() != null ? def.getName() : def.getId())
                .displayName(def.getDisplayName())
                .kind(NodeKind.fromString(def.getKind()))
                .category(def.getCategory())
                .parameterSchema(ParameterSchema.of(fields))
                .systemTemplate(true);
        if (def.getVersion() != null)
            b.version(def.getVersion());
        for (PortDef p : def.getInputs())
            b.inputPort(new Port(p.getName(), p.getType()));
        for (PortDef p : def.getOutputs())
            b.outputPort(new Port(p.getName(), p.getType()));
        if (def.getCodeTemplate() != null)
            b.codeTemplate(new CodeTemplate(def.getCodeTemplate().getSnippet(), def.getCodeTemplate().getImports()));
        return b.build();
    }
}
