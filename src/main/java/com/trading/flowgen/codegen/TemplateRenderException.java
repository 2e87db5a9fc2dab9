package com.trading.flowgen.codegen;

/** A snippet could not be rendered, e.g. it names an unknown placeholder. */
public class TemplateRenderException extends CodeGenerationException {
    private final String templateId;

    public TemplateRenderException(String templateId, String message) {
        super("Template " + templateId + ": " + message);
        this.templateId = templateId;
    }

    public String templateId() {
        return templateId;
    }
}
