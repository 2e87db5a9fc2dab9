package com.trading.flowgen.template;

import java.util.List;

/**
 * Code-generation hints attached to a node template.
 *
 * @param snippet body rendered for the node; {@code {{placeholders}}} are
 *                substituted by the renderer. May be null, in which case the
 *                node kind's default is used.
 * @param imports module imports the snippet relies on, e.g. {@code talib} or
 *                {@code numpy as np}
 */
public record CodeTemplate(String snippet, List<String> imports) {

    public CodeTemplate {
        imports = imports == null ? List.of() : List.copyOf(imports);
    }

    public static CodeTemplate of(String snippet, String... imports) {
        return new CodeTemplate(snippet, List.of(imports));
    }

    public boolean hasSnippet() {
        return snippet != null && !snippet.isBlank();
    }
}
