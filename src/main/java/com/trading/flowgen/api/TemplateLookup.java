package com.trading.flowgen.api;

import com.trading.flowgen.template.NodeTemplate;

import java.util.Optional;

/**
 * Read-only access to the node template catalog.
 * Passed into every validation and generation call.
 */
@FunctionalInterface
public interface TemplateLookup {

    Optional<NodeTemplate> getTemplate(String templateId);
}
