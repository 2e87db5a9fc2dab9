package com.trading.flowgen.graph;

/**
 * A node instance inside one {@link LogicFlow}.
 *
 * @param nodeId     unique within the owning flow
 * @param templateId catalog template this node instantiates
 * @param type       optional kind label supplied by the editor
 * @param outputType declared output value type, overriding the template's port
 * @param inputType  declared input value type for single-input nodes
 */
public record GraphNode(String nodeId, String templateId, String type, String outputType, String inputType) {

    public static GraphNode of(String nodeId, String templateId) {
        return new GraphNode(nodeId, templateId, null, null, null);
    }

    public GraphNode withTypes(String outputType, String inputType) {
        return new GraphNode(nodeId, templateId, type, outputType, inputType);
    }

    public boolean hasTemplateId() {
        return templateId != null && !templateId.isBlank();
    }
}
