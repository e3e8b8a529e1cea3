package com.genbatch.orchestrator.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A workflow in API format: {@code { "<node id>": { "class_type": ..., "inputs": {...} } }}.
 *
 * Nodes are validated into {@link WorkflowNode} records when the graph is
 * built. The document itself is kept as-is so every field the service
 * understands survives a mutation, including ones this class never reads.
 * Instances are immutable; {@link #withInputImage} returns a new graph.
 */
public final class WorkflowGraph {

    /** Node types that load the seed image. Exactly one must be present. */
    public static final Set<String> INPUT_NODE_TYPES = Set.of("LoadImage", "LoadImageFromPath");

    public record WorkflowNode(String id, String classType) {}

    private final ObjectNode               document;
    private final Map<String, WorkflowNode> nodes;

    private WorkflowGraph(ObjectNode document, Map<String, WorkflowNode> nodes) {
        this.document = document;
        this.nodes    = nodes;
    }

    /** @throws GraphShapeException if the text is not an API-format workflow */
    public static WorkflowGraph parse(ObjectMapper json, String text) {
        try {
            return of(json.readTree(text));
        } catch (JsonProcessingException e) {
            throw new GraphShapeException("Workflow is not valid JSON: " + e.getOriginalMessage());
        }
    }

    /** @throws GraphShapeException if the document is not an API-format workflow */
    public static WorkflowGraph of(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new GraphShapeException("Workflow must be a JSON object of nodes");
        }
        if (root.has("nodes") && root.get("nodes").isArray()) {
            throw new GraphShapeException(
                    "Workflow is in editor format ('nodes' array); export it in API format");
        }
        Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode node = field.getValue();
            if (!node.isObject() || !node.path("class_type").isTextual()) {
                throw new GraphShapeException("Workflow node '" + field.getKey() + "' has no class_type");
            }
            JsonNode inputs = node.get("inputs");
            if (inputs != null && !inputs.isObject()) {
                throw new GraphShapeException("Workflow node '" + field.getKey() + "' has malformed inputs");
            }
            nodes.put(field.getKey(), new WorkflowNode(field.getKey(), node.get("class_type").asText()));
        }
        if (nodes.isEmpty()) {
            throw new GraphShapeException("Workflow has no nodes");
        }
        return new WorkflowGraph(((ObjectNode) root).deepCopy(), nodes);
    }

    public List<WorkflowNode> nodes() {
        return List.copyOf(nodes.values());
    }

    /** Distinct node types, sorted. */
    public Set<String> nodeTypes() {
        Set<String> types = new TreeSet<>();
        nodes.values().forEach(n -> types.add(n.classType()));
        return types;
    }

    /**
     * Copy of this graph with the input node's {@code image} input set.
     *
     * @throws GraphShapeException if zero or several input nodes exist
     */
    public WorkflowGraph withInputImage(String imageName) {
        WorkflowNode input = inputNode();
        ObjectNode copy = document.deepCopy();
        ObjectNode node = (ObjectNode) copy.get(input.id());
        ObjectNode inputs = node.has("inputs") ? (ObjectNode) node.get("inputs") : node.putObject("inputs");
        inputs.put("image", imageName);
        return new WorkflowGraph(copy, nodes);
    }

    /** The document to submit. Callers get a copy. */
    public ObjectNode document() {
        return document.deepCopy();
    }

    WorkflowNode inputNode() {
        List<WorkflowNode> matches = new ArrayList<>();
        for (WorkflowNode n : nodes.values()) {
            if (INPUT_NODE_TYPES.contains(n.classType())) matches.add(n);
        }
        if (matches.size() == 1) return matches.get(0);
        String problem = matches.isEmpty()
                ? "No input image node"
                : "Ambiguous input image node (" + matches.size() + " candidates: "
                  + matches.stream().map(WorkflowNode::id).toList() + ")";
        throw new GraphShapeException(problem + " among " + INPUT_NODE_TYPES
                + "; node types found: " + nodeTypes());
    }
}
