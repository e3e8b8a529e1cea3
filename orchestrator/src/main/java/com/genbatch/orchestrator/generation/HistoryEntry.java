package com.genbatch.orchestrator.generation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Completion record of one request, read from the history endpoint.
 *
 * Only the fields the orchestrator needs are interpreted; the raw node is
 * kept for error messages.
 */
public record HistoryEntry(String requestId, JsonNode raw) {

    private static final List<String> OUTPUT_KINDS = List.of("gifs", "images", "videos");

    public boolean isCompleted() {
        return raw.path("status").path("completed").asBoolean(false);
    }

    public boolean hasOutputs() {
        return raw.has("outputs");
    }

    public boolean isError() {
        return "error".equals(raw.path("status").path("status_str").asText(null));
    }

    /** Status block, truncated for log and error messages. */
    public String statusDetail() {
        String s = raw.path("status").toString();
        return s.length() > 500 ? s.substring(0, 500) : s;
    }

    /** Every produced file in output order: per node, gifs then images then videos. */
    public List<ArtifactRef> artifacts() {
        List<ArtifactRef> files = new ArrayList<>();
        JsonNode outputs = raw.path("outputs");
        for (Iterator<JsonNode> nodes = outputs.elements(); nodes.hasNext(); ) {
            JsonNode node = nodes.next();
            for (String kind : OUTPUT_KINDS) {
                for (JsonNode item : node.path(kind)) {
                    if (item.isObject() && item.hasNonNull("filename")) {
                        files.add(new ArtifactRef(
                                item.get("filename").asText(),
                                item.path("subfolder").asText(""),
                                item.path("type").asText("output")));
                    }
                }
            }
        }
        return files;
    }

    /** The workflow's final output: the last listed file. */
    public Optional<ArtifactRef> finalArtifact() {
        List<ArtifactRef> files = artifacts();
        return files.isEmpty() ? Optional.empty() : Optional.of(files.get(files.size() - 1));
    }
}
