package com.genbatch.orchestrator.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genbatch.orchestrator.Sleeper;
import com.genbatch.orchestrator.config.BatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * HTTP client for the generation service running on one worker.
 *
 * Wraps the service endpoints with typed Java methods:
 * <pre>
 *   GET  /system_stats          health
 *   POST /upload/image          multipart seed upload → {name}
 *   POST /prompt                {prompt, client_id} → {prompt_id}
 *   GET  /history/{id}          completion record
 *   GET  /view?filename&amp;subfolder&amp;type   artifact bytes
 *   POST /queue                 {"clear": true}
 * </pre>
 * One instance per worker; calls are blocking and made from that worker's loop.
 */
public class GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(GenerationClient.class);

    private final String                   baseUrl;
    private final HttpClient               http;
    private final ObjectMapper             json;
    private final BatchProperties.Protocol settings;
    private final CompletionWaiter         waiter;

    public GenerationClient(String baseUrl, HttpClient http, ObjectMapper json,
                            BatchProperties.Protocol settings, Clock clock, Sleeper sleeper) {
        this.baseUrl  = stripTrailingSlash(baseUrl);
        this.http     = http;
        this.json     = json;
        this.settings = settings;

        List<CompletionBackend> backends = new ArrayList<>();
        if (settings.isStreaming()) {
            backends.add(new StreamingCompletionBackend(
                    WebSocketEventStream.factory(http, this.baseUrl, settings.getConnectTimeout()),
                    json, settings.getMessageWait(), clock));
        }
        backends.add(new PollingCompletionBackend(settings.getPollInterval(), clock, sleeper));
        this.waiter = new CompletionWaiter(backends, clock);
    }

    public String baseUrl() {
        return baseUrl;
    }

    // ------------------------------------------------------------------
    // Health and queue
    // ------------------------------------------------------------------

    /** True if the service answers its stats endpoint with 200. Never throws. */
    public boolean isHealthy() {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/system_stats"))
                    .timeout(settings.getHealthTimeout())
                    .GET()
                    .build();
            return http.send(req, HttpResponse.BodyHandlers.discarding()).statusCode() == 200;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.debug("Health probe of {} failed: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    /** Drop everything pending in the service queue. */
    public void clearQueue() {
        ObjectNode body = json.createObjectNode().put("clear", true);
        post("/queue", toJson(body), "clearQueue", settings.getRequestTimeout());
    }

    // ------------------------------------------------------------------
    // Job operations
    // ------------------------------------------------------------------

    /**
     * Upload a seed image, overwriting any previous file of the same name.
     *
     * @return the name the service stored it under
     */
    public String upload(Path file, String name) {
        String boundary = "----genbatch" + UUID.randomUUID().toString().replace("-", "");
        byte[] body;
        try {
            body = multipart(boundary, name, Files.readAllBytes(file));
        } catch (IOException e) {
            throw new GenerationException("Cannot read " + file, e);
        }
        String resp = send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/upload/image"))
                        .timeout(settings.getUploadTimeout())
                        .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                        .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                        .build(),
                "upload " + name);
        return readTree(resp, "upload").path("name").asText(name);
    }

    /**
     * Queue a graph for execution.
     *
     * @return the request id assigned by the service
     * @throws GenerationHttpException on a non-200 answer; per-node errors are in the message
     */
    public String submit(ObjectNode graph, String correlationId) {
        ObjectNode body = json.createObjectNode();
        body.set("prompt", graph);
        body.put("client_id", correlationId);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/prompt"))
                .timeout(settings.getRequestTimeout())
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();
        HttpResponse<String> resp = exchange(req, "submit");
        if (resp.statusCode() != 200) {
            throw new GenerationHttpException(resp.statusCode(),
                    "submit failed - HTTP " + resp.statusCode() + ": " + submitErrorDetail(resp.body()));
        }
        JsonNode id = readTree(resp.body(), "submit").path("prompt_id");
        if (!id.isTextual() || id.asText().isEmpty()) {
            throw new GenerationException("submit returned no prompt_id: " + truncate(resp.body()));
        }
        return id.asText();
    }

    /** Completion record of a request; empty while the service has none. */
    public Optional<HistoryEntry> history(String requestId) {
        String resp = get("/history/" + encode(requestId), "history " + requestId);
        JsonNode entry = readTree(resp, "history").get(requestId);
        return entry == null || entry.isNull()
                ? Optional.empty()
                : Optional.of(new HistoryEntry(requestId, entry));
    }

    /**
     * Block until the request finishes, streaming first and polling as fallback.
     *
     * @throws GenerationFailedException  on an execution error
     * @throws GenerationTimeoutException when {@code timeout} passes
     */
    public HistoryEntry awaitCompletion(String label, String requestId, String correlationId, Duration timeout) {
        return waiter.await(label, requestId, correlationId, timeout, CompletionCheck.history(this, requestId));
    }

    public byte[] fetchArtifact(ArtifactRef ref) {
        String query = "filename=" + encode(ref.filename())
                + "&subfolder=" + encode(ref.subfolder())
                + "&type=" + encode(ref.kind());
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/view?" + query))
                .timeout(settings.getDownloadTimeout())
                .GET()
                .build();
        try {
            HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new GenerationHttpException(resp.statusCode(),
                        "fetch " + ref.filename() + " failed - HTTP " + resp.statusCode());
            }
            return resp.body();
        } catch (GenerationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("fetch " + ref.filename() + " interrupted", e);
        } catch (Exception e) {
            throw new GenerationException("fetch " + ref.filename() + " failed", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String get(String path, String opName) {
        return send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .timeout(settings.getRequestTimeout())
                        .header("Accept", "application/json")
                        .GET()
                        .build(),
                opName);
    }

    private String post(String path, String jsonBody, String opName, Duration timeout) {
        return send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .timeout(timeout)
                        .header("Content-Type", "application/json")
                        .header("Accept",       "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                        .build(),
                opName);
    }

    /** Send and require a 2xx status; returns the body. */
    private String send(HttpRequest req, String opName) {
        HttpResponse<String> resp = exchange(req, opName);
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new GenerationHttpException(resp.statusCode(),
                    opName + " failed - HTTP " + resp.statusCode() + ": " + truncate(resp.body()));
        }
        return resp.body();
    }

    private HttpResponse<String> exchange(HttpRequest req, String opName) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(opName + " interrupted", e);
        } catch (IOException e) {
            throw new GenerationException(opName + " failed", e);
        }
    }

    private String submitErrorDetail(String body) {
        try {
            JsonNode node = json.readTree(body);
            if (node.has("node_errors") && node.get("node_errors").size() > 0) {
                return truncate(node.path("error").toString() + " node_errors: " + node.get("node_errors"));
            }
        } catch (JsonProcessingException e) {
            log.debug("submit error body is not JSON");
        }
        return truncate(body);
    }

    private byte[] multipart(String boundary, String name, byte[] content) {
        String contentType = name.toLowerCase().endsWith(".png") ? "image/png"
                : name.toLowerCase().matches(".*\\.jpe?g") ? "image/jpeg"
                : "application/octet-stream";
        ByteArrayOutputStream out = new ByteArrayOutputStream(content.length + 512);
        write(out, "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"image\"; filename=\"" + name + "\"\r\n"
                + "Content-Type: " + contentType + "\r\n\r\n");
        out.writeBytes(content);
        write(out, "\r\n--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"overwrite\"\r\n\r\n"
                + "true\r\n"
                + "--" + boundary + "--\r\n");
        return out.toByteArray();
    }

    private static void write(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
    }

    private JsonNode readTree(String body, String opName) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new GenerationException("JSON serialization failed", e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() > 500 ? s.substring(0, 500) : s;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
