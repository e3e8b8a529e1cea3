package com.genbatch.orchestrator.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.config.BatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ControlPlane} backed by the RunPod GraphQL API.
 *
 * Every call is a single POST of {@code {"query": ...}}; a response with an
 * {@code errors} array is a failure even when the HTTP status is 200.
 */
public class RunPodControlPlane implements ControlPlane {

    private static final Logger log = LoggerFactory.getLogger(RunPodControlPlane.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient             http;
    private final ObjectMapper           json;
    private final BatchProperties.RunPod settings;

    public RunPodControlPlane(HttpClient http, ObjectMapper json, BatchProperties.RunPod settings) {
        this.http     = http;
        this.json     = json;
        this.settings = settings;
    }

    // ------------------------------------------------------------------
    // ControlPlane
    // ------------------------------------------------------------------

    @Override
    public String create(WorkerSpec spec) {
        StringBuilder input = new StringBuilder()
                .append("name: ").append(quote(spec.name()))
                .append(" imageName: ").append(quote(settings.getImageName()))
                .append(" gpuTypeId: ").append(quote(settings.getGpuTypeId()))
                .append(" gpuCount: ").append(settings.getGpuCount())
                .append(" containerDiskInGb: ").append(settings.getContainerDiskGb())
                .append(" volumeInGb: ").append(settings.getVolumeGb())
                .append(" ports: ").append(quote(settings.getPorts()));
        if (isSet(settings.getNetworkVolumeId())) {
            input.append(" networkVolumeId: ").append(quote(settings.getNetworkVolumeId()));
        }
        if (isSet(settings.getDataCenterId())) {
            input.append(" dataCenterId: ").append(quote(settings.getDataCenterId()));
        }
        String mutation = "mutation { podFindAndDeployOnDemand(input: {" + input + "}) "
                + "{ id name desiredStatus machine { gpuDisplayName } } }";

        JsonNode pod = graphql(mutation, "create " + spec.name()).path("podFindAndDeployOnDemand");
        if (!pod.hasNonNull("id")) {
            throw new ControlPlaneException("create " + spec.name() + " returned no pod (no capacity?)");
        }
        log.debug("Pod {} deployed on {}", pod.get("id").asText(),
                pod.path("machine").path("gpuDisplayName").asText("?"));
        return pod.get("id").asText();
    }

    @Override
    public Optional<WorkerStatus> status(String workerId) {
        String query = "query { pod(input: {podId: " + quote(workerId) + "}) { id desiredStatus "
                + "runtime { uptimeInSeconds ports { ip isIpPublic privatePort publicPort type } } } }";
        JsonNode pod = graphql(query, "status " + workerId).path("pod");
        if (pod.isMissingNode() || pod.isNull()) return Optional.empty();
        try {
            return Optional.of(json.treeToValue(pod, WorkerStatus.class));
        } catch (JsonProcessingException e) {
            throw new ControlPlaneException("Failed to parse status of " + workerId, e);
        }
    }

    @Override
    public void resume(String workerId) {
        graphql("mutation { podResume(input: {podId: " + quote(workerId) + ", gpuCount: "
                + settings.getGpuCount() + "}) { id desiredStatus } }", "resume " + workerId);
    }

    @Override
    public void stop(String workerId) {
        graphql("mutation { podStop(input: {podId: " + quote(workerId) + "}) { id desiredStatus } }",
                "stop " + workerId);
    }

    @Override
    public void terminate(String workerId) {
        graphql("mutation { podTerminate(input: {podId: " + quote(workerId) + "}) }",
                "terminate " + workerId);
    }

    @Override
    public String serviceUrl(String workerId) {
        return String.format(settings.getProxyUrlTemplate(), workerId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** POST a GraphQL document; returns the {@code data} node. */
    private JsonNode graphql(String document, String opName) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new ControlPlaneException(opName + " failed - no RunPod API key configured");
        }
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(settings.getApiUrl()))
                    .timeout(TIMEOUT)
                    .header("Content-Type",  "application/json")
                    .header("Authorization", "Bearer " + settings.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(
                            json.writeValueAsString(Map.of("query", document))))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ControlPlaneException(
                        opName + " failed - HTTP " + resp.statusCode() + ": " + resp.body());
            }
            JsonNode root = json.readTree(resp.body());
            if (root.has("errors")) {
                throw new ControlPlaneException(opName + " failed - " + root.get("errors"));
            }
            return root.path("data");
        } catch (ControlPlaneException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControlPlaneException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ControlPlaneException(opName + " failed", e);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static String quote(String value) {
        String v = value == null ? "" : value;
        return "\"" + v.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
