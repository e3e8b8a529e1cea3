package com.genbatch.orchestrator.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.config.BatchProperties;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunPodControlPlaneTest {

    private final ObjectMapper json = new ObjectMapper();

    HttpServer server;
    BatchProperties.RunPod settings;
    RunPodControlPlane controlPlane;

    final AtomicReference<String> reply = new AtomicReference<>("{\"data\": {}}");
    final List<String> queries = new CopyOnWriteArrayList<>();
    final List<String> authHeaders = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/graphql", ex -> {
            queries.add(json.readTree(ex.getRequestBody()).path("query").asText());
            authHeaders.add(ex.getRequestHeaders().getFirst("Authorization"));
            byte[] out = reply.get().getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(200, out.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();

        settings = new BatchProperties.RunPod();
        settings.setApiUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/graphql");
        settings.setApiKey("secret");
        settings.setGpuTypeId("NVIDIA RTX 4090");
        settings.setNetworkVolumeId("");
        controlPlane = new RunPodControlPlane(
                HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), json, settings);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void create_sendsTemplateAndReturnsPodId() {
        reply.set("{\"data\": {\"podFindAndDeployOnDemand\": {\"id\": \"pod-1\", \"machine\": {\"gpuDisplayName\": \"RTX 4090\"}}}}");

        assertThat(controlPlane.create(new WorkerSpec("genbatch-worker-1"))).isEqualTo("pod-1");

        assertThat(queries.get(0))
                .contains("name: \"genbatch-worker-1\"")
                .contains("gpuTypeId: \"NVIDIA RTX 4090\"")
                .contains("ports: \"8188/http,22/tcp\"")
                .doesNotContain("networkVolumeId")
                .doesNotContain("dataCenterId");
        assertThat(authHeaders.get(0)).isEqualTo("Bearer secret");
    }

    @Test
    void create_noPodReturned_throws() {
        reply.set("{\"data\": {\"podFindAndDeployOnDemand\": null}}");

        assertThatThrownBy(() -> controlPlane.create(new WorkerSpec("w")))
                .isInstanceOf(ControlPlaneException.class)
                .hasMessageContaining("no capacity");
    }

    @Test
    void status_parsesRuntimeAndSshPort() {
        reply.set("""
                {"data": {"pod": {"id": "pod-1", "desiredStatus": "RUNNING",
                  "runtime": {"uptimeInSeconds": 30, "ports": [
                    {"ip": "10.0.0.2", "isIpPublic": false, "privatePort": 22, "publicPort": 22, "type": "tcp"},
                    {"ip": "203.0.113.7", "isIpPublic": true, "privatePort": 22, "publicPort": 40022, "type": "tcp"}
                  ]}}}}
                """);

        WorkerStatus status = controlPlane.status("pod-1").orElseThrow();

        assertThat(status.isRunning()).isTrue();
        assertThat(status.sshEndpoint()).contains(new WorkerStatus.SshEndpoint("203.0.113.7", 40022));
    }

    @Test
    void status_unknownPod_empty() {
        reply.set("{\"data\": {\"pod\": null}}");

        assertThat(controlPlane.status("pod-x")).isEqualTo(Optional.empty());
    }

    @Test
    void graphqlErrors_failEvenWithHttp200() {
        reply.set("{\"errors\": [{\"message\": \"pod not found\"}]}");

        assertThatThrownBy(() -> controlPlane.terminate("pod-1"))
                .isInstanceOf(ControlPlaneException.class)
                .hasMessageContaining("pod not found");
    }

    @Test
    void missingApiKey_failsWithoutCalling() {
        settings.setApiKey(" ");

        assertThatThrownBy(() -> controlPlane.stop("pod-1"))
                .isInstanceOf(ControlPlaneException.class)
                .hasMessageContaining("API key");
        assertThat(queries).isEmpty();
    }

    @Test
    void serviceUrl_fromTemplate() {
        assertThat(controlPlane.serviceUrl("abc")).isEqualTo("https://abc-8188.proxy.runpod.net");
    }
}
