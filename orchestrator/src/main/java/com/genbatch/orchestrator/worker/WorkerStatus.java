package com.genbatch.orchestrator.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Control-plane view of a worker.
 *
 * @param desiredState e.g. RUNNING, EXITED, TERMINATED
 * @param runtime      present only while the container actually runs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerStatus(@JsonProperty("desiredStatus") String desiredState, Runtime runtime) {

    public static final String RUNNING = "RUNNING";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Runtime(Long uptimeInSeconds, List<Port> ports) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Port(String ip, @JsonProperty("isIpPublic") boolean isIpPublic, int privatePort, int publicPort, String type) {}

    public record SshEndpoint(String host, int port) {
        @Override
        public String toString() {
            return host + ":" + port;
        }
    }

    public boolean isRunning() {
        return RUNNING.equals(desiredState) && runtime != null;
    }

    /** Public mapping of the container's port 22. */
    public Optional<SshEndpoint> sshEndpoint() {
        if (runtime == null || runtime.ports() == null) return Optional.empty();
        return runtime.ports().stream()
                .filter(p -> p.privatePort() == 22 && p.isIpPublic())
                .findFirst()
                .map(p -> new SshEndpoint(p.ip(), p.publicPort()));
    }
}
