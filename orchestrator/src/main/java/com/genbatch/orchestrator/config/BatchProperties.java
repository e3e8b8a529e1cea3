package com.genbatch.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All knobs of a batch run, bound from {@code genbatch.*}.
 *
 * Typical override from the command line:
 * <pre>
 *   java -jar orchestrator.jar --genbatch.batch-dir=/data/batch5 \
 *        --genbatch.output-dir=/data/batch5/out --genbatch.parallel=true
 * </pre>
 */
@ConfigurationProperties(prefix = "genbatch")
public class BatchProperties {

    /** Directory holding one folder per character. */
    private String batchDir;

    /** Where artifacts, progress.json and manifest.json are written. */
    private String outputDir = "./output";

    /** Global scene filter: ALL, "a, b" or "NO a, NO b". */
    private String scenes = "ALL";

    /** Extra comma-separated exclusions applied after {@link #scenes}. */
    private String excludeScenes;

    /**
     * Characters to plan, each with an optional scene-filter override.
     * An empty value means "use the global scenes". Empty map = every folder.
     */
    private Map<String, String> characters = new LinkedHashMap<>();

    /** Scene catalog in its canonical order. */
    private Map<String, Scene> catalog = new LinkedHashMap<>();

    private boolean dryRun = false;
    private boolean resume = true;
    private boolean parallel = false;
    private int maxWorkers = 5;
    private Duration generationTimeout = Duration.ofSeconds(600);
    private String defaultArtifactExtension = ".mp4";
    private int estimatedMinutesPerJob = 7;

    private final Retry retry = new Retry();
    private final Protocol protocol = new Protocol();
    private final Worker worker = new Worker();
    private final RunPod runpod = new RunPod();
    private final Ssh ssh = new Ssh();

    public Path batchPath() {
        return batchDir == null ? null : Path.of(batchDir).toAbsolutePath().normalize();
    }

    public Path outputPath() {
        return Path.of(outputDir).toAbsolutePath().normalize();
    }

    public String getBatchDir() { return batchDir; }
    public void setBatchDir(String batchDir) { this.batchDir = batchDir; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public String getScenes() { return scenes; }
    public void setScenes(String scenes) { this.scenes = scenes; }

    public String getExcludeScenes() { return excludeScenes; }
    public void setExcludeScenes(String excludeScenes) { this.excludeScenes = excludeScenes; }

    public Map<String, String> getCharacters() { return characters; }
    public void setCharacters(Map<String, String> characters) { this.characters = characters; }

    public Map<String, Scene> getCatalog() { return catalog; }
    public void setCatalog(Map<String, Scene> catalog) { this.catalog = catalog; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public boolean isResume() { return resume; }
    public void setResume(boolean resume) { this.resume = resume; }

    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }

    public int getMaxWorkers() { return maxWorkers; }
    public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

    public Duration getGenerationTimeout() { return generationTimeout; }
    public void setGenerationTimeout(Duration generationTimeout) { this.generationTimeout = generationTimeout; }

    public String getDefaultArtifactExtension() { return defaultArtifactExtension; }
    public void setDefaultArtifactExtension(String ext) { this.defaultArtifactExtension = ext; }

    public int getEstimatedMinutesPerJob() { return estimatedMinutesPerJob; }
    public void setEstimatedMinutesPerJob(int minutes) { this.estimatedMinutesPerJob = minutes; }

    public Retry getRetry() { return retry; }
    public Protocol getProtocol() { return protocol; }
    public Worker getWorker() { return worker; }
    public RunPod getRunpod() { return runpod; }
    public Ssh getSsh() { return ssh; }

    // ------------------------------------------------------------------
    // Nested groups
    // ------------------------------------------------------------------

    public static class Scene {
        private String seed;
        private String workflow;

        public Scene() {}

        public Scene(String seed, String workflow) {
            this.seed = seed;
            this.workflow = workflow;
        }

        public String getSeed() { return seed; }
        public void setSeed(String seed) { this.seed = seed; }
        public String getWorkflow() { return workflow; }
        public void setWorkflow(String workflow) { this.workflow = workflow; }
    }

    /** Per-job retry policy. multiplier = 1.0 keeps the backoff fixed. */
    public static class Retry {
        private int maxRetries = 2;
        private Duration backoff = Duration.ofSeconds(5);
        private double multiplier = 1.0;
        private Duration maxBackoff = Duration.ofSeconds(60);
        private List<Integer> retryableStatusCodes = new ArrayList<>(List.of(404, 502, 503));

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
        public List<Integer> getRetryableStatusCodes() { return retryableStatusCodes; }
        public void setRetryableStatusCodes(List<Integer> codes) { this.retryableStatusCodes = codes; }
    }

    /** Timings of the generation service HTTP and WebSocket calls. */
    public static class Protocol {
        private boolean streaming = true;
        private Duration messageWait = Duration.ofSeconds(7);
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration uploadTimeout = Duration.ofSeconds(60);
        private Duration downloadTimeout = Duration.ofSeconds(120);
        private Duration healthTimeout = Duration.ofSeconds(10);

        public boolean isStreaming() { return streaming; }
        public void setStreaming(boolean streaming) { this.streaming = streaming; }
        public Duration getMessageWait() { return messageWait; }
        public void setMessageWait(Duration messageWait) { this.messageWait = messageWait; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public Duration getUploadTimeout() { return uploadTimeout; }
        public void setUploadTimeout(Duration uploadTimeout) { this.uploadTimeout = uploadTimeout; }
        public Duration getDownloadTimeout() { return downloadTimeout; }
        public void setDownloadTimeout(Duration downloadTimeout) { this.downloadTimeout = downloadTimeout; }
        public Duration getHealthTimeout() { return healthTimeout; }
        public void setHealthTimeout(Duration healthTimeout) { this.healthTimeout = healthTimeout; }
    }

    /** Worker lifecycle: provisioning, service start-up and teardown policy. */
    public static class Worker {
        /** Attach to this worker instead of creating one (forces a single partition). */
        private String existingId;
        /** Stop (resumable) instead of terminating at the end. */
        private boolean keep = false;
        /** Skip teardown entirely. */
        private boolean leaveRunning = false;
        private String namePrefix = "genbatch-worker";
        private Duration provisionTimeout = Duration.ofSeconds(300);
        private Duration provisionPollInterval = Duration.ofSeconds(10);
        private Duration startupTimeout = Duration.ofSeconds(300);
        private Duration startupPollInterval = Duration.ofSeconds(5);
        private String serviceDir = "/workspace/ComfyUI";
        private int servicePort = 8188;
        private String startupScript = "/workspace/start_comfyui.sh";
        private String startupLog = "/workspace/startup.log";
        private String serviceLog = "/workspace/comfyui.log";
        private List<String> workflowDirs = new ArrayList<>(List.of(
                "/workspace/ComfyUI/workflows_api",
                "/workspace/ComfyUI/user/default/workflows",
                "/workspace/ComfyUI/workflows"));
        /** Optional local directory searched for workflow files before the worker. */
        private String localWorkflowDir;

        public String getExistingId() { return existingId; }
        public void setExistingId(String existingId) { this.existingId = existingId; }
        public boolean isKeep() { return keep; }
        public void setKeep(boolean keep) { this.keep = keep; }
        public boolean isLeaveRunning() { return leaveRunning; }
        public void setLeaveRunning(boolean leaveRunning) { this.leaveRunning = leaveRunning; }
        public String getNamePrefix() { return namePrefix; }
        public void setNamePrefix(String namePrefix) { this.namePrefix = namePrefix; }
        public Duration getProvisionTimeout() { return provisionTimeout; }
        public void setProvisionTimeout(Duration provisionTimeout) { this.provisionTimeout = provisionTimeout; }
        public Duration getProvisionPollInterval() { return provisionPollInterval; }
        public void setProvisionPollInterval(Duration interval) { this.provisionPollInterval = interval; }
        public Duration getStartupTimeout() { return startupTimeout; }
        public void setStartupTimeout(Duration startupTimeout) { this.startupTimeout = startupTimeout; }
        public Duration getStartupPollInterval() { return startupPollInterval; }
        public void setStartupPollInterval(Duration interval) { this.startupPollInterval = interval; }
        public String getServiceDir() { return serviceDir; }
        public void setServiceDir(String serviceDir) { this.serviceDir = serviceDir; }
        public int getServicePort() { return servicePort; }
        public void setServicePort(int servicePort) { this.servicePort = servicePort; }
        public String getStartupScript() { return startupScript; }
        public void setStartupScript(String startupScript) { this.startupScript = startupScript; }
        public String getStartupLog() { return startupLog; }
        public void setStartupLog(String startupLog) { this.startupLog = startupLog; }
        public String getServiceLog() { return serviceLog; }
        public void setServiceLog(String serviceLog) { this.serviceLog = serviceLog; }
        public List<String> getWorkflowDirs() { return workflowDirs; }
        public void setWorkflowDirs(List<String> workflowDirs) { this.workflowDirs = workflowDirs; }
        public String getLocalWorkflowDir() { return localWorkflowDir; }
        public void setLocalWorkflowDir(String localWorkflowDir) { this.localWorkflowDir = localWorkflowDir; }
    }

    /** RunPod control plane and the pod template new workers are created from. */
    public static class RunPod {
        private String apiUrl = "https://api.runpod.io/graphql";
        private String apiKey;
        private String imageName = "runpod/comfyui:latest";
        private String gpuTypeId;
        private int gpuCount = 1;
        private int containerDiskGb = 150;
        private int volumeGb = 0;
        private String networkVolumeId;
        private String ports = "8188/http,22/tcp";
        private String dataCenterId;
        /** %s is replaced by the pod id. */
        private String proxyUrlTemplate = "https://%s-8188.proxy.runpod.net";

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getImageName() { return imageName; }
        public void setImageName(String imageName) { this.imageName = imageName; }
        public String getGpuTypeId() { return gpuTypeId; }
        public void setGpuTypeId(String gpuTypeId) { this.gpuTypeId = gpuTypeId; }
        public int getGpuCount() { return gpuCount; }
        public void setGpuCount(int gpuCount) { this.gpuCount = gpuCount; }
        public int getContainerDiskGb() { return containerDiskGb; }
        public void setContainerDiskGb(int containerDiskGb) { this.containerDiskGb = containerDiskGb; }
        public int getVolumeGb() { return volumeGb; }
        public void setVolumeGb(int volumeGb) { this.volumeGb = volumeGb; }
        public String getNetworkVolumeId() { return networkVolumeId; }
        public void setNetworkVolumeId(String networkVolumeId) { this.networkVolumeId = networkVolumeId; }
        public String getPorts() { return ports; }
        public void setPorts(String ports) { this.ports = ports; }
        public String getDataCenterId() { return dataCenterId; }
        public void setDataCenterId(String dataCenterId) { this.dataCenterId = dataCenterId; }
        public String getProxyUrlTemplate() { return proxyUrlTemplate; }
        public void setProxyUrlTemplate(String proxyUrlTemplate) { this.proxyUrlTemplate = proxyUrlTemplate; }
    }

    public static class Ssh {
        private String user = "root";
        private String keyPath = "~/.ssh/id_ed25519";
        private Duration uploadTimeout = Duration.ofSeconds(120);
        private Duration downloadTimeout = Duration.ofSeconds(300);

        public String getUser() { return user; }
        public void setUser(String user) { this.user = user; }
        public String getKeyPath() { return keyPath; }
        public void setKeyPath(String keyPath) { this.keyPath = keyPath; }
        public Duration getUploadTimeout() { return uploadTimeout; }
        public void setUploadTimeout(Duration uploadTimeout) { this.uploadTimeout = uploadTimeout; }
        public Duration getDownloadTimeout() { return downloadTimeout; }
        public void setDownloadTimeout(Duration downloadTimeout) { this.downloadTimeout = downloadTimeout; }
    }
}
