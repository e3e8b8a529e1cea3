package com.genbatch.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.Sleeper;
import com.genbatch.orchestrator.execution.ErrorClassifier;
import com.genbatch.orchestrator.execution.RetryPolicy;
import com.genbatch.orchestrator.generation.GenerationClientFactory;
import com.genbatch.orchestrator.job.SceneCatalog;
import com.genbatch.orchestrator.progress.ProgressLedger;
import com.genbatch.orchestrator.worker.ControlPlane;
import com.genbatch.orchestrator.worker.RemoteShell;
import com.genbatch.orchestrator.worker.RunPodControlPlane;
import com.genbatch.orchestrator.worker.SshRemoteShell;
import com.genbatch.orchestrator.worker.WorkerControllerFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.HashSet;

/**
 * Infrastructure and adapter beans built from {@link BatchProperties}. The
 * batch services themselves are components with constructor injection.
 */
@Configuration
@EnableConfigurationProperties(BatchProperties.class)
public class OrchestratorConfig {

    // ------------------------------------------------------------------
    // Infrastructure
    // ------------------------------------------------------------------

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    HttpClient httpClient(BatchProperties props) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(props.getProtocol().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    // ------------------------------------------------------------------
    // Planning and progress
    // ------------------------------------------------------------------

    @Bean
    SceneCatalog sceneCatalog(BatchProperties props) {
        return SceneCatalog.from(props.getCatalog());
    }

    @Bean
    ProgressLedger progressLedger(BatchProperties props, Clock clock) {
        return new ProgressLedger(props.outputPath(), clock);
    }

    // ------------------------------------------------------------------
    // Worker adapters and retry policy
    // ------------------------------------------------------------------

    @Bean
    ControlPlane controlPlane(HttpClient http, ObjectMapper json, BatchProperties props) {
        return new RunPodControlPlane(http, json, props.getRunpod());
    }

    @Bean
    GenerationClientFactory generationClientFactory(HttpClient http, ObjectMapper json,
                                                    BatchProperties props, Clock clock, Sleeper sleeper) {
        return new GenerationClientFactory(http, json, props.getProtocol(), clock, sleeper);
    }

    @Bean
    WorkerControllerFactory workerControllerFactory(ControlPlane controlPlane, GenerationClientFactory clients,
                                                    BatchProperties props, Clock clock, Sleeper sleeper) {
        RemoteShell.Factory shells = endpoint -> new SshRemoteShell(endpoint, props.getSsh());
        return new WorkerControllerFactory(controlPlane, shells, clients, props.getWorker(), clock, sleeper);
    }

    @Bean
    ErrorClassifier errorClassifier(BatchProperties props) {
        return new ErrorClassifier(new HashSet<>(props.getRetry().getRetryableStatusCodes()));
    }

    @Bean
    RetryPolicy retryPolicy(BatchProperties props) {
        return RetryPolicy.from(props.getRetry());
    }
}
