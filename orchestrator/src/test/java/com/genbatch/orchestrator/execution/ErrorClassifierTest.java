package com.genbatch.orchestrator.execution;

import com.genbatch.orchestrator.generation.GenerationException;
import com.genbatch.orchestrator.generation.GenerationFailedException;
import com.genbatch.orchestrator.generation.GenerationHttpException;
import com.genbatch.orchestrator.generation.GenerationTimeoutException;
import com.genbatch.orchestrator.generation.GraphShapeException;
import com.genbatch.orchestrator.job.NotFoundException;
import com.genbatch.orchestrator.worker.RemoteShellException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier(Set.of(404, 502, 503));

    @Test
    void retryableHttpStatus_transient() {
        assertThat(classifier.classify(new GenerationHttpException(503, "busy"), () -> true))
                .isInstanceOf(Outcome.Transient.class);
        assertThat(classifier.classify(new GenerationHttpException(404, "proxy not ready"), () -> true))
                .isInstanceOf(Outcome.Transient.class);
    }

    @Test
    void otherHttpStatus_terminal() {
        assertThat(classifier.classify(new GenerationHttpException(400, "bad prompt"), () -> false))
                .isInstanceOf(Outcome.Terminal.class);
    }

    @Test
    void timeoutsExecutionErrorsAndShellFailures_transient() {
        assertThat(classifier.classify(new GenerationTimeoutException("t"), () -> true))
                .isInstanceOf(Outcome.Transient.class);
        assertThat(classifier.classify(new GenerationFailedException("OOM"), () -> true))
                .isInstanceOf(Outcome.Transient.class);
        assertThat(classifier.classify(new RemoteShellException("refused"), () -> true))
                .isInstanceOf(Outcome.Transient.class);
    }

    @Test
    void ioCauseAnywhereInChain_transient() {
        Exception e = new GenerationException("submit failed", new ConnectException("refused"));

        Outcome outcome = classifier.classify(e, () -> true);

        assertThat(outcome).isInstanceOf(Outcome.Transient.class);
        assertThat(((Outcome.Transient) outcome).reason()).isEqualTo("submit failed: refused");
    }

    @Test
    void shapeMissingWorkflowNoArtifactAndLocalWrite_terminal() {
        assertThat(classifier.classify(new GraphShapeException("no LoadImage"), () -> false))
                .isInstanceOf(Outcome.Terminal.class);
        assertThat(classifier.classify(new NotFoundException("no workflow"), () -> false))
                .isInstanceOf(Outcome.Terminal.class);
        assertThat(classifier.classify(new NoArtifactException("empty"), () -> false))
                .isInstanceOf(Outcome.Terminal.class);
        assertThat(classifier.classify(new ArtifactWriteException("disk full", new IOException("ENOSPC")), () -> false))
                .isInstanceOf(Outcome.Terminal.class);
    }

    @Test
    void unknownError_dependsOnWorkerHealth() {
        Exception e = new IllegalStateException("weird");

        assertThat(classifier.classify(e, () -> true)).isInstanceOf(Outcome.Terminal.class);
        Outcome unhealthy = classifier.classify(e, () -> false);
        assertThat(unhealthy).isInstanceOf(Outcome.Transient.class);
        assertThat(((Outcome.Transient) unhealthy).reason()).endsWith("(worker unhealthy)");
    }
}
