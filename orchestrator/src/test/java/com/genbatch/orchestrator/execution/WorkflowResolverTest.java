package com.genbatch.orchestrator.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.generation.WorkflowGraph;
import com.genbatch.orchestrator.job.NotFoundException;
import com.genbatch.orchestrator.model.WorkerContext;
import com.genbatch.orchestrator.worker.RemoteShell;
import com.genbatch.orchestrator.worker.ShellResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowResolverTest {

    private static final String GRAPH = "{\"1\": {\"class_type\": \"LoadImage\", \"inputs\": {}}}";
    private static final WorkerContext CTX = WorkerContext.of(0, List.of("alice/idle"), 1);

    private final ObjectMapper json = new ObjectMapper();

    @Mock RemoteShell shell;

    @TempDir Path localDir;

    @Test
    void load_localFileWins() throws IOException {
        Files.writeString(localDir.resolve("idle-api.json"), GRAPH);
        WorkflowResolver resolver = new WorkflowResolver(localDir, List.of("/workspace/flows"), "/workspace/svc", json);

        WorkflowGraph graph = resolver.load(CTX, "idle-api.json", shell);

        assertThat(graph.nodeTypes()).containsExactly("LoadImage");
        verifyNoInteractions(shell);
    }

    @Test
    void load_remoteDirectoryThenCached() {
        WorkflowResolver resolver = new WorkflowResolver(null,
                List.of("/workspace/a", "/workspace/b"), "/workspace/svc", json);
        when(shell.exec(eq("test -f '/workspace/a/idle-api.json' && echo found"), any()))
                .thenReturn(new ShellResult(1, "", ""));
        when(shell.exec(eq("test -f '/workspace/b/idle-api.json' && echo found"), any()))
                .thenReturn(new ShellResult(0, "found\n", ""));
        when(shell.exec(eq("cat '/workspace/b/idle-api.json'"), any()))
                .thenReturn(new ShellResult(0, GRAPH, ""));

        WorkflowGraph first = resolver.load(CTX, "idle-api.json", shell);
        WorkflowGraph second = resolver.load(CTX, "idle-api.json", shell);

        assertThat(second).isSameAs(first);
        verify(shell, times(1)).exec(eq("cat '/workspace/b/idle-api.json'"), any());
    }

    @Test
    void load_absolutePath_readDirectly() {
        WorkflowResolver resolver = new WorkflowResolver(null, List.of("/workspace/a"), "/workspace/svc", json);
        when(shell.exec(eq("cat '/data/custom-api.json'"), any())).thenReturn(new ShellResult(0, GRAPH, ""));

        assertThat(resolver.load(CTX, "/data/custom-api.json", shell).nodes()).hasSize(1);
    }

    @Test
    void load_foundBySearch() {
        WorkflowResolver resolver = new WorkflowResolver(null, List.of(), "/workspace/svc", json);
        when(shell.exec(startsWith("find /workspace/svc"), any()))
                .thenReturn(new ShellResult(0, "/workspace/svc/user/idle-api.json\n", ""));
        when(shell.exec(eq("cat '/workspace/svc/user/idle-api.json'"), any()))
                .thenReturn(new ShellResult(0, GRAPH, ""));

        assertThat(resolver.load(CTX, "idle-api.json", shell).nodes()).hasSize(1);
    }

    @Test
    void load_nowhere_notFound() {
        WorkflowResolver resolver = new WorkflowResolver(null, List.of(), "/workspace/svc", json);
        when(shell.exec(startsWith("find"), any())).thenReturn(new ShellResult(0, "", ""));

        assertThatThrownBy(() -> resolver.load(CTX, "nope-api.json", shell))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("nope-api.json");
    }
}
