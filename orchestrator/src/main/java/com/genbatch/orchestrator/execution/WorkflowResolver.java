package com.genbatch.orchestrator.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.generation.WorkflowGraph;
import com.genbatch.orchestrator.job.NotFoundException;
import com.genbatch.orchestrator.model.WorkerContext;
import com.genbatch.orchestrator.worker.RemoteShell;
import com.genbatch.orchestrator.worker.ShellResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds and loads workflow graphs for one worker.
 *
 * Lookup order for a reference:
 * <ol>
 *   <li>the local workflow directory, when configured</li>
 *   <li>an absolute path on the worker, used as is</li>
 *   <li>each known remote workflow directory</li>
 *   <li>a recursive search under the service directory</li>
 * </ol>
 * Parsed graphs are cached for the lifetime of the resolver (one partition).
 */
public class WorkflowResolver {

    private static final Logger log = LoggerFactory.getLogger(WorkflowResolver.class);

    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(15);

    private final Path         localDir;
    private final List<String> remoteDirs;
    private final String       serviceDir;
    private final ObjectMapper json;

    private final Map<String, WorkflowGraph> cache = new HashMap<>();

    public WorkflowResolver(Path localDir, List<String> remoteDirs, String serviceDir, ObjectMapper json) {
        this.localDir   = localDir;
        this.remoteDirs = List.copyOf(remoteDirs);
        this.serviceDir = serviceDir;
        this.json       = json;
    }

    /**
     * @throws NotFoundException            if the workflow exists nowhere
     * @throws com.genbatch.orchestrator.generation.GraphShapeException if it is not an API-format graph
     */
    public WorkflowGraph load(WorkerContext ctx, String workflowRef, RemoteShell shell) {
        WorkflowGraph cached = cache.get(workflowRef);
        if (cached != null) return cached;

        Optional<Path> local = findLocal(workflowRef);
        WorkflowGraph graph;
        if (local.isPresent()) {
            log.info("[{}]   Workflow: {} (local)", ctx.label(), local.get());
            graph = WorkflowGraph.parse(json, readLocal(local.get()));
        } else {
            String remote = findRemote(workflowRef, shell)
                    .orElseThrow(() -> new NotFoundException("Workflow '" + workflowRef
                            + "' not found locally or on the worker"));
            log.info("[{}]   Workflow: {}", ctx.label(), remote);
            ShellResult cat = shell.exec("cat '" + remote + "'", LOOKUP_TIMEOUT);
            if (!cat.ok()) {
                throw new NotFoundException("Cannot read workflow " + remote + ": " + cat.stderr().trim());
            }
            graph = WorkflowGraph.parse(json, cat.stdout());
        }
        cache.put(workflowRef, graph);
        return graph;
    }

    private Optional<Path> findLocal(String workflowRef) {
        if (localDir == null) return Optional.empty();
        String fileName = workflowRef.substring(workflowRef.lastIndexOf('/') + 1);
        Path candidate = localDir.resolve(fileName);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private Optional<String> findRemote(String workflowRef, RemoteShell shell) {
        if (workflowRef.startsWith("/")) return Optional.of(workflowRef);
        for (String dir : remoteDirs) {
            String path = dir + "/" + workflowRef;
            if (shell.exec("test -f '" + path + "' && echo found", LOOKUP_TIMEOUT).stdout().contains("found")) {
                return Optional.of(path);
            }
        }
        String found = shell.exec("find " + serviceDir + " -name '" + workflowRef
                + "' -type f 2>/dev/null | head -1", LOOKUP_TIMEOUT).stdout().trim();
        return found.isEmpty() ? Optional.empty() : Optional.of(found);
    }

    private static String readLocal(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read workflow " + file, e);
        }
    }
}
