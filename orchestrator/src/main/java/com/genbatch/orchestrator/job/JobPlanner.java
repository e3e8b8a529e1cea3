package com.genbatch.orchestrator.job;

import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.model.CharacterAssets;
import com.genbatch.orchestrator.model.Job;
import com.genbatch.orchestrator.model.SceneDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns a batch directory plus a scene selection into the list of jobs to run.
 *
 * Planning happens once, before any worker is provisioned. Everything that is
 * wrong with the input at this point is either fatal ({@link ValidationException},
 * {@link NotFoundException}) or a warning. A character missing one seed image
 * only loses the scenes that need it.
 */
@Service
public class JobPlanner {

    private static final Logger log = LoggerFactory.getLogger(JobPlanner.class);

    private final SceneCatalog catalog;
    private final Path         outputDir;

    public JobPlanner(SceneCatalog catalog, BatchProperties props) {
        this.catalog   = catalog;
        this.outputDir = props.outputPath();
    }

    public SceneCatalog catalog() {
        return catalog;
    }

    // ------------------------------------------------------------------
    // Full planning pass
    // ------------------------------------------------------------------

    /**
     * Discover, select, filter and build.
     *
     * @param selection per-character scene overrides; when non-empty only the
     *                  listed characters are planned (blank value = global scenes)
     */
    public JobPlan plan(Path batchDir, String sceneSpec, String excludeSpec,
                        Map<String, String> selection) {
        List<String> warnings = new ArrayList<>();
        List<CharacterAssets> characters = selectCharacters(
                discoverCharacters(batchDir), selection, batchDir, warnings);
        List<String> scenes = resolveSceneFilter(sceneSpec, excludeSpec);

        JobPlan built = buildJobs(characters, scenes, selection);
        warnings.addAll(built.warnings());

        if (built.jobs().isEmpty()) {
            throw new ValidationException("No jobs to run: scenes [" + String.join(", ", scenes)
                    + "] produced nothing for " + characters.size() + " character(s)");
        }
        log.info("Planned {} job(s) for {} character(s), {} warning(s)",
                built.jobs().size(), characters.size(), warnings.size());
        return new JobPlan(characters, scenes, built.jobs(), warnings);
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    /**
     * Character folders under {@code root}, sorted by name. A folder qualifies
     * when it holds at least one seed file named by the catalog.
     *
     * @throws NotFoundException if {@code root} is not a directory or nothing qualifies
     */
    public List<CharacterAssets> discoverCharacters(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new NotFoundException("Batch directory not found: " + root);
        }
        Set<String> seedFiles = catalog.seedFiles();
        List<CharacterAssets> characters = new ArrayList<>();
        try (Stream<Path> children = Files.list(root)) {
            for (Path dir : children.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList()) {
                Set<String> present = new LinkedHashSet<>();
                for (String seed : seedFiles) {
                    if (Files.isRegularFile(dir.resolve(seed))) present.add(seed);
                }
                if (!present.isEmpty()) {
                    characters.add(new CharacterAssets(dir.getFileName().toString(), dir, present));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan batch directory " + root, e);
        }
        if (characters.isEmpty()) {
            throw new NotFoundException("No character folders with seed images ("
                    + String.join(", ", seedFiles) + ") under " + root);
        }
        return characters;
    }

    /**
     * Resolve the global scene selection, then subtract the extra exclusion list.
     *
     * @throws ValidationException on an unknown scene name
     */
    public List<String> resolveSceneFilter(String spec, String extraExclusions) {
        List<String> scenes = SceneFilter.parse(spec).resolve(catalog);
        return SceneFilter.exclusions(extraExclusions).applyTo(scenes, catalog);
    }

    public List<String> resolveSceneFilter(String spec) {
        return resolveSceneFilter(spec, null);
    }

    /**
     * One job per character and applicable scene. Missing seeds become warnings
     * of the form {@code character/scene: missing seed.png}.
     *
     * @throws ValidationException on an unknown override scene or a duplicate job identity
     */
    public JobPlan buildJobs(List<CharacterAssets> characters, List<String> scenes,
                             Map<String, String> overrides) {
        List<Job>    jobs     = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String>  seen     = new HashSet<>();

        for (CharacterAssets character : characters) {
            List<String> characterScenes = scenesFor(character.name(), scenes, overrides);
            for (String scene : characterScenes) {
                SceneDefinition def = catalog.get(scene);
                if (!character.hasSeed(def.seedFile())) {
                    String warning = character.name() + "/" + scene + ": missing " + def.seedFile();
                    log.warn("Skipping {}", warning);
                    warnings.add(warning);
                    continue;
                }
                Job job = Job.of(character.name(), scene, def.workflowFile(),
                        character.seedPath(def.seedFile()), outputDir.resolve(character.name()));
                if (!seen.add(job.identity())) {
                    throw new ValidationException("Duplicate job identity '" + job.identity() + "'");
                }
                jobs.add(job);
            }
        }
        return new JobPlan(characters, scenes, jobs, warnings);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private List<String> scenesFor(String character, List<String> scenes,
                                   Map<String, String> overrides) {
        String override = overrides == null ? null : overrides.get(character);
        if (override == null || override.isBlank()) return scenes;
        return SceneFilter.parse(override).applyTo(scenes, catalog);
    }

    private List<CharacterAssets> selectCharacters(List<CharacterAssets> discovered,
                                                   Map<String, String> selection,
                                                   Path root, List<String> warnings) {
        if (selection == null || selection.isEmpty()) return discovered;

        List<CharacterAssets> selected = new ArrayList<>();
        for (CharacterAssets c : discovered) {
            if (selection.containsKey(c.name())) selected.add(c);
        }
        Set<String> found = new HashSet<>();
        selected.forEach(c -> found.add(c.name()));
        for (String name : selection.keySet()) {
            if (!found.contains(name)) {
                String warning = name + ": no character folder with seed images under " + root;
                log.warn(warning);
                warnings.add(warning);
            }
        }
        if (selected.isEmpty()) {
            throw new NotFoundException("None of the selected characters "
                    + selection.keySet() + " exist under " + root);
        }
        return selected;
    }
}
