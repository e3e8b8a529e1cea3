package com.genbatch.orchestrator.job;

import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.model.SceneDefinition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered mapping of scene name to seed file and workflow.
 *
 * Scene names are case-insensitive and stored lower-case. Iteration order is
 * the configured order, which is also the order jobs are planned in.
 */
public class SceneCatalog {

    private final Map<String, SceneDefinition> scenes = new LinkedHashMap<>();

    public SceneCatalog(Collection<SceneDefinition> definitions) {
        for (SceneDefinition def : definitions) {
            String name = normalize(def.name());
            if (scenes.containsKey(name)) {
                throw new ValidationException("Scene '" + name + "' is defined twice in the catalog");
            }
            scenes.put(name, new SceneDefinition(name, def.seedFile(), def.workflowFile()));
        }
    }

    public static SceneCatalog from(Map<String, BatchProperties.Scene> configured) {
        return new SceneCatalog(configured.entrySet().stream()
                .map(e -> new SceneDefinition(e.getKey(),
                        e.getValue().getSeed(), e.getValue().getWorkflow()))
                .toList());
    }

    public List<String> names() {
        return List.copyOf(scenes.keySet());
    }

    public boolean contains(String name) {
        return scenes.containsKey(normalize(name));
    }

    public Optional<SceneDefinition> find(String name) {
        return Optional.ofNullable(scenes.get(normalize(name)));
    }

    /** @throws ValidationException if the scene is not in the catalog */
    public SceneDefinition get(String name) {
        return find(name).orElseThrow(() -> unknownScene(name));
    }

    /** Distinct seed file names used by at least one scene. */
    public Set<String> seedFiles() {
        Set<String> seeds = new LinkedHashSet<>();
        scenes.values().forEach(s -> seeds.add(s.seedFile()));
        return seeds;
    }

    public int size() {
        return scenes.size();
    }

    public boolean isEmpty() {
        return scenes.isEmpty();
    }

    ValidationException unknownScene(String name) {
        return new ValidationException("Unknown scene '" + name + "'. Valid scenes: "
                + String.join(", ", scenes.keySet()));
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
