package com.genbatch.orchestrator.job;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed scene-filter expression.
 *
 * Grammar (comma separated, case-insensitive):
 * <ul>
 *   <li>blank or {@code ALL}: every catalog scene</li>
 *   <li>{@code bj, feet}: exactly these scenes</li>
 *   <li>{@code NO bj, NO feet}: every scene except these</li>
 * </ul>
 * Inclusions and exclusions combine: the explicit list first, then the
 * exclusions are subtracted. An {@code ALL} token inside a list is ignored.
 */
public final class SceneFilter {

    static final String ALL = "ALL";
    static final String EXCLUDE_PREFIX = "NO ";

    private final List<String> includes;
    private final List<String> excludes;

    private SceneFilter(List<String> includes, List<String> excludes) {
        this.includes = List.copyOf(includes);
        this.excludes = List.copyOf(excludes);
    }

    public static SceneFilter parse(String spec) {
        List<String> includes = new ArrayList<>();
        List<String> excludes = new ArrayList<>();
        if (spec != null) {
            for (String raw : spec.split(",")) {
                String item = raw.trim();
                if (item.isEmpty() || item.equalsIgnoreCase(ALL)) continue;
                if (item.toUpperCase(Locale.ROOT).startsWith(EXCLUDE_PREFIX)) {
                    String name = SceneCatalog.normalize(item.substring(EXCLUDE_PREFIX.length()));
                    if (!name.isEmpty()) excludes.add(name);
                } else {
                    includes.add(SceneCatalog.normalize(item));
                }
            }
        }
        return new SceneFilter(includes, excludes);
    }

    /** A plain comma list read as exclusions only (the global exclude option). */
    public static SceneFilter exclusions(String csv) {
        List<String> excludes = new ArrayList<>();
        if (csv != null) {
            for (String raw : csv.split(",")) {
                String name = SceneCatalog.normalize(raw);
                if (!name.isEmpty()) excludes.add(name);
            }
        }
        return new SceneFilter(List.of(), excludes);
    }

    public List<String> includes() { return includes; }
    public List<String> excludes() { return excludes; }

    /** True when the expression selects every scene of its base. */
    public boolean isUnrestricted() {
        return includes.isEmpty() && excludes.isEmpty();
    }

    /** Resolve against the full catalog. */
    public List<String> resolve(SceneCatalog catalog) {
        return applyTo(catalog.names(), catalog);
    }

    /**
     * Apply to a base scene list: inclusions replace the base, exclusions
     * subtract from it. Every name must exist in the catalog.
     *
     * @throws ValidationException naming the catalog on an unknown scene
     */
    public List<String> applyTo(List<String> base, SceneCatalog catalog) {
        validate(catalog);
        Set<String> scenes = new LinkedHashSet<>(includes.isEmpty() ? base : includes);
        excludes.forEach(scenes::remove);
        return List.copyOf(scenes);
    }

    private void validate(SceneCatalog catalog) {
        for (String name : includes) {
            if (!catalog.contains(name)) throw catalog.unknownScene(name);
        }
        for (String name : excludes) {
            if (!catalog.contains(name)) throw catalog.unknownScene(name);
        }
    }

    @Override
    public String toString() {
        if (isUnrestricted()) return ALL;
        List<String> parts = new ArrayList<>(includes);
        excludes.forEach(e -> parts.add(EXCLUDE_PREFIX + e));
        return String.join(", ", parts);
    }
}
