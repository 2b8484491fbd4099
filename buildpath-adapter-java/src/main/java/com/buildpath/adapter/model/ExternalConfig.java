package com.buildpath.adapter.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolved layout of a project: source roots, the dependency jars needed for each
 * {@link Purpose}, and the compiled-output directory.
 * All paths are canonical and existed on disk when the config was built.
 */
public record ExternalConfig(
    Optional<String> projectName,
    Set<Path> sourceRoots,
    Set<Path> compileDepJars,
    Set<Path> runtimeDepJars,
    Set<Path> testDepJars,
    Optional<Path> target
) {

    public ExternalConfig {
        Objects.requireNonNull(projectName, "projectName");
        Objects.requireNonNull(target, "target");
        sourceRoots    = Set.copyOf(sourceRoots);
        compileDepJars = Set.copyOf(compileDepJars);
        runtimeDepJars = Set.copyOf(runtimeDepJars);
        testDepJars    = Set.copyOf(testDepJars);
    }

    /** A config that only knows its source roots. */
    public static ExternalConfig sourcesOnly(Set<Path> sourceRoots) {
        return new ExternalConfig(Optional.empty(), sourceRoots, Set.of(), Set.of(), Set.of(), Optional.empty());
    }

    public Set<Path> depJars(Purpose purpose) {
        return switch (purpose) {
            case COMPILE -> compileDepJars;
            case RUNTIME -> runtimeDepJars;
            case TEST    -> testDepJars;
        };
    }
}
