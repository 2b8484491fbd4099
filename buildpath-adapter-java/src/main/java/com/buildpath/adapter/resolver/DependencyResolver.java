package com.buildpath.adapter.resolver;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Performs the actual dependency-graph resolution for a project. Implementations may
 * block for as long as the underlying tool needs (downloads included).
 */
@FunctionalInterface
public interface DependencyResolver {

    /**
     * @param baseDir    project base directory
     * @param descriptor explicit descriptor file (POM or ivy file); when empty the
     *                   resolver applies its own discovery convention
     * @param scopes     named configuration scopes to resolve, in order
     * @return local files of the resolved artifacts
     * @throws ResolutionException if resolution fails
     */
    Set<Path> resolveDependencies(Path baseDir, Optional<Path> descriptor, List<String> scopes)
            throws ResolutionException;
}
