package com.buildpath.adapter.build;

import com.buildpath.adapter.diagnostics.DiagnosticSink;
import com.buildpath.adapter.fs.FileProbe;
import com.buildpath.adapter.resolver.DependencyResolver;
import com.buildpath.adapter.resolver.ResolutionException;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

final class AdapterSupport {

    static final List<String> SOURCE_LAYOUT = List.of(
        "src/main/scala",
        "src/main/java",
        "src/test/scala",
        "src/test/java");

    private AdapterSupport() {}

    static Set<Path> sourceRoots(Path baseDir, DiagnosticSink sink) {
        try {
            return FileProbe.existingOf(baseDir, SOURCE_LAYOUT);
        } catch (UncheckedIOException e) {
            sink.error("Could not probe source roots under " + baseDir, e);
            return Set.of();
        }
    }

    /**
     * Runs one resolver call. Any failure is reported and turned into an empty set so
     * the remaining purposes still resolve.
     */
    static Set<Path> resolveOrEmpty(DependencyResolver resolver, Path baseDir, Optional<Path> descriptor,
                                    List<String> scopes, DiagnosticSink sink, String failureMessage) {
        try {
            return FileProbe.canonicalExisting(resolver.resolveDependencies(baseDir, descriptor, scopes));
        } catch (ResolutionException | RuntimeException e) {
            sink.error(failureMessage, e);
            return Set.of();
        }
    }

    static Optional<Path> existingDir(Path baseDir, String relative, DiagnosticSink sink) {
        try {
            return FileProbe.existing(baseDir, relative);
        } catch (UncheckedIOException e) {
            sink.error("Could not probe " + relative + " under " + baseDir, e);
            return Optional.empty();
        }
    }
}
