package com.buildpath.adapter.build;

import com.buildpath.adapter.diagnostics.DiagnosticSink;
import com.buildpath.adapter.model.BuildSystem;
import com.buildpath.adapter.model.ExternalConfig;
import com.buildpath.adapter.model.Purpose;
import com.buildpath.adapter.resolver.DependencyResolver;
import com.buildpath.adapter.scope.ScopeMapper;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maven projects: conventional source roots, {@code target/classes}, and one resolver
 * call per purpose against {@code pom.xml} recreating Maven's default classpaths.
 */
public final class MavenAdapter implements BuildSystemAdapter {

    private final DependencyResolver resolver;
    private final DiagnosticSink sink;

    public MavenAdapter(DependencyResolver resolver, DiagnosticSink sink) {
        this.resolver = resolver;
        this.sink = sink;
    }

    @Override
    public BuildSystem buildSystem() {
        return BuildSystem.MAVEN;
    }

    @Override
    public ExternalConfig resolve(Path baseDir) {
        Set<Path> srcPaths = AdapterSupport.sourceRoots(baseDir, sink);
        Set<Path> runtimeDeps = resolveDeps(baseDir, Purpose.RUNTIME);
        Set<Path> compileDeps = resolveDeps(baseDir, Purpose.COMPILE);
        Set<Path> testDeps    = resolveDeps(baseDir, Purpose.TEST);
        Optional<Path> target = AdapterSupport.existingDir(baseDir, "target/classes", sink);

        return new ExternalConfig(Optional.empty(), srcPaths, compileDeps, runtimeDeps, testDeps, target);
    }

    private Set<Path> resolveDeps(Path baseDir, Purpose purpose) {
        List<String> scopes = ScopeMapper.scopesFor(BuildSystem.MAVEN, purpose);
        sink.info("Resolving Maven dependencies...");
        sink.info("Using conf: " + purpose);
        return AdapterSupport.resolveOrEmpty(resolver, baseDir, Optional.of(baseDir.resolve("pom.xml")),
                scopes, sink, "Failed to resolve Maven dependencies.");
    }
}
