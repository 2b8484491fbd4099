package com.buildpath.adapter.build;

import com.buildpath.adapter.diagnostics.DiagnosticSink;
import com.buildpath.adapter.model.BuildSystem;
import com.buildpath.adapter.model.ExternalConfig;
import com.buildpath.adapter.resolver.DependencyResolver;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Detects which build system manages a project and runs the matching adapter.
 */
public class ConfigSelector {

    public static class UnsupportedBuildToolException extends RuntimeException {
        public UnsupportedBuildToolException(String message) { super(message); }
    }

    private final DependencyResolver mavenResolver;
    private final DependencyResolver ivyResolver;
    private final DiagnosticSink sink;

    public ConfigSelector(DependencyResolver mavenResolver, DependencyResolver ivyResolver, DiagnosticSink sink) {
        this.mavenResolver = mavenResolver;
        this.ivyResolver = ivyResolver;
        this.sink = sink;
    }

    /**
     * Checks, in order: {@code pom.xml}, {@code ivy.xml}, then sbt markers
     * ({@code project/build.properties} here or in the parent, or {@code build.sbt}).
     *
     * @throws UnsupportedBuildToolException if none is present
     */
    public BuildSystem detect(Path baseDir) {
        if (Files.exists(baseDir.resolve("pom.xml"))) {
            return BuildSystem.MAVEN;
        }
        if (Files.exists(baseDir.resolve("ivy.xml"))) {
            return BuildSystem.IVY;
        }
        if (Files.exists(baseDir.resolve(SbtAdapter.PROPERTIES_FILE))
                || Files.exists(baseDir.resolve("../" + SbtAdapter.PROPERTIES_FILE))
                || Files.exists(baseDir.resolve("build.sbt"))) {
            return BuildSystem.SBT;
        }
        throw new UnsupportedBuildToolException(
            "No pom.xml, ivy.xml or sbt project found in: " + baseDir +
            ". Supported build tools: Maven, Ivy, sbt.");
    }

    public BuildSystemAdapter adapterFor(BuildSystem system, IvyAdapter.Options ivyOptions) {
        return switch (system) {
            case MAVEN -> new MavenAdapter(mavenResolver, sink);
            case IVY   -> new IvyAdapter(ivyResolver, sink, ivyOptions);
            case SBT   -> new SbtAdapter(sink);
        };
    }

    public ExternalConfig resolve(Path baseDir, IvyAdapter.Options ivyOptions) {
        BuildSystem system = detect(baseDir);
        sink.info("Detected " + system + " project at " + baseDir);
        return adapterFor(system, ivyOptions).resolve(baseDir);
    }
}
