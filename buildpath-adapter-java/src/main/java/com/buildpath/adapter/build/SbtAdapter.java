package com.buildpath.adapter.build;

import com.buildpath.adapter.diagnostics.DiagnosticSink;
import com.buildpath.adapter.fs.FileProbe;
import com.buildpath.adapter.model.BuildSystem;
import com.buildpath.adapter.model.ExternalConfig;
import com.buildpath.adapter.model.Purpose;
import com.buildpath.adapter.scope.ScopeMapper;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * sbt 0.7-style projects. No resolver is involved: jars are found by walking the
 * unmanaged {@code lib} directory, the Scala boot library and the version-qualified
 * {@code lib_managed} directories, using the Scala version from
 * {@code project/build.properties} (or the parent project's copy for subprojects).
 */
public final class SbtAdapter implements BuildSystemAdapter {

    public static final String DEFAULT_SCALA_VERSION = "2.8.0";

    static final String PROPERTIES_FILE = "project/build.properties";
    static final String VERSION_KEY = "build.scala.versions";
    static final String NAME_KEY = "project.name";
    private static final String TOOL = "scala";

    private final DiagnosticSink sink;
    private final BuildPropertiesReader propertiesReader;
    private final String defaultScalaVersion;

    public SbtAdapter(DiagnosticSink sink) {
        this(sink, DEFAULT_SCALA_VERSION);
    }

    /**
     * @param defaultScalaVersion version assumed when build.properties does not name one
     */
    public SbtAdapter(DiagnosticSink sink, String defaultScalaVersion) {
        this.sink = sink;
        this.propertiesReader = new BuildPropertiesReader();
        this.defaultScalaVersion = defaultScalaVersion;
    }

    @Override
    public BuildSystem buildSystem() {
        return BuildSystem.SBT;
    }

    @Override
    public ExternalConfig resolve(Path baseDir) {
        Set<Path> srcPaths = AdapterSupport.sourceRoots(baseDir, sink);

        Path projectProps = baseDir.resolve(PROPERTIES_FILE);
        Path parentProjectProps = baseDir.resolve("../" + PROPERTIES_FILE);
        boolean isMain = Files.exists(projectProps);
        boolean isSubProject = !isMain && Files.exists(parentProjectProps);

        if (!isMain && !isSubProject) {
            sink.error("Could not locate build.properties file!");
            return ExternalConfig.sourcesOnly(srcPaths);
        }

        Path propFile = isSubProject ? parentProjectProps : projectProps;
        sink.info("Loading sbt build.properties from " + propFile + ".");
        Properties props;
        try {
            props = propertiesReader.read(propFile);
        } catch (BuildPropertiesReader.BuildPropertiesException e) {
            sink.error("Could not load build.properties file!", e);
            return ExternalConfig.sourcesOnly(srcPaths);
        }

        String version = scalaVersion(props);
        Optional<String> projectName = Optional.ofNullable(props.getProperty(NAME_KEY));

        Set<Path> compileDeps = resolveDeps(baseDir, version, Purpose.COMPILE, isSubProject);
        Set<Path> runtimeDeps = resolveDeps(baseDir, version, Purpose.RUNTIME, isSubProject);
        Set<Path> testDeps    = resolveDeps(baseDir, version, Purpose.TEST, isSubProject);
        Optional<Path> target = AdapterSupport.existingDir(baseDir, targetDir(version), sink);

        return new ExternalConfig(projectName, srcPaths, compileDeps, runtimeDeps, testDeps, target);
    }

    /**
     * Directories searched for jars, relative to the project base directory:
     * {@code lib}, the Scala boot library, then one {@code lib_managed} directory per scope.
     */
    public static List<String> libraryDirs(String version, Purpose purpose, boolean isSubProject) {
        List<String> dirs = new ArrayList<>();
        dirs.add("lib");
        String bootLib = "project/boot/" + TOOL + "-" + version + "/lib";
        dirs.add(isSubProject ? "../" + bootLib : bootLib);
        for (String scope : ScopeMapper.scopesFor(BuildSystem.SBT, purpose)) {
            dirs.add("lib_managed/" + TOOL + "_" + version + "/" + scope);
        }
        return dirs;
    }

    static String targetDir(String version) {
        return "target/" + TOOL + "_" + version + "/classes";
    }

    private String scalaVersion(Properties props) {
        String versions = props.getProperty(VERSION_KEY);
        if (versions == null || versions.isBlank()) {
            return defaultScalaVersion;
        }
        // cross-built projects list several versions; the first is the build's own
        return versions.trim().split("\\s+")[0];
    }

    private Set<Path> resolveDeps(Path baseDir, String version, Purpose purpose, boolean isSubProject) {
        sink.info("Resolving sbt dependencies...");
        sink.info("Using build config '" + purpose + "'");
        List<String> jarDirs = libraryDirs(version, purpose, isSubProject);
        sink.info("Searching for dependencies in " + jarDirs);
        try {
            Set<Path> jarRoots = FileProbe.existingOf(baseDir, jarDirs);
            return FileProbe.expandJars(baseDir, jarRoots, FileProbe::isValidJar);
        } catch (UncheckedIOException e) {
            sink.error("Failed to scan sbt dependency directories.", e);
            return Set.of();
        }
    }
}
