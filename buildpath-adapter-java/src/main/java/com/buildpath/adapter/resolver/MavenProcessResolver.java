package com.buildpath.adapter.resolver;

import com.buildpath.adapter.diagnostics.DiagnosticSink;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Resolves Maven dependencies by running {@code mvn dependency:list} against the POM
 * and keeping the artifacts whose effective scope was requested.
 */
public class MavenProcessResolver implements DependencyResolver {

    private static final Set<String> MAVEN_SCOPES =
        Set.of("compile", "provided", "runtime", "test", "system", "import");

    private final String mavenExecutable;
    private final DiagnosticSink sink;

    public MavenProcessResolver(DiagnosticSink sink) {
        this("mvn", sink);
    }

    public MavenProcessResolver(String mavenExecutable, DiagnosticSink sink) {
        this.mavenExecutable = mavenExecutable;
        this.sink = sink;
    }

    @Override
    public Set<Path> resolveDependencies(Path baseDir, Optional<Path> descriptor, List<String> scopes)
            throws ResolutionException {
        Path pom = descriptor.orElse(baseDir.resolve("pom.xml"));
        Model model = readPom(pom);
        sink.info("Resolving " + coordinates(model) + " with scopes " + scopes);

        Path listing;
        try {
            listing = Files.createTempFile("buildpath-mvn-deps", ".txt");
        } catch (IOException e) {
            throw new ResolutionException("Could not create dependency listing file: " + e.getMessage(), e);
        }
        try {
            List<String> command = List.of(
                mavenExecutable, "-B", "-q",
                "-f", pom.toAbsolutePath().toString(),
                "dependency:list",
                "-DoutputAbsoluteArtifactFilename=true",
                "-DappendOutput=false",
                "-DoutputFile=" + listing.toAbsolutePath());
            runCommand(command, baseDir);
            return parseDependencyList(Files.readAllLines(listing, StandardCharsets.UTF_8), scopes);
        } catch (IOException e) {
            throw new ResolutionException("Could not read dependency listing: " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(listing);
            } catch (IOException e) {
                sink.error("Could not delete " + listing, e);
            }
        }
    }

    /**
     * Parses the output of {@code dependency:list -DoutputAbsoluteArtifactFilename=true}.
     * Lines look like {@code g:a:type[:classifier]:version:scope:/abs/file.jar[ -- module m]}.
     * Only artifacts in one of {@code scopes} whose file exists are returned.
     */
    static Set<Path> parseDependencyList(List<String> lines, Collection<String> scopes) {
        Set<Path> deps = new LinkedHashSet<>();
        for (String raw : lines) {
            String line = raw.strip();
            int moduleInfo = line.indexOf(" -- ");
            if (moduleInfo >= 0) {
                line = line.substring(0, moduleInfo).strip();
            }
            String[] parts = line.split(":");
            if (parts.length < 6) {
                continue;
            }
            // scope sits at index 4, or 5 when a classifier is present
            for (int i = 4; i <= 5 && i < parts.length - 1; i++) {
                if (MAVEN_SCOPES.contains(parts[i])) {
                    if (scopes.contains(parts[i])) {
                        String file = String.join(":", Arrays.copyOfRange(parts, i + 1, parts.length));
                        Path path = Paths.get(file);
                        if (Files.exists(path)) {
                            deps.add(path);
                        }
                    }
                    break;
                }
            }
        }
        return deps;
    }

    private Model readPom(Path pom) throws ResolutionException {
        if (!Files.isRegularFile(pom)) {
            throw new ResolutionException("POM file not found: " + pom);
        }
        try (Reader reader = Files.newBufferedReader(pom, StandardCharsets.UTF_8)) {
            return new MavenXpp3Reader().read(reader);
        } catch (IOException | XmlPullParserException e) {
            throw new ResolutionException("Malformed POM " + pom + ": " + e.getMessage(), e);
        }
    }

    private static String coordinates(Model model) {
        String groupId = model.getGroupId();
        if (groupId == null && model.getParent() != null) {
            groupId = model.getParent().getGroupId();
        }
        return groupId + ":" + model.getArtifactId();
    }

    private void runCommand(List<String> command, Path workDir) throws ResolutionException {
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true);

        String javaHome = System.getenv("JAVA_HOME");
        if (javaHome != null) {
            pb.environment().put("JAVA_HOME", javaHome);
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ResolutionException("Failed to spawn Maven process: " + e.getMessage(), e);
        }

        StringBuilder output = new StringBuilder();
        boolean finished = false;
        try {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                    sink.info("mvn: " + line);
                }
            }
            int exitCode = process.waitFor();
            finished = true;
            if (exitCode != 0) {
                throw new ResolutionException("mvn dependency:list failed (exit " + exitCode + "):\n" + output);
            }
        } catch (IOException e) {
            throw new ResolutionException("Failed to read Maven output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolutionException("Maven resolution interrupted", e);
        } finally {
            if (!finished) {
                process.destroyForcibly();
            }
        }
    }
}
