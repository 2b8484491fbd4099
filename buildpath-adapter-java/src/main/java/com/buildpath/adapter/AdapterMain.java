package com.buildpath.adapter;

import com.buildpath.adapter.build.ConfigSelector;
import com.buildpath.adapter.build.IvyAdapter;
import com.buildpath.adapter.diagnostics.DiagnosticSink;
import com.buildpath.adapter.diagnostics.StderrDiagnosticSink;
import com.buildpath.adapter.model.BuildSystem;
import com.buildpath.adapter.model.ExternalConfig;
import com.buildpath.adapter.output.ExternalConfigSerializer;
import com.buildpath.adapter.resolver.IvyLibraryResolver;
import com.buildpath.adapter.resolver.MavenProcessResolver;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar buildpath-adapter-java.jar resolve \
 *     --project <dir> [--build maven|ivy|sbt] [--ivy-file <file>] \
 *     [--compile-conf <c>] [--runtime-conf <c>] [--test-conf <c>] \
 *     [--mvn <executable>] [--output <file>]
 */
public class AdapterMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[buildpath] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar buildpath-adapter-java.jar resolve " +
                               "--project <dir> [--build maven|ivy|sbt] [--ivy-file <file>] " +
                               "[--compile-conf <c>] [--runtime-conf <c>] [--test-conf <c>] " +
                               "[--mvn <exe>] [--output <file>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[buildpath] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("resolve")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String project = null;
        String build = null;
        String ivyFile = null;
        String compileConf = null;
        String runtimeConf = null;
        String testConf = null;
        String mvn = "mvn";
        String output = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--project"      -> project     = requireNext(args, i++, "--project");
                case "--build"        -> build       = requireNext(args, i++, "--build");
                case "--ivy-file"     -> ivyFile     = requireNext(args, i++, "--ivy-file");
                case "--compile-conf" -> compileConf = requireNext(args, i++, "--compile-conf");
                case "--runtime-conf" -> runtimeConf = requireNext(args, i++, "--runtime-conf");
                case "--test-conf"    -> testConf    = requireNext(args, i++, "--test-conf");
                case "--mvn"          -> mvn         = requireNext(args, i++, "--mvn");
                case "--output"       -> output      = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (project == null) throw new UsageException("--project is required");

        BuildSystem buildSystem = null;
        if (build != null) {
            try {
                buildSystem = BuildSystem.of(build);
            } catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }

        Path baseDir = Paths.get(project).toAbsolutePath().normalize();
        IvyAdapter.Options ivyOptions = new IvyAdapter.Options(
                Optional.ofNullable(ivyFile).map(Paths::get),
                Optional.ofNullable(runtimeConf),
                Optional.ofNullable(compileConf),
                Optional.ofNullable(testConf));

        DiagnosticSink sink = new StderrDiagnosticSink();
        ConfigSelector selector = new ConfigSelector(
                new MavenProcessResolver(mvn, sink),
                new IvyLibraryResolver(sink),
                sink);

        sink.info("Resolving project: " + baseDir);
        ExternalConfig config = buildSystem != null
                ? selector.adapterFor(buildSystem, ivyOptions).resolve(baseDir)
                : selector.resolve(baseDir, ivyOptions);
        sink.info("Resolved " + config.sourceRoots().size() + " source roots, "
                + config.compileDepJars().size() + " compile, "
                + config.runtimeDepJars().size() + " runtime, "
                + config.testDepJars().size() + " test jars");

        ExternalConfigSerializer serializer = new ExternalConfigSerializer();
        if (output != null) {
            Path outputFile = Paths.get(output);
            serializer.write(config, outputFile);
            sink.info("Wrote " + outputFile);
        } else {
            System.out.println(serializer.toJson(config));
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
