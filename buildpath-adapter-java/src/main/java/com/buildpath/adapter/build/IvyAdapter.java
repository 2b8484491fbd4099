package com.buildpath.adapter.build;

import com.buildpath.adapter.diagnostics.DiagnosticSink;
import com.buildpath.adapter.model.BuildSystem;
import com.buildpath.adapter.model.ExternalConfig;
import com.buildpath.adapter.model.Purpose;
import com.buildpath.adapter.resolver.DependencyResolver;
import com.buildpath.adapter.scope.ScopeMapper;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ivy projects. The {@code default} conf is always resolved; a purpose with its own
 * conf gets a separate resolver call, every other purpose reuses the default set.
 */
public final class IvyAdapter implements BuildSystemAdapter {

    /**
     * @param ivyFile optional descriptor override; when empty the resolver looks for {@code ivy.xml}
     */
    public record Options(
        Optional<Path> ivyFile,
        Optional<String> runtimeConf,
        Optional<String> compileConf,
        Optional<String> testConf
    ) {
        public Options {
            Objects.requireNonNull(ivyFile, "ivyFile");
            Objects.requireNonNull(runtimeConf, "runtimeConf");
            Objects.requireNonNull(compileConf, "compileConf");
            Objects.requireNonNull(testConf, "testConf");
        }

        public static Options defaults() {
            return new Options(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
        }

        Map<Purpose, String> configuredConfs() {
            Map<Purpose, String> confs = new EnumMap<>(Purpose.class);
            runtimeConf.ifPresent(c -> confs.put(Purpose.RUNTIME, c));
            compileConf.ifPresent(c -> confs.put(Purpose.COMPILE, c));
            testConf.ifPresent(c -> confs.put(Purpose.TEST, c));
            return confs;
        }
    }

    private final DependencyResolver resolver;
    private final DiagnosticSink sink;
    private final Options options;

    public IvyAdapter(DependencyResolver resolver, DiagnosticSink sink) {
        this(resolver, sink, Options.defaults());
    }

    public IvyAdapter(DependencyResolver resolver, DiagnosticSink sink, Options options) {
        this.resolver = resolver;
        this.sink = sink;
        this.options = options;
    }

    @Override
    public BuildSystem buildSystem() {
        return BuildSystem.IVY;
    }

    @Override
    public ExternalConfig resolve(Path baseDir) {
        return resolve(baseDir, options);
    }

    public ExternalConfig resolve(Path baseDir, Options options) {
        Set<Path> srcPaths = AdapterSupport.sourceRoots(baseDir, sink);
        Map<Purpose, String> configured = options.configuredConfs();

        Set<Path> defaultDeps = resolveConf(baseDir, options.ivyFile(), ScopeMapper.IVY_DEFAULT_CONF);
        Map<Purpose, Set<Path>> deps = new EnumMap<>(Purpose.class);
        for (Purpose purpose : List.of(Purpose.RUNTIME, Purpose.COMPILE, Purpose.TEST)) {
            if (configured.containsKey(purpose)) {
                String conf = ScopeMapper.scopesFor(BuildSystem.IVY, purpose, configured).get(0);
                deps.put(purpose, resolveConf(baseDir, options.ivyFile(), conf));
            } else {
                deps.put(purpose, defaultDeps);
            }
        }

        return new ExternalConfig(Optional.empty(), srcPaths,
                deps.get(Purpose.COMPILE), deps.get(Purpose.RUNTIME), deps.get(Purpose.TEST),
                Optional.empty());
    }

    private Set<Path> resolveConf(Path baseDir, Optional<Path> ivyFile, String conf) {
        sink.info("Resolving Ivy dependencies...");
        ivyFile.ifPresent(f -> sink.info("Using ivy file '" + f + "'."));
        sink.info("Using config '" + conf + "'.");
        return AdapterSupport.resolveOrEmpty(resolver, baseDir, ivyFile, List.of(conf),
                sink, "Failed to resolve Ivy dependencies.");
    }
}
