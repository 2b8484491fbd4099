package com.buildpath.adapter.resolver;

import com.buildpath.adapter.diagnostics.DiagnosticSink;
import org.apache.ivy.Ivy;
import org.apache.ivy.core.report.ArtifactDownloadReport;
import org.apache.ivy.core.report.ResolveReport;
import org.apache.ivy.core.resolve.ResolveOptions;
import org.apache.ivy.core.settings.IvySettings;
import org.apache.ivy.util.AbstractMessageLogger;
import org.apache.ivy.util.Message;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.util.*;

/**
 * Resolves Ivy configurations in-process with Apache Ivy.
 * Uses {@code ivysettings.xml} from the base directory when present, Ivy's default
 * settings otherwise.
 */
public class IvyLibraryResolver implements DependencyResolver {

    static final String DEFAULT_IVY_FILE = "ivy.xml";
    static final String SETTINGS_FILE = "ivysettings.xml";

    private final DiagnosticSink sink;

    public IvyLibraryResolver(DiagnosticSink sink) {
        this.sink = sink;
    }

    @Override
    public Set<Path> resolveDependencies(Path baseDir, Optional<Path> descriptor, List<String> scopes)
            throws ResolutionException {
        Path ivyFile = descriptor.map(baseDir::resolve).orElse(baseDir.resolve(DEFAULT_IVY_FILE));
        if (!Files.isRegularFile(ivyFile)) {
            throw new ResolutionException("Ivy file not found: " + ivyFile);
        }

        Ivy ivy = newIvy(baseDir);
        ResolveOptions options = new ResolveOptions();
        options.setConfs(scopes.toArray(new String[0]));
        options.setTransitive(true);
        options.setDownload(true);

        ResolveReport report;
        try {
            report = ivy.resolve(ivyFile.toUri().toURL(), options);
        } catch (ParseException e) {
            throw new ResolutionException("Malformed ivy file " + ivyFile + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ResolutionException("Ivy resolution failed for " + ivyFile + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // e.g. a requested conf the module does not declare
            throw new ResolutionException("Ivy rejected the request for " + ivyFile + ": " + e.getMessage(), e);
        }
        if (report.hasError()) {
            throw new ResolutionException("Ivy resolution reported problems for " + ivyFile + ": "
                    + report.getAllProblemMessages());
        }

        Set<Path> deps = new LinkedHashSet<>();
        for (ArtifactDownloadReport artifact : report.getAllArtifactsReports()) {
            File local = artifact.getLocalFile();
            if (local != null) {
                deps.add(local.toPath());
            }
        }
        return deps;
    }

    private Ivy newIvy(Path baseDir) throws ResolutionException {
        IvySettings settings = new IvySettings();
        settings.setBaseDir(baseDir.toFile());
        Ivy ivy = Ivy.newInstance(settings);
        ivy.getLoggerEngine().pushLogger(new SinkLogger(sink));

        Path settingsFile = baseDir.resolve(SETTINGS_FILE);
        try {
            if (Files.isRegularFile(settingsFile)) {
                sink.info("Using ivy settings '" + settingsFile + "'.");
                ivy.configure(settingsFile.toFile());
            } else {
                ivy.configureDefault();
            }
        } catch (ParseException | IOException e) {
            throw new ResolutionException("Could not load ivy settings: " + e.getMessage(), e);
        }
        return ivy;
    }

    /** Forwards Ivy warnings and errors to the diagnostic sink; progress output is dropped. */
    static class SinkLogger extends AbstractMessageLogger {

        private final DiagnosticSink sink;

        SinkLogger(DiagnosticSink sink) {
            this.sink = sink;
        }

        @Override
        public void log(String msg, int level) {
            if (level == Message.MSG_ERR) {
                sink.error("ivy: " + msg);
            } else if (level == Message.MSG_WARN) {
                sink.info("ivy: " + msg);
            }
        }

        @Override
        public void rawlog(String msg, int level) {
            log(msg, level);
        }

        @Override
        protected void doProgress() {
            // progress dots are not forwarded
        }

        @Override
        protected void doEndProgress(String msg) {
            // progress dots are not forwarded
        }
    }
}
