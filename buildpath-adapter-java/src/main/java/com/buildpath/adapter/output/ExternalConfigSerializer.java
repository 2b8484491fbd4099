package com.buildpath.adapter.output;

import com.buildpath.adapter.model.ExternalConfig;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON form of an {@link ExternalConfig}. Path arrays are sorted so that output is
 * deterministic; absent optionals are omitted.
 */
public class ExternalConfigSerializer {

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public String toJson(ExternalConfig config) {
        return GSON.toJson(toDocument(config));
    }

    public void write(ExternalConfig config, Path outputFile) {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer w = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
                GSON.toJson(toDocument(config), w);
            }
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + outputFile + ": " + e.getMessage(), e);
        }
    }

    private static Document toDocument(ExternalConfig config) {
        return new Document(
            config.projectName().orElse(null),
            sorted(config.sourceRoots()),
            sorted(config.compileDepJars()),
            sorted(config.runtimeDepJars()),
            sorted(config.testDepJars()),
            config.target().map(Path::toString).orElse(null));
    }

    private static List<String> sorted(Collection<Path> paths) {
        return paths.stream().map(Path::toString).sorted().collect(Collectors.toList());
    }

    private record Document(
        String projectName,
        List<String> sourceRoots,
        List<String> compileDepJars,
        List<String> runtimeDepJars,
        List<String> testDepJars,
        String target
    ) {}
}
