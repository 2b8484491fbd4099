package com.buildpath.adapter.build;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Loads an sbt {@code project/build.properties} file.
 */
public class BuildPropertiesReader {

    /**
     * @throws BuildPropertiesException if the file is missing or unreadable
     */
    public Properties read(Path propertiesFile) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(propertiesFile)) {
            props.load(in);
            return props;
        } catch (NoSuchFileException e) {
            throw new BuildPropertiesException("build.properties not found: " + propertiesFile, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new BuildPropertiesException("Failed to read " + propertiesFile + ": " + e.getMessage(), e);
        }
    }

    public static class BuildPropertiesException extends RuntimeException {
        public BuildPropertiesException(String message) { super(message); }
        public BuildPropertiesException(String message, Throwable cause) { super(message, cause); }
    }
}
