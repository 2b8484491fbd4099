package com.buildpath.adapter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AdapterMainTest {

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class, () -> AdapterMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"record"}));
    }

    @Test
    void missingProjectFlagThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"resolve", "--build", "maven"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"resolve", "--project"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"resolve", "--foo", "bar"}));
    }

    @Test
    void unknownBuildSystemThrowsUsageException(@TempDir Path tmp) {
        assertThrows(AdapterMain.UsageException.class,
                () -> AdapterMain.run(new String[]{"resolve", "--project", tmp.toString(), "--build", "ant"}));
    }

    @Test
    void sbtProjectIsWrittenToOutputFile(@TempDir Path tmp) throws IOException {
        Path project = Files.createDirectories(tmp.resolve("shop"));
        Files.createDirectories(project.resolve("project"));
        Files.writeString(project.resolve("project/build.properties"),
                "project.name=shop\nbuild.scala.versions=2.8.0\n");
        Files.createDirectories(project.resolve("src/main/scala"));
        Path out = tmp.resolve("config.json");

        AdapterMain.run(new String[]{"resolve", "--project", project.toString(), "--output", out.toString()});

        String json = Files.readString(out);
        assertTrue(json.contains("\"projectName\": \"shop\""), json);
        assertTrue(json.contains("src/main/scala"), json);
    }
}
