package com.buildpath.adapter.resolver;

import com.buildpath.adapter.diagnostics.DiagnosticSink;
import com.buildpath.adapter.testutil.RecordingDiagnosticSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.buildpath.adapter.testutil.ProjectFiles.file;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class MavenProcessResolverTest {

    // never spawned: every test fails before the process would start
    private final MavenProcessResolver resolver =
            new MavenProcessResolver("/nonexistent/mvn", new RecordingDiagnosticSink());

    @Test
    void parsesListingAndFiltersByScope(@TempDir Path tmp) {
        Path guava = file(tmp, "m2/guava-33.0.jar");
        Path junit = file(tmp, "m2/junit-4.13.jar");
        Path servlet = file(tmp, "m2/servlet-api-4.0.jar");
        Path natives = file(tmp, "m2/netty-linux.jar");
        List<String> listing = List.of(
            "",
            "The following files have been resolved:",
            "   com.google.guava:guava:jar:33.0:compile:" + guava + " -- module com.google.common",
            "   junit:junit:jar:4.13:test:" + junit,
            "   javax.servlet:servlet-api:jar:4.0:provided:" + servlet,
            "   io.netty:netty-transport:jar:linux-x86_64:4.1:runtime:" + natives + " -- module io.netty [auto]",
            "");

        assertEquals(Set.of(guava, servlet),
                MavenProcessResolver.parseDependencyList(listing, List.of("compile", "provided", "system")));
        assertEquals(Set.of(guava, junit, servlet, natives),
                MavenProcessResolver.parseDependencyList(listing,
                        List.of("compile", "provided", "system", "runtime", "test")));
    }

    @Test
    void listingEntriesForMissingFilesAreDropped(@TempDir Path tmp) {
        List<String> listing = List.of("   a:b:jar:1.0:compile:" + tmp.resolve("gone.jar"));
        assertTrue(MavenProcessResolver.parseDependencyList(listing, List.of("compile")).isEmpty());
    }

    @Test
    void noneListingIsEmpty() {
        List<String> listing = List.of("The following files have been resolved:", "   none");
        assertTrue(MavenProcessResolver.parseDependencyList(listing, List.of("compile")).isEmpty());
    }

    @Test
    void missingPomIsResolutionException(@TempDir Path tmp) {
        ResolutionException e = assertThrows(ResolutionException.class,
                () -> resolver.resolveDependencies(tmp, Optional.empty(), List.of("compile")));
        assertTrue(e.getMessage().contains("POM file not found"));
    }

    @Test
    void malformedPomIsResolutionException(@TempDir Path tmp) {
        Path pom = file(tmp, "pom.xml", "<project><artifactId>broken");
        assertThrows(ResolutionException.class,
                () -> resolver.resolveDependencies(tmp, Optional.of(pom), List.of("compile")));
    }

    @Test
    void unavailableExecutableIsResolutionException(@TempDir Path tmp) {
        file(tmp, "pom.xml", """
            <project>
              <modelVersion>4.0.0</modelVersion>
              <groupId>org.example</groupId>
              <artifactId>demo</artifactId>
              <version>1.0</version>
            </project>
            """);
        ResolutionException e = assertThrows(ResolutionException.class,
                () -> resolver.resolveDependencies(tmp, Optional.empty(), List.of("compile")));
        assertTrue(e.getMessage().contains("Failed to spawn Maven process"));
    }

    @Test
    void childProcessIsKilledWhenOutputHandlingFails(@TempDir Path tmp) throws Exception {
        assumeTrue(tmp.getFileSystem().supportedFileAttributeViews().contains("posix"));
        file(tmp, "pom.xml", "<project><modelVersion>4.0.0</modelVersion><artifactId>demo</artifactId></project>");
        Path fakeMvn = file(tmp, "bin/mvn", "#!/bin/sh\necho started\nexec sleep 60\n");
        Files.setPosixFilePermissions(fakeMvn, PosixFilePermissions.fromString("rwxr-xr-x"));
        DiagnosticSink failingSink = new DiagnosticSink() {
            @Override
            public void info(String message) {
                if (message.startsWith("mvn: ")) {
                    throw new IllegalStateException("sink closed");
                }
            }

            @Override
            public void error(String message, Throwable cause) {
                // not inspected
            }
        };
        MavenProcessResolver fake = new MavenProcessResolver(fakeMvn.toString(), failingSink);

        assertThrows(IllegalStateException.class,
                () -> fake.resolveDependencies(tmp, Optional.empty(), List.of("compile")));

        long deadline = System.currentTimeMillis() + 10_000;
        while (ProcessHandle.current().children().anyMatch(ProcessHandle::isAlive)
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertFalse(ProcessHandle.current().children().anyMatch(ProcessHandle::isAlive),
                "mvn child process still running");
    }
}
