package com.buildpath.adapter.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.function.Predicate;

/**
 * Existence checks and recursive archive discovery, always returning canonical paths
 * so that results can be compared for equality.
 */
public final class FileProbe {

    private FileProbe() {}

    /**
     * Returns the canonical form of each candidate (resolved against {@code baseDir})
     * that exists. Missing candidates are dropped.
     */
    public static Set<Path> existingOf(Path baseDir, Collection<String> relativePaths) {
        Set<Path> found = new LinkedHashSet<>();
        for (String relative : relativePaths) {
            existing(baseDir, relative).ifPresent(found::add);
        }
        return Collections.unmodifiableSet(found);
    }

    public static Optional<Path> existing(Path baseDir, String relativePath) {
        return canonical(baseDir.resolve(relativePath));
    }

    /**
     * Canonical (absolute, symlink-resolved, normalized) form of {@code path},
     * or empty if it does not exist. A path below a regular file counts as missing.
     */
    public static Optional<Path> canonical(Path path) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(path.toRealPath());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not canonicalize " + path, e);
        }
    }

    /**
     * Recursively collects every regular file under the given roots that satisfies
     * {@code isArchive}. Roots are resolved against {@code baseDir}; roots that do not
     * exist are skipped.
     */
    public static Set<Path> expandJars(Path baseDir, Collection<Path> rootDirs, Predicate<Path> isArchive) {
        Set<Path> jars = new LinkedHashSet<>();
        for (Path root : rootDirs) {
            Optional<Path> existingRoot = canonical(baseDir.resolve(root));
            if (existingRoot.isEmpty() || !Files.isDirectory(existingRoot.get())) {
                continue;
            }
            try {
                Files.walkFileTree(existingRoot.get(), EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                        new ArchiveCollector(isArchive, jars));
            } catch (IOException e) {
                throw new UncheckedIOException("Could not scan dependency dir: " + existingRoot.get(), e);
            }
        }
        return Collections.unmodifiableSet(jars);
    }

    /** Canonicalizes resolver output, dropping files that do not exist. */
    public static Set<Path> canonicalExisting(Collection<Path> paths) {
        Set<Path> result = new LinkedHashSet<>();
        for (Path p : paths) {
            canonical(p).ifPresent(result::add);
        }
        return Collections.unmodifiableSet(result);
    }

    /** Follows symlinked directories; a link cycle is skipped rather than walked again. */
    private static class ArchiveCollector extends SimpleFileVisitor<Path> {

        private final Predicate<Path> isArchive;
        private final Set<Path> jars;

        ArchiveCollector(Predicate<Path> isArchive, Set<Path> jars) {
            this.isArchive = isArchive;
            this.jars = jars;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && isArchive.test(file)) {
                canonical(file).ifPresent(jars::add);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (exc instanceof FileSystemLoopException) {
                return FileVisitResult.CONTINUE;
            }
            throw exc;
        }
    }

    public static boolean isValidJar(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jar") || name.endsWith(".zip");
    }
}
