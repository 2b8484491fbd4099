package com.buildpath.adapter.build;

import com.buildpath.adapter.model.BuildSystem;
import com.buildpath.adapter.model.ExternalConfig;

import java.nio.file.Path;

/**
 * Replays one build system's dependency-resolution and directory conventions for a
 * project. Implementations never throw for missing metadata or resolver failures;
 * they degrade to partial results and report through their diagnostic sink.
 */
public sealed interface BuildSystemAdapter permits MavenAdapter, IvyAdapter, SbtAdapter {

    BuildSystem buildSystem();

    ExternalConfig resolve(Path baseDir);
}
