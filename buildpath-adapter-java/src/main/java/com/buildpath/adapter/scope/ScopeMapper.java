package com.buildpath.adapter.scope;

import com.buildpath.adapter.model.BuildSystem;
import com.buildpath.adapter.model.Purpose;

import java.util.List;
import java.util.Map;

/**
 * Maps a {@link Purpose} to the named configuration scopes a build system uses to
 * satisfy it, replaying each tool's default classpath semantics.
 */
public final class ScopeMapper {

    /** Ivy configuration used whenever no conf was given for a purpose. */
    public static final String IVY_DEFAULT_CONF = "default";

    private ScopeMapper() {}

    public static List<String> scopesFor(BuildSystem system, Purpose purpose) {
        return scopesFor(system, purpose, Map.of());
    }

    /**
     * @param configured explicit Ivy confs per purpose; ignored by the other build systems
     */
    public static List<String> scopesFor(BuildSystem system, Purpose purpose, Map<Purpose, String> configured) {
        return switch (system) {
            case MAVEN -> mavenScopes(purpose);
            case SBT   -> sbtScopes(purpose);
            case IVY   -> List.of(configured.getOrDefault(purpose, IVY_DEFAULT_CONF));
        };
    }

    private static List<String> mavenScopes(Purpose purpose) {
        return switch (purpose) {
            case COMPILE -> List.of("compile", "provided", "system", "test");
            case RUNTIME -> List.of("compile", "provided", "system", "runtime");
            case TEST    -> List.of("compile", "provided", "system", "runtime", "test");
        };
    }

    // test is part of compile so that test sources can be analyzed
    private static List<String> sbtScopes(Purpose purpose) {
        return switch (purpose) {
            case COMPILE -> List.of("compile", "default", "provided", "optional", "test");
            case RUNTIME -> List.of("compile", "default", "provided", "optional", "runtime");
            case TEST    -> List.of("compile", "default", "provided", "optional", "runtime", "test");
        };
    }
}
