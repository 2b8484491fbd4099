package com.buildpath.adapter.scope;

import com.buildpath.adapter.model.BuildSystem;
import com.buildpath.adapter.model.Purpose;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScopeMapperTest {

    private static final Object[][] TABLE = {
        {BuildSystem.MAVEN, Purpose.COMPILE, List.of("compile", "provided", "system", "test")},
        {BuildSystem.MAVEN, Purpose.RUNTIME, List.of("compile", "provided", "system", "runtime")},
        {BuildSystem.MAVEN, Purpose.TEST,    List.of("compile", "provided", "system", "runtime", "test")},
        {BuildSystem.SBT,   Purpose.COMPILE, List.of("compile", "default", "provided", "optional", "test")},
        {BuildSystem.SBT,   Purpose.RUNTIME, List.of("compile", "default", "provided", "optional", "runtime")},
        {BuildSystem.SBT,   Purpose.TEST,    List.of("compile", "default", "provided", "optional", "runtime", "test")},
        {BuildSystem.IVY,   Purpose.COMPILE, List.of("default")},
        {BuildSystem.IVY,   Purpose.RUNTIME, List.of("default")},
        {BuildSystem.IVY,   Purpose.TEST,    List.of("default")},
    };

    @Test
    void everyBuildSystemAndPurposeMapsToItsScopes() {
        for (Object[] row : TABLE) {
            BuildSystem system = (BuildSystem) row[0];
            Purpose purpose = (Purpose) row[1];
            assertEquals(row[2], ScopeMapper.scopesFor(system, purpose), system + "/" + purpose);
        }
    }

    @Test
    void ivyUsesConfiguredConfOnlyForThatPurpose() {
        Map<Purpose, String> configured = Map.of(Purpose.RUNTIME, "runtime-jars");
        assertEquals(List.of("runtime-jars"), ScopeMapper.scopesFor(BuildSystem.IVY, Purpose.RUNTIME, configured));
        assertEquals(List.of("default"), ScopeMapper.scopesFor(BuildSystem.IVY, Purpose.COMPILE, configured));
        assertEquals(List.of("default"), ScopeMapper.scopesFor(BuildSystem.IVY, Purpose.TEST, configured));
    }

    @Test
    void configuredConfsDoNotAffectMavenOrSbt() {
        Map<Purpose, String> configured = Map.of(Purpose.COMPILE, "weird");
        assertEquals(ScopeMapper.scopesFor(BuildSystem.MAVEN, Purpose.COMPILE),
                ScopeMapper.scopesFor(BuildSystem.MAVEN, Purpose.COMPILE, configured));
        assertEquals(ScopeMapper.scopesFor(BuildSystem.SBT, Purpose.COMPILE),
                ScopeMapper.scopesFor(BuildSystem.SBT, Purpose.COMPILE, configured));
    }

    @Test
    void unsupportedPurposeFailsFast() {
        assertThrows(IllegalArgumentException.class, () -> Purpose.of("deploy"));
        assertThrows(NullPointerException.class, () -> ScopeMapper.scopesFor(BuildSystem.MAVEN, null));
    }

    @Test
    void returnedScopeListsAreImmutable() {
        List<String> scopes = ScopeMapper.scopesFor(BuildSystem.MAVEN, Purpose.TEST);
        assertThrows(UnsupportedOperationException.class, () -> scopes.add("import"));
    }
}
