package com.buildpath.adapter.model;

import java.util.Locale;

public enum BuildSystem {
    MAVEN,
    IVY,
    SBT;

    public static BuildSystem of(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown build system: " + name
                    + ". Supported: maven, ivy, sbt.", e);
        }
    }
}
