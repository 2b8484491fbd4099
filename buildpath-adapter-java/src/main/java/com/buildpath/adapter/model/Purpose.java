package com.buildpath.adapter.model;

/**
 * The logical reason a set of dependency jars is needed.
 */
public enum Purpose {
    COMPILE("compile"),
    RUNTIME("runtime"),
    TEST("test");

    private final String label;

    Purpose(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses a purpose label.
     *
     * @throws IllegalArgumentException for anything other than compile, runtime or test
     */
    public static Purpose of(String label) {
        for (Purpose p : values()) {
            if (p.label.equals(label)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unsupported purpose: " + label
                + ". Expected one of: compile, runtime, test.");
    }

    @Override
    public String toString() {
        return label;
    }
}
