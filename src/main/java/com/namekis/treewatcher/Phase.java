package com.namekis.treewatcher;

/** The three steps of a load, in the order they run. */
public enum Phase {
    PARSING("Reading and parsing lines"),
    BUILDING("Building tree structure"),
    POPULATING("Initializing root nodes");

    private final String label;

    Phase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** For example {@code "Phase 2/3: Building tree structure"}. */
    public String title() {
        return "Phase " + (ordinal() + 1) + "/" + values().length + ": " + label;
    }
}
