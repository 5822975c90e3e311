package com.namekis.treewatcher;

public record ProgressEvent(Phase phase, int done, int total) {
    public int percent() {
        return total == 0 ? 100 : (int) (100L * done / total);
    }

    public boolean isFinal() {
        return done == total;
    }

    @Override
    public String toString() {
        return phase.title() + "... " + done + "/" + total;
    }
}
