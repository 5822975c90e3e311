package com.namekis.treewatcher;

/**
 * Receives throttled progress of a load. Called from whichever thread runs the phase, so implementations must be
 * thread safe and must hand any view update over to their own thread.
 */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(ProgressEvent event);

    ProgressListener NOOP = event -> {
    };
}
