package com.namekis.treewatcher;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Throttles progress of one load before it reaches a {@link ProgressListener}.
 *
 * <li>an event goes out once at least 1% of the phase total (and at least one item) passed since the previous one;
 * <li>{@code done == total} goes out exactly once per phase, later calls for that phase are ignored;
 * <li>{@code done} strictly increases per phase, stale or out of range values are dropped.
 *
 * A failing listener is logged at debug and otherwise ignored: progress never breaks a load.
 */
public final class ProgressReporter {
    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final ProgressListener listener;
    private final Map<Phase, Integer> lastDone = new EnumMap<>(Phase.class);
    private final Set<Phase> finished = EnumSet.noneOf(Phase.class);

    public ProgressReporter(ProgressListener listener) {
        this.listener = listener != null ? listener : ProgressListener.NOOP;
    }

    public static ProgressReporter silent() {
        return new ProgressReporter(ProgressListener.NOOP);
    }

    public static int step(int total) {
        return Math.max(1, total / 100);
    }

    public synchronized void report(Phase phase, int done, int total) {
        if (finished.contains(phase) || done < 0 || done > total)
            return;
        int last = lastDone.getOrDefault(phase, 0);
        boolean isFinal = done == total;
        if (!isFinal && done - last < step(total))
            return;
        lastDone.put(phase, done);
        if (isFinal)
            finished.add(phase);
        deliver(new ProgressEvent(phase, done, total));
    }

    public void complete(Phase phase, int total) {
        report(phase, total, total);
    }

    public synchronized boolean isFinished(Phase phase) {
        return finished.contains(phase);
    }

    private void deliver(ProgressEvent event) {
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            log.debug("Progress listener failed on {}", event, e);
        }
    }
}
