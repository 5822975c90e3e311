package com.namekis.treewatcher;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a load across two executors: parsing and building on {@code worker}, publishing the {@link LazyTreeModel} on
 * {@code primary}, the executor that owns the view. The forest crosses over once and is not touched by the worker
 * afterwards.
 *
 * <p>
 * Each load gets a generation number. A result whose generation is no longer the latest is dropped with
 * {@link LoadStatus#SUPERSEDED} instead of being published, and its progress stops reaching the listener.
 */
public class TreeLoader {
    private static final Logger log = LoggerFactory.getLogger(TreeLoader.class);

    private final Executor worker;
    private final Executor primary;
    private final BuildStrategy strategy;
    private final ProgressListener listener;
    private final AtomicLong generation = new AtomicLong();
    private volatile LazyTreeModel currentModel;

    public TreeLoader(Executor worker, Executor primary, BuildStrategy strategy, ProgressListener listener) {
        this.worker = worker;
        this.primary = primary;
        this.strategy = strategy;
        this.listener = listener != null ? listener : ProgressListener.NOOP;
    }

    public CompletableFuture<LoadResult> load(List<String> lines) {
        long gen = generation.incrementAndGet();
        List<String> snapshot = List.copyOf(lines);
        // a superseded load falls silent so the listener only follows the latest one
        ProgressReporter progress = new ProgressReporter(event -> {
            if (!isStale(gen))
                listener.onProgress(event);
        });
        log.debug("Load #{} of {} lines with {}", gen, snapshot.size(), strategy);
        return CompletableFuture.supplyAsync(() -> build(gen, snapshot, progress), worker)
                .thenApplyAsync(built -> publish(gen, built, progress), primary);
    }

    /** The model of the latest published load, null before the first one. */
    public LazyTreeModel currentModel() {
        return currentModel;
    }

    public long generation() {
        return generation.get();
    }

    private boolean isStale(long gen) {
        return generation.get() != gen;
    }

    private LoadResult build(long gen, List<String> lines, ProgressReporter progress) {
        if (lines.isEmpty())
            return LoadResult.emptyInput();
        if (isStale(gen))
            return LoadResult.superseded(lines.size());
        long start = System.nanoTime();
        List<ParsedItem> items;
        try {
            items = ListingReader.read(lines, progress);
        } catch (NoRootFoundException e) {
            log.debug("Load #{}: {}", gen, e.getMessage());
            return LoadResult.noRootFound(lines.size());
        }
        if (isStale(gen))
            return LoadResult.superseded(lines.size());
        Forest forest = strategy.build(items, progress);
        if (log.isDebugEnabled())
            log.debug("Load #{} built {} nodes from {} items in {} ms", gen, forest.nodeCount(), items.size(),
                    (System.nanoTime() - start) / 1_000_000);
        return LoadResult.built(forest, lines.size(), items.size());
    }

    private LoadResult publish(long gen, LoadResult built, ProgressReporter progress) {
        if (isStale(gen)) {
            log.debug("Dropping stale load #{}, latest is #{}", gen, generation.get());
            return LoadResult.superseded(built.lineCount());
        }
        if (!built.isLoaded())
            return built;
        LazyTreeModel model = LazyTreeModel.of(built.forest(), progress);
        currentModel = model;
        return built.withModel(model);
    }
}
