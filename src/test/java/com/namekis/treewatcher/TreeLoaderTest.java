package com.namekis.treewatcher;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

class TreeLoaderTest {

    /** Queues worker tasks until the test runs them. */
    static final class ManualExecutor implements Executor {
        final List<Runnable> tasks = new ArrayList<>();

        @Override
        public void execute(Runnable task) {
            tasks.add(task);
        }

        void runAll() {
            List<Runnable> now = new ArrayList<>(tasks);
            tasks.clear();
            now.forEach(Runnable::run);
        }
    }

    @Test
    void loadsOnWorkerAndPublishesOnPrimary() throws Exception {
        List<ProgressEvent> events = Collections.synchronizedList(new ArrayList<>());
        ExecutorService worker = Executors.newSingleThreadExecutor();
        PrimaryExecutor primary = new PrimaryExecutor();
        try {
            TreeLoader loader = new TreeLoader(worker, primary, BuildStrategy.RECURSIVE, events::add);
            LoadResult result = primary.runUntil(loader.load(List.of("C:.", "├── a", "└── b")));

            assertEquals(LoadStatus.LOADED, result.status());
            assertEquals(3, result.lineCount());
            assertEquals(3, result.itemCount());
            assertSame(result.model(), loader.currentModel());
            // the model belongs to this thread, which drained the primary queue
            assertEquals("C:.", result.model().roots().get(0).name());
            assertEquals(2, result.model().expand(result.model().roots().get(0)).size());
        } finally {
            worker.shutdownNow();
        }
        for (Phase phase : Phase.values())
            assertTrue(events.stream().anyMatch(e -> e.phase() == phase && e.isFinal()), phase.name());
    }

    @Test
    void emptyInput() throws Exception {
        TreeLoader loader = new TreeLoader(Runnable::run, Runnable::run, BuildStrategy.STACK, null);
        LoadResult result = loader.load(List.of()).get();
        assertEquals(LoadStatus.EMPTY_INPUT, result.status());
        assertEquals("File is empty", result.message());
        assertNull(loader.currentModel());
    }

    @Test
    void bannerOnlyInput() throws Exception {
        TreeLoader loader = new TreeLoader(Runnable::run, Runnable::run, BuildStrategy.STACK, null);
        LoadResult result = loader.load(List.of("Folder PATH listing for volume C")).get();
        assertEquals(LoadStatus.NO_ROOT_FOUND, result.status());
        assertEquals("No tree structure found.", result.message());
        assertNull(result.model());
        assertTrue(result.forest().isEmpty());
    }

    @Test
    void newerLoadSupersedesOlderOne() throws Exception {
        ManualExecutor worker = new ManualExecutor();
        TreeLoader loader = new TreeLoader(worker, Runnable::run, BuildStrategy.STACK, null);

        CompletableFuture<LoadResult> first = loader.load(List.of("old", "├── x"));
        CompletableFuture<LoadResult> second = loader.load(List.of("new", "├── y"));
        worker.runAll();

        assertEquals(LoadStatus.SUPERSEDED, first.get().status());
        assertEquals(LoadStatus.LOADED, second.get().status());
        assertEquals("new", loader.currentModel().roots().get(0).name());
        assertEquals(2, loader.generation());
    }

    @Test
    void staleResultIsDroppedAtHandover() throws Exception {
        ManualExecutor worker = new ManualExecutor();
        ManualExecutor primary = new ManualExecutor();
        TreeLoader loader = new TreeLoader(worker, primary, BuildStrategy.RECURSIVE, null);

        CompletableFuture<LoadResult> first = loader.load(List.of("old", "├── x"));
        worker.runAll();
        // built, but not yet handed over when the next load starts
        CompletableFuture<LoadResult> second = loader.load(List.of("new"));
        primary.runAll();
        assertEquals(LoadStatus.SUPERSEDED, first.get().status());
        assertNull(loader.currentModel());

        worker.runAll();
        primary.runAll();
        assertEquals(LoadStatus.LOADED, second.get().status());
        assertEquals("new", loader.currentModel().roots().get(0).name());
    }

    @Test
    void supersededLoadStopsReportingProgress() throws Exception {
        ManualExecutor worker = new ManualExecutor();
        List<ProgressEvent> events = new ArrayList<>();
        AtomicReference<TreeLoader> loader = new AtomicReference<>();
        AtomicReference<CompletableFuture<LoadResult>> second = new AtomicReference<>();
        loader.set(new TreeLoader(worker, Runnable::run, BuildStrategy.STACK, event -> {
            events.add(event);
            // the first event of the first load starts the next one
            if (second.get() == null)
                second.set(loader.get().load(List.of("new")));
        }));

        CompletableFuture<LoadResult> first = loader.get().load(List.of("old", "├── a", "├── b", "└── c"));
        worker.runAll();
        assertEquals(LoadStatus.SUPERSEDED, first.get().status());
        assertEquals(List.of(new ProgressEvent(Phase.PARSING, 1, 4)), events);

        worker.runAll();
        assertEquals(LoadStatus.LOADED, second.get().get().status());
        assertTrue(events.size() > 1);
        for (ProgressEvent event : events.subList(1, events.size()))
            assertEquals(1, event.total(), event.toString());
    }

    @Test
    void rejectedWorkerTaskReachesCaller() {
        Executor failing = task -> {
            throw new IllegalStateException("worker pool shut down");
        };
        TreeLoader loader = new TreeLoader(failing, Runnable::run, BuildStrategy.STACK, null);
        assertThrows(Exception.class, () -> loader.load(List.of("root")).get());
    }

    @Test
    void primaryExecutorReturnsFailures() {
        PrimaryExecutor primary = new PrimaryExecutor();
        CompletableFuture<String> failed = CompletableFuture.failedFuture(new IllegalStateException("boom"));
        ExecutionException e = assertThrows(ExecutionException.class, () -> primary.runUntil(failed));
        assertEquals("boom", e.getCause().getMessage());
    }
}
