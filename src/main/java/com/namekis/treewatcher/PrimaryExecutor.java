package com.namekis.treewatcher;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * An executor whose tasks run on whichever thread calls {@link #runUntil(CompletableFuture)}. Lets a plain main thread
 * act as the primary line of control for a {@link TreeLoader}, the way an event loop would in a GUI.
 */
public final class PrimaryExecutor implements Executor {
    private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();

    @Override
    public void execute(Runnable task) {
        tasks.add(task);
    }

    public <T> T runUntil(CompletableFuture<T> future) throws InterruptedException, ExecutionException {
        // wakes the loop up when the future fails before reaching this executor
        future.whenComplete((result, error) -> tasks.add(() -> {
        }));
        while (!future.isDone())
            tasks.take().run();
        return future.get();
    }

    int pending() {
        return tasks.size();
    }
}
