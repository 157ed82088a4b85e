package com.ttennebkram.spectral.fft;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs independent per-channel tasks, either on the calling thread or on an executor.
 * Results keep the task order. If any task fails, the results of the others are
 * handed to the cleanup callback and the first failure is rethrown.
 */
final class ChannelRunner {

    private ChannelRunner() {
    }

    static <T> List<T> runAll(List<Supplier<T>> tasks, Executor executor, Consumer<T> cleanup) {
        if (executor == null) {
            return runSequential(tasks, cleanup);
        }

        List<CompletableFuture<T>> futures = new ArrayList<>();
        for (Supplier<T> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(task, executor));
        }

        List<T> results = new ArrayList<>();
        RuntimeException failure = null;
        for (CompletableFuture<T> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                if (failure == null) {
                    failure = unwrap(e);
                }
            }
        }
        if (failure != null) {
            results.forEach(cleanup);
            throw failure;
        }
        return results;
    }

    private static <T> List<T> runSequential(List<Supplier<T>> tasks, Consumer<T> cleanup) {
        List<T> results = new ArrayList<>();
        try {
            for (Supplier<T> task : tasks) {
                results.add(task.get());
            }
            return results;
        } catch (RuntimeException e) {
            results.forEach(cleanup);
            throw e;
        }
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return e;
    }
}
