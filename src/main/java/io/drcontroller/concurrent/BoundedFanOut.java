package io.drcontroller.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs one task per item on a fixed pool of worker threads and collects the results in
 * item order. A failing item never affects its siblings.
 */
@Slf4j
public class BoundedFanOut implements AutoCloseable {

    private static final long POLL_INTERVAL_MS = 20;

    private final String name;
    private final int parallelism;
    private final ExecutorService executor;

    public BoundedFanOut(String name, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
        }
        this.name = name;
        this.parallelism = parallelism;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Started fan-out pool '{}' with {} workers", name, parallelism);
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Apply {@code task} to every item.
     * <p>
     * Once {@code signal} is raised, items still queued or in flight are abandoned: their
     * futures are cancelled with interruption and {@code onCancelled} stands in for them.
     * Results of items that already completed are kept.
     *
     * @param onCancelled placeholder for items abandoned after the signal was raised
     * @param onError     result for items whose task threw
     */
    public <T, R> List<R> map(List<T> items,
                              Function<T, R> task,
                              Function<T, R> onCancelled,
                              BiFunction<T, Throwable, R> onError,
                              CancellationSignal signal) {
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(executor.submit(() -> signal.isCancelled() ? onCancelled.apply(item) : task.apply(item)));
        }

        List<R> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            results.add(await(items.get(i), futures.get(i), futures, onCancelled, onError, signal));
        }
        return results;
    }

    private <T, R> R await(T item,
                           Future<R> future,
                           List<Future<R>> futures,
                           Function<T, R> onCancelled,
                           BiFunction<T, Throwable, R> onError,
                           CancellationSignal signal) {
        while (true) {
            try {
                return future.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (signal.isCancelled()) {
                    abandon(futures);
                }
            } catch (InterruptedException e) {
                // Caller gave up waiting: abandon everything still outstanding
                Thread.currentThread().interrupt();
                signal.cancel();
                abandon(futures);
                return onCancelled.apply(item);
            } catch (CancellationException e) {
                return onCancelled.apply(item);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.warn("[{}] Task for item {} failed: {}", name, item, cause.toString());
                return onError.apply(item, cause);
            }
        }
    }

    private <R> void abandon(List<Future<R>> futures) {
        long abandoned = futures.stream().filter(f -> f.cancel(true)).count();
        if (abandoned > 0) {
            log.info("[{}] Cancellation requested, abandoned {} outstanding task(s)", name, abandoned);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stopped fan-out pool '{}'", name);
    }
}
