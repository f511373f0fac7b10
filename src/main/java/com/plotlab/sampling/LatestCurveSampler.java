package com.plotlab.sampling;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import com.plotlab.debug.Debug;

/**
 * Runs sampling off the caller's thread for hosts that cannot afford to
 * sample inline (large step counts, slow devices).
 *
 * Requests are grouped by field name ("target", "player", ...). Within a
 * field the newest request wins: a result is delivered only if no later
 * request for the same field was submitted while it was running, so a stale
 * curve can never overwrite a fresher one.
 */
public final class LatestCurveSampler {

    private final Sampler sampler;
    private final Executor executor;
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();

    public LatestCurveSampler(Sampler sampler, Executor executor) {
        if (sampler == null) throw new IllegalArgumentException("sampler must not be null");
        if (executor == null) throw new IllegalArgumentException("executor must not be null");
        this.sampler = sampler;
        this.executor = executor;
    }

    /**
     * Samples {@code text} asynchronously and hands the result to
     * {@code onResult} unless a newer request for {@code field} superseded it.
     *
     * @return future completing with true if the result was delivered, false if it was dropped
     */
    public CompletableFuture<Boolean> submit(String field, String text, Consumer<SampleResult> onResult) {
        AtomicLong counter = generations.computeIfAbsent(field, k -> new AtomicLong());
        long generation = counter.incrementAndGet();

        return CompletableFuture.supplyAsync(() -> sampler.sample(text), executor)
                .thenApply(result -> {
                    synchronized (counter) {
                        if (counter.get() != generation) {
                            Debug.get().t(Debug.TAG_SAMPLE, "dropping stale " + field + " sample #" + generation);
                            return false;
                        }
                        onResult.accept(result);
                        return true;
                    }
                });
    }

    /** Marks every in-flight request for {@code field} as stale. */
    public void cancel(String field) {
        AtomicLong counter = generations.get(field);
        if (counter != null) {
            synchronized (counter) {
                counter.incrementAndGet();
            }
        }
    }
}
