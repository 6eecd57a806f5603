package org.janelia.transients.pipeline;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs independent units of work concurrently with a per-attempt timeout and bounded retries.
 * <p>
 * Each unit is supervised by one thread of a fixed size pool (which bounds concurrency).
 * The supervisor runs each attempt on a separate worker thread so that it can stop waiting when the
 * attempt times out. Attempts that time out, or fail with a retryable exception, are retried until
 * the attempt limit is reached. A failing unit never affects its siblings.
 * Outcomes are returned in the same order as the unit keys.
 */
public class UnitOfWorkRunner
        implements AutoCloseable {

    /**
     * Work for one unit.
     */
    @FunctionalInterface
    public interface UnitFunction<K, T> {
        T apply(final K key) throws Exception;
    }

    /**
     * Result or final failure of one unit.
     */
    public static class UnitOutcome<K, T> {

        private final K key;
        private final T result;
        private final Throwable failure;
        private final int attemptCount;
        private final int timeoutCount;

        UnitOutcome(final K key,
                    final T result,
                    final Throwable failure,
                    final int attemptCount,
                    final int timeoutCount) {
            this.key = key;
            this.result = result;
            this.failure = failure;
            this.attemptCount = attemptCount;
            this.timeoutCount = timeoutCount;
        }

        public K getKey() {
            return key;
        }

        public boolean isSuccess() {
            return failure == null;
        }

        public T getResult() {
            return result;
        }

        public Throwable getFailure() {
            return failure;
        }

        public int getAttemptCount() {
            return attemptCount;
        }

        public int getTimeoutCount() {
            return timeoutCount;
        }

        public boolean isTimedOut() {
            return failure instanceof TimeoutException;
        }
    }

    private final int maxAttempts;
    private final long timeoutMilliseconds;
    private final Predicate<Throwable> isRetryable;
    private final ExecutorService supervisorPool;
    private final ExecutorService workerPool;

    /**
     * @param  threads              maximum number of units processed concurrently.
     * @param  timeoutMilliseconds  maximum time for one attempt.
     * @param  maxAttempts          maximum attempts per unit.
     * @param  isRetryable          identifies failures worth retrying (timeouts are always retried).
     */
    public UnitOfWorkRunner(final int threads,
                            final long timeoutMilliseconds,
                            final int maxAttempts,
                            final Predicate<Throwable> isRetryable) {
        this.maxAttempts = maxAttempts;
        this.timeoutMilliseconds = timeoutMilliseconds;
        this.isRetryable = isRetryable;
        this.supervisorPool = Executors.newFixedThreadPool(
                threads,
                new ThreadFactoryBuilder().setNameFormat("unit-supervisor-%d").setDaemon(true).build());
        this.workerPool = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("unit-worker-%d").setDaemon(true).build());
    }

    public <K, T> List<UnitOutcome<K, T>> runAll(final List<K> keys,
                                                 final UnitFunction<K, T> function) {

        final List<Future<UnitOutcome<K, T>>> futures = new ArrayList<>(keys.size());
        for (final K key : keys) {
            futures.add(supervisorPool.submit(() -> runUnit(key, function)));
        }

        final List<UnitOutcome<K, T>> outcomes = new ArrayList<>(keys.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("interrupted while waiting for units to complete", e);
            } catch (final ExecutionException e) {
                // supervisors catch everything, so this only happens for errors like OutOfMemoryError
                outcomes.add(new UnitOutcome<>(keys.get(i), null, e.getCause(), 0, 0));
            }
        }

        return outcomes;
    }

    private <K, T> UnitOutcome<K, T> runUnit(final K key,
                                             final UnitFunction<K, T> function) {

        Throwable lastFailure = null;
        int timeoutCount = 0;
        int attempt = 0;

        while (attempt < maxAttempts) {

            attempt++;
            final Future<T> future = workerPool.submit(() -> function.apply(key));

            try {

                final T result = future.get(timeoutMilliseconds, TimeUnit.MILLISECONDS);
                if (attempt > 1) {
                    LOG.info("runUnit: {} succeeded on attempt {}", key, attempt);
                }
                return new UnitOutcome<>(key, result, null, attempt, timeoutCount);

            } catch (final TimeoutException e) {

                future.cancel(true);
                timeoutCount++;
                lastFailure = new TimeoutException("unit " + key + " attempt " + attempt + " exceeded " +
                                                   timeoutMilliseconds + "ms");
                LOG.warn("runUnit: {}", lastFailure.getMessage());

            } catch (final ExecutionException e) {

                lastFailure = e.getCause();
                if (! isRetryable.test(lastFailure)) {
                    break;
                }
                LOG.warn("runUnit: {} attempt {} of {} failed", key, attempt, maxAttempts, lastFailure);

            } catch (final InterruptedException e) {

                future.cancel(true);
                Thread.currentThread().interrupt();
                lastFailure = e;
                break;
            }
        }

        return new UnitOutcome<>(key, null, lastFailure, attempt, timeoutCount);
    }

    @Override
    public void close() {
        supervisorPool.shutdownNow();
        workerPool.shutdownNow();
    }

    private static final Logger LOG = LoggerFactory.getLogger(UnitOfWorkRunner.class);
}
