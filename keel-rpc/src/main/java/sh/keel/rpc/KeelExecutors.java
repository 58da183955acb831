// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors Keel uses internally.
 *
 * <p>
 * All threads are daemon threads with descriptive names so that stray
 * background loops never keep the JVM alive and show up clearly in thread
 * dumps.
 *
 * <ul>
 * <li>{@link #newScheduler(String, int)}: scheduler for periodic loops
 * (health checks, blockhash refresh)</li>
 * <li>{@link #newIoBoundExecutor(String, int)}: bounded pool for blocking
 * network work (concurrent health checks, per-identity transaction builds)</li>
 * </ul>
 */
public final class KeelExecutors {

    private KeelExecutors() {
        // Utility class
    }

    /**
     * Creates a scheduler with {@code threads} daemon threads named {@code <prefix>-N}.
     *
     * @throws IllegalArgumentException if threads is less than 1
     */
    public static ScheduledExecutorService newScheduler(final String prefix, final int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        return Executors.newScheduledThreadPool(threads, namedDaemon(prefix));
    }

    /**
     * Creates a fixed pool of {@code threads} daemon threads named {@code <prefix>-N}.
     *
     * @throws IllegalArgumentException if threads is less than 1
     */
    public static ExecutorService newIoBoundExecutor(final String prefix, final int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        return Executors.newFixedThreadPool(threads, namedDaemon(prefix));
    }

    /**
     * Shuts {@code executor} down and waits up to {@code timeoutMillis} for running
     * tasks, interrupting them if they do not finish.
     */
    public static void shutdown(final ExecutorService executor, final long timeoutMillis) {
        executor.shutdownNow();
        try {
            executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedDaemon(final String prefix) {
        final AtomicInteger ids = new AtomicInteger(0);
        return r -> {
            // Mask off sign bit to keep ids non-negative after overflow
            final Thread t = new Thread(r, prefix + "-" + (ids.getAndIncrement() & 0x7FFFFFFF));
            t.setDaemon(true);
            return t;
        };
    }
}
