// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import sh.keel.core.types.Blockhash;

/**
 * Single shared recent blockhash.
 *
 * <p>
 * {@link #get()} returns the cached value or, when empty, fetches it while
 * holding the lock so that concurrent first readers trigger exactly one fetch.
 * {@link #refresh()} fetches outside the lock and swaps the value in under it.
 * Readers may see a value up to one refresh interval old.
 */
public final class BlockhashCache {

    private final Supplier<Blockhash> fetcher;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private @Nullable Blockhash value;
    private @Nullable Instant fetchedAt;

    public BlockhashCache(final Supplier<Blockhash> fetcher) {
        this(fetcher, Clock.systemUTC());
    }

    BlockhashCache(final Supplier<Blockhash> fetcher, final Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Blockhash get() {
        lock.lock();
        try {
            if (value == null) {
                store(fetcher.get());
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fetches a fresh blockhash and replaces the cached one.
     *
     * @return the new value
     */
    public Blockhash refresh() {
        final Blockhash fresh = fetcher.get();
        lock.lock();
        try {
            store(fresh);
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns when the cached value was fetched, or {@code null} if empty.
     */
    public @Nullable Instant fetchedAt() {
        lock.lock();
        try {
            return fetchedAt;
        } finally {
            lock.unlock();
        }
    }

    private void store(final Blockhash fresh) {
        value = Objects.requireNonNull(fresh, "fetched blockhash");
        fetchedAt = clock.instant();
    }
}
