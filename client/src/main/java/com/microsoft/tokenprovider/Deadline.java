// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

import com.microsoft.tokenprovider.utils.Helpers;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;

/**
 * The point in time after which a caller of {@link TokenCache#getAccessToken} gives up waiting.
 */
final class Deadline {
    // Anything longer is treated as no timeout to keep nanoTime arithmetic from overflowing.
    private static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE / 4;

    private final long deadlineNanos;
    private final boolean infinite;

    private Deadline(long deadlineNanos, boolean infinite) {
        this.deadlineNanos = deadlineNanos;
        this.infinite = infinite;
    }

    static Deadline after(@Nullable Duration timeout) {
        if (Helpers.isInfiniteTimeout(timeout) || timeout.compareTo(Duration.ofNanos(MAX_TIMEOUT_NANOS)) > 0) {
            return new Deadline(0, true);
        }

        return new Deadline(System.nanoTime() + timeout.toNanos(), false);
    }

    boolean isInfinite() {
        return this.infinite;
    }

    Duration remaining() {
        if (this.infinite) {
            throw new IllegalStateException("An infinite deadline has no remaining time");
        }

        return Duration.ofNanos(Math.max(0, this.deadlineNanos - System.nanoTime()));
    }

    /**
     * Acquires {@code lock}, giving up when the deadline passes or the thread is interrupted.
     */
    void lock(Lock lock, String description) throws TimeoutException {
        try {
            if (this.infinite) {
                lock.lockInterruptibly();
            } else if (!lock.tryLock(this.remaining().toNanos(), TimeUnit.NANOSECONDS)) {
                throw new TimeoutException("Timed out waiting for " + description);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenCacheException("Interrupted while waiting for " + description, e);
        }
    }

    /**
     * Waits once on {@code condition}, whose lock must be held. Callers re-check their guard after this returns.
     */
    void await(Condition condition, String description) throws TimeoutException {
        try {
            if (this.infinite) {
                condition.await();
                return;
            }

            long remainingNanos = this.remaining().toNanos();
            if (remainingNanos <= 0) {
                throw new TimeoutException("Timed out waiting for " + description);
            }
            condition.awaitNanos(remainingNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenCacheException("Interrupted while waiting for " + description, e);
        }
    }
}
