/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.provider;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Serializes calls to a rate-limited service and spaces the start of
 * successive calls by at least a minimum delay, no matter how many threads
 * share the gate.
 */
@Slf4j
public class RateGate {

    private final long minDelayNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final ReentrantLock gateLock = new ReentrantLock(true);

    private long lastStartNanos;
    private boolean started;

    public RateGate(Duration minDelay) {
        this(minDelay, System::nanoTime, Sleeper.SYSTEM);
    }

    public RateGate(Duration minDelay, LongSupplier nanoClock, Sleeper sleeper) {
        Objects.requireNonNull(minDelay, "minDelay must not be null");
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("minDelay must not be negative: " + minDelay);
        }
        this.minDelayNanos = minDelay.toNanos();
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Waits for the gate to open, then runs the call while holding it. Only one
     * call is in flight at a time.
     *
     * @throws GeocodeInterruptedException if interrupted while waiting
     */
    public <T> T call(Supplier<T> call) {
        gateLock.lock();
        try {
            awaitSlot();
            lastStartNanos = nanoClock.getAsLong();
            started = true;
            return call.get();
        } finally {
            gateLock.unlock();
        }
    }

    public Duration getMinDelay() {
        return Duration.ofNanos(minDelayNanos);
    }

    private void awaitSlot() {
        if (!started) {
            return;
        }
        long waitNanos = lastStartNanos + minDelayNanos - nanoClock.getAsLong();
        if (waitNanos <= 0) {
            return;
        }
        log.debug("Rate gate closed, waiting {} ms", waitNanos / 1_000_000);
        try {
            sleeper.sleep(Duration.ofNanos(waitNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeocodeInterruptedException("Interrupted while waiting on the rate gate", e);
        }
    }
}
