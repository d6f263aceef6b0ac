/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.provider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RateGate.
 */
class RateGateTest {

    private AtomicLong clock;
    private List<Duration> sleeps;
    private RateGate gate;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(1_000_000_000L);
        sleeps = new ArrayList<>();
        gate = new RateGate(Duration.ofSeconds(1), clock::get, duration -> {
            sleeps.add(duration);
            clock.addAndGet(duration.toNanos());
        });
    }

    @Test
    @DisplayName("Should let the first call through without waiting")
    void shouldNotWaitForFirstCall() {
        var result = gate.call(() -> "first");

        assertEquals("first", result);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should wait the full minimum delay for back-to-back calls")
    void shouldWaitFullDelayForImmediateCall() {
        gate.call(() -> 1);
        gate.call(() -> 2);

        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    @DisplayName("Should only wait for the remainder of the delay")
    void shouldWaitOnlyForRemainder() {
        gate.call(() -> 1);
        clock.addAndGet(Duration.ofMillis(400).toNanos());
        gate.call(() -> 2);

        assertEquals(List.of(Duration.ofMillis(600)), sleeps);
    }

    @Test
    @DisplayName("Should not wait when the delay has already elapsed")
    void shouldNotWaitWhenDelayElapsed() {
        gate.call(() -> 1);
        clock.addAndGet(Duration.ofMillis(1500).toNanos());
        gate.call(() -> 2);

        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should measure the delay from the start of the previous call")
    void shouldMeasureFromCallStart() {
        gate.call(() -> clock.addAndGet(Duration.ofMillis(700).toNanos()));
        gate.call(() -> 2);

        assertEquals(List.of(Duration.ofMillis(300)), sleeps);
    }

    @Test
    @DisplayName("Should open the gate after a failed call")
    void shouldReleaseGateAfterFailure() {
        assertThrows(GeocodeProviderException.class, () -> gate.call(() -> {
            throw new GeocodeProviderException("boom");
        }));

        assertEquals("next", gate.call(() -> "next"));
        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    @DisplayName("Should surface interruption and restore the interrupt flag")
    void shouldSurfaceInterruption() {
        var interrupting = new RateGate(Duration.ofSeconds(1), clock::get, duration -> {
            throw new InterruptedException("test");
        });
        interrupting.call(() -> 1);

        try {
            assertThrows(GeocodeInterruptedException.class, () -> interrupting.call(() -> 2));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Should reject a negative delay")
    void shouldRejectNegativeDelay() {
        assertThrows(IllegalArgumentException.class, () -> new RateGate(Duration.ofMillis(-1)));
    }

    @Test
    @DisplayName("Should serialize concurrent callers and space them by the delay")
    void shouldSerializeConcurrentCallers() throws InterruptedException {
        var delay = Duration.ofMillis(40);
        var sharedGate = new RateGate(delay);
        int threads = 4;
        int callsPerThread = 3;
        var inFlight = new AtomicInteger();
        var maxInFlight = new AtomicInteger();
        var done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        long startNanos = System.nanoTime();
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < callsPerThread; i++) {
                        sharedGate.call(() -> {
                            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                            inFlight.decrementAndGet();
                            return null;
                        });
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        long elapsedNanos = System.nanoTime() - startNanos;
        executor.shutdown();

        assertEquals(1, maxInFlight.get());
        long minimumNanos = delay.toNanos() * (threads * callsPerThread - 1);
        assertTrue(elapsedNanos >= minimumNanos,
                "Expected at least " + minimumNanos + "ns but took " + elapsedNanos + "ns");
    }
}
