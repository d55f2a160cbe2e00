/*
 * /////////////////////////////////////////////////////////////////////////////
 *
 * Copyright (c) 2026 Indra Sistemas, S.A. All Rights Reserved.
 * http://www.indracompany.com/
 *
 * The contents of this file are owned by Indra Sistemas, S.A. copyright holder.
 * This file can only be copied, distributed and used all or in part with the
 * written permission of Indra Sistemas, S.A, or in accordance with the terms and
 * conditions laid down in the agreement / contract under which supplied.
 *
 * /////////////////////////////////////////////////////////////////////////////
 */
package com.indra.minsait.dvsmart.extraction.infrastructure.retry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffTest {

    private final List<Duration> sleeps = new ArrayList<>();

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void delaysDoubleFromInitialValue() {
        ExponentialBackoff backoff = new ExponentialBackoff(6, Duration.ofSeconds(2), 2.0, sleeps::add);

        assertEquals(Duration.ofSeconds(2), backoff.delayAfter(1));
        assertEquals(Duration.ofSeconds(4), backoff.delayAfter(2));
        assertEquals(Duration.ofSeconds(8), backoff.delayAfter(3));
        assertEquals(Duration.ofSeconds(16), backoff.delayAfter(4));
        assertEquals(Duration.ofSeconds(32), backoff.delayAfter(5));
    }

    @Test
    void succeedsAfterTransientFailures() throws IOException {
        ExponentialBackoff backoff = new ExponentialBackoff(6, Duration.ofSeconds(2), 2.0, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        String result = backoff.execute("connect", EOFException.class, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new EOFException("dropped");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
    }

    @Test
    void otherFailuresAreNotRetried() {
        ExponentialBackoff backoff = new ExponentialBackoff(6, Duration.ofSeconds(2), 2.0, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ConnectException.class, () -> backoff.execute("connect", EOFException.class, () -> {
            calls.incrementAndGet();
            throw new ConnectException("refused");
        }));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void lastFailureIsRethrownWhenAttemptsRunOut() {
        ExponentialBackoff backoff = new ExponentialBackoff(3, Duration.ofMillis(100), 2.0, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        EOFException ex = assertThrows(EOFException.class, () -> backoff.execute("connect", EOFException.class, () -> {
            throw new EOFException("attempt " + calls.incrementAndGet());
        }));

        assertEquals("attempt 3", ex.getMessage());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void interruptedWaitStopsRetrying() {
        Sleeper interrupting = delay -> {
            throw new InterruptedException("stop");
        };
        ExponentialBackoff backoff = new ExponentialBackoff(6, Duration.ofSeconds(1), 2.0, interrupting);

        assertThrows(InterruptedIOException.class, () -> backoff.execute("connect", EOFException.class, () -> {
            throw new EOFException("dropped");
        }));
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoff(0, Duration.ofSeconds(1), 2.0, Sleeper.SYSTEM));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoff(3, Duration.ofSeconds(1), 0.5, Sleeper.SYSTEM));
    }
}
