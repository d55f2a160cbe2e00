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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 10-10-2026 at 09:20:31
 * File: ExponentialBackoff.java
 */

/**
 * Reintento con backoff exponencial, sin jitter.
 *
 * Solo se reintentan las excepciones del tipo indicado; cualquier otra se propaga
 * en el primer intento. Espera antes del reintento n: initialDelay * multiplier^(n-1).
 */
@Slf4j
@Getter
public class ExponentialBackoff {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Sleeper sleeper;

    public ExponentialBackoff(int maxAttempts, Duration initialDelay, double multiplier, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.sleeper = sleeper;
    }

    /**
     * Espera tras el intento fallido número {@code attempt} (1-based).
     */
    public Duration delayAfter(int attempt) {
        double factor = Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis(Math.round(initialDelay.toMillis() * factor));
    }

    public <T> T execute(
            String operationName,
            Class<? extends IOException> retryOn,
            RetryableOperation<T> operation) throws IOException {

        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            } catch (IOException e) {
                if (!retryOn.isInstance(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts", operationName, maxAttempts);
                    throw e;
                }

                Duration delay = delayAfter(attempt);
                log.warn("{} closed unexpectedly. Waiting {} seconds and retrying... (attempt {}/{})",
                        operationName, delay.toMillis() / 1000.0, attempt, maxAttempts);

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    InterruptedIOException interrupted = new InterruptedIOException(operationName + " retry interrupted");
                    interrupted.initCause(ie);
                    throw interrupted;
                }
            }
        }
    }
}
