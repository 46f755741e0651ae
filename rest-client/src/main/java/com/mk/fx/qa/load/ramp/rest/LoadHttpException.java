package com.mk.fx.qa.load.ramp.rest;

import lombok.Getter;

/**
 * Raised when a request could not be completed at the transport level (connection refused, DNS
 * failure, timeout, interruption). Carries the time spent before the failure was signalled.
 */
@Getter
public class LoadHttpException extends RuntimeException {

    private final long elapsedMs;
    private final boolean timeout;

    public LoadHttpException(String message, Throwable cause, long elapsedMs, boolean timeout) {
        super(message, cause);
        this.elapsedMs = elapsedMs;
        this.timeout = timeout;
    }
}
