package com.mk.fx.qa.load.ramp.processors;

/**
 * Issues the run's configured request once. Method, URL, headers and body are fixed when the
 * executor is built.
 *
 * <p>Transport errors, timeouts and non-success statuses come back as unsuccessful outcomes;
 * they are never thrown. Anything that is thrown signals a broken executor rather than a failed
 * request, and aborts the run. Implementations must be safe to call from many threads at once and
 * must not log per request.
 */
@FunctionalInterface
public interface RequestExecutor {

  RequestOutcome execute();
}
