package com.mk.fx.qa.load.ramp.metrics;

import java.util.Map;

/**
 * Immutable result of one load step.
 *
 * <p>{@code averageLatencyMs}, {@code successRate} and {@code throughputRps} are {@code 0} when the
 * step recorded no requests. {@code minLatencyMs} and {@code maxLatencyMs} are {@code null} in
 * that case.
 *
 * @param users concurrency level of the step
 * @param totalRequests requests recorded during the step
 * @param successfulRequests requests with a status in {@code [200, 400)}
 * @param failedRequests all other requests, transport failures included
 * @param totalLatencyMs sum of the latencies of all recorded requests
 * @param averageLatencyMs {@code totalLatencyMs / totalRequests}
 * @param successRate {@code successfulRequests / totalRequests}, between 0 and 1
 * @param minLatencyMs fastest recorded request
 * @param maxLatencyMs slowest recorded request
 * @param elapsedMs wall-clock time the step's workers ran
 * @param throughputRps {@code totalRequests} per second of {@code elapsedMs}
 * @param errorBreakdown failure count per category
 */
public record StepSummary(
    int users,
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    long totalLatencyMs,
    double averageLatencyMs,
    double successRate,
    Long minLatencyMs,
    Long maxLatencyMs,
    long elapsedMs,
    double throughputRps,
    Map<String, Long> errorBreakdown) {

  public StepSummary {
    errorBreakdown = errorBreakdown == null ? Map.of() : Map.copyOf(errorBreakdown);
  }

  public double successRatePercent() {
    return successRate * 100.0;
  }
}
