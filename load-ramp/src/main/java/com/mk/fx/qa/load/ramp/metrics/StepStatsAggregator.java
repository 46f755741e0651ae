package com.mk.fx.qa.load.ramp.metrics;

import com.mk.fx.qa.load.ramp.processors.RequestOutcome;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accumulates request outcomes for the active load step.
 *
 * <p>{@link #record(RequestOutcome)} may be called from any number of threads concurrently; every
 * counter is an atomic, so no update is lost. {@link #reset()} and {@link #summarize(int,
 * Duration)} are only called at step boundaries, once every worker of the step has finished. The
 * aggregator does not enforce this itself; the ramp executor's join does.
 */
public final class StepStatsAggregator {

  private volatile StepStats current = new StepStats();

  public void record(RequestOutcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    current.record(outcome);
  }

  /** Discards everything recorded so far. */
  public void reset() {
    current = new StepStats();
  }

  /**
   * Builds the summary of what has been recorded since the last reset.
   *
   * @param users concurrency level of the step
   * @param elapsed how long the step's workers ran, used for throughput
   */
  public StepSummary summarize(int users, Duration elapsed) {
    Objects.requireNonNull(elapsed, "elapsed");
    return current.toSummary(users, elapsed);
  }

  public long totalRequests() {
    return current.total.get();
  }

  private static final class StepStats {
    final AtomicLong total = new AtomicLong();
    final AtomicLong successful = new AtomicLong();
    final AtomicLong failed = new AtomicLong();
    final AtomicLong latencySum = new AtomicLong();
    final AtomicLong minLatency = new AtomicLong(Long.MAX_VALUE);
    final AtomicLong maxLatency = new AtomicLong(Long.MIN_VALUE);
    final Map<String, AtomicLong> errorBreakdown = new ConcurrentHashMap<>();

    void record(RequestOutcome outcome) {
      long latency = Math.max(0, outcome.latencyMs());
      latencySum.addAndGet(latency);
      minLatency.accumulateAndGet(latency, Math::min);
      maxLatency.accumulateAndGet(latency, Math::max);
      if (outcome.success()) {
        successful.incrementAndGet();
      } else {
        failed.incrementAndGet();
        var key =
            outcome.category() == null || outcome.category().isBlank()
                ? "UNKNOWN"
                : outcome.category();
        errorBreakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
      }
      total.incrementAndGet();
    }

    StepSummary toSummary(int users, Duration elapsed) {
      long requests = total.get();
      long ok = successful.get();
      long ko = failed.get();
      long sum = latencySum.get();
      long elapsedMs = Math.max(0, elapsed.toMillis());

      // Empty steps report zeros rather than NaN.
      double average = requests == 0 ? 0.0 : (double) sum / requests;
      double successRate = requests == 0 ? 0.0 : (double) ok / requests;
      double throughput = requests == 0 || elapsedMs == 0 ? 0.0 : requests / (elapsedMs / 1000.0);

      Map<String, Long> breakdown = new HashMap<>();
      errorBreakdown.forEach((k, v) -> breakdown.put(k, v.get()));

      return new StepSummary(
          users,
          requests,
          ok,
          ko,
          sum,
          average,
          successRate,
          requests == 0 ? null : minLatency.get(),
          requests == 0 ? null : maxLatency.get(),
          elapsedMs,
          throughput,
          breakdown);
    }
  }
}
