package com.mk.fx.qa.load.ramp.executors.step;

import com.mk.fx.qa.load.ramp.log.LogLevel;
import com.mk.fx.qa.load.ramp.log.LogSink;
import com.mk.fx.qa.load.ramp.metrics.StepStatsAggregator;
import com.mk.fx.qa.load.ramp.processors.RequestExecutor;
import com.mk.fx.qa.load.ramp.processors.RequestOutcome;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * One virtual user of a step: issues requests back-to-back until the step deadline passes.
 *
 * <p>This is a closed-loop worker. The next request goes out as soon as the previous outcome has
 * been recorded, with no think time. A step's throughput is therefore bounded by {@code users /
 * latency} and falls as the target slows down. It is not an open arrival rate, and throughput
 * figures should be read with that in mind.
 *
 * <p>The deadline is checked between requests only. A request in flight when the deadline passes
 * is allowed to finish and is recorded, so a loop overruns by at most one request latency. At least
 * one request is always issued, even with a deadline already in the past. Failed requests never
 * stop the loop; thread interruption does, and the interrupted attempt is not recorded.
 */
public final class VirtualUserLoop implements Callable<Long> {

  private final int userIndex;
  private final int stepUsers;
  private final long deadlineNanos;
  private final RequestExecutor requestExecutor;
  private final StepStatsAggregator aggregator;
  private final LogSink sink;

  /**
   * @param userIndex zero-based index of this user within its step
   * @param stepUsers concurrency of the step, for diagnostics
   * @param deadlineNanos {@link System#nanoTime()} value after which no new request is started
   * @param requestExecutor issues the run's request
   * @param aggregator step statistics shared by every user of the step
   * @param sink receives per-request diagnostics
   */
  public VirtualUserLoop(
      int userIndex,
      int stepUsers,
      long deadlineNanos,
      RequestExecutor requestExecutor,
      StepStatsAggregator aggregator,
      LogSink sink) {
    this.userIndex = userIndex;
    this.stepUsers = stepUsers;
    this.deadlineNanos = deadlineNanos;
    this.requestExecutor = Objects.requireNonNull(requestExecutor, "requestExecutor");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /**
   * Runs the loop.
   *
   * @return number of outcomes recorded by this user
   */
  @Override
  public Long call() {
    long recorded = 0;
    do {
      var outcome = requestExecutor.execute();
      if (Thread.currentThread().isInterrupted()) {
        break;
      }
      aggregator.record(outcome);
      recorded++;
      report(outcome);
    } while (System.nanoTime() - deadlineNanos < 0 && !Thread.currentThread().isInterrupted());
    return recorded;
  }

  private void report(RequestOutcome outcome) {
    if (outcome.success()) {
      if (sink.isEnabled(LogLevel.DEBUG)) {
        sink.debug(
            "Request completed with status code: {} latencyMs={} (user {}/{})",
            outcome.statusCode(),
            outcome.latencyMs(),
            userIndex + 1,
            stepUsers);
      }
    } else if (outcome.statusCode() == RequestOutcome.NO_STATUS) {
      sink.error(
          "Request failed with error: {} [{}] status={} latencyMs={} (user {}/{})",
          outcome.error(),
          outcome.category(),
          outcome.statusCode(),
          outcome.latencyMs(),
          userIndex + 1,
          stepUsers);
    } else {
      sink.warn(
          "Request failed with status code: {} [{}] latencyMs={} (user {}/{})",
          outcome.statusCode(),
          outcome.category(),
          outcome.latencyMs(),
          userIndex + 1,
          stepUsers);
    }
  }
}
