package com.mk.fx.qa.load.ramp.executors.step;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.ramp.exception.RampExecutionException;
import com.mk.fx.qa.load.ramp.log.LogSink;
import com.mk.fx.qa.load.ramp.metrics.ErrorClassifier;
import com.mk.fx.qa.load.ramp.metrics.StepStatsAggregator;
import com.mk.fx.qa.load.ramp.metrics.StepSummary;
import com.mk.fx.qa.load.ramp.processors.RequestExecutor;
import com.mk.fx.qa.load.ramp.rest.JsonUtil;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a stepped ramp: for every step size it waits the ramp-up delay, runs that many {@link
 * VirtualUserLoop}s until the step deadline, then reports the step's statistics to the run log.
 *
 * <p>Threading: each step gets its own fixed pool with one daemon thread per virtual user. The
 * step ends only when every user's future has completed, so no worker of one step can record into
 * the next. The pool is shut down before moving on, also when the step fails.
 *
 * <p>Failures: request failures are counted, never thrown. A worker that throws, or a pool that
 * cannot start its workers, aborts the whole ramp with {@link RampExecutionException}. An
 * interrupt during the ramp aborts it with {@link InterruptedException}.
 */
@Slf4j
public final class StepRampExecutor {

  static final Duration DEFAULT_POOL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  private final LogSink sink;
  private final RequestExecutor requestExecutor;
  private final StepStatsAggregator aggregator;
  private final Duration poolShutdownTimeout;
  private final ThreadFactory threadFactoryOverride;

  private volatile RampState state = RampState.IDLE;
  private volatile int currentStepUsers;

  public StepRampExecutor(LogSink sink, RequestExecutor requestExecutor) {
    this(sink, requestExecutor, new StepStatsAggregator(), DEFAULT_POOL_SHUTDOWN_TIMEOUT);
  }

  /**
   * @param sink run log receiving step announcements, results and request failures
   * @param requestExecutor issues the run's request, shared by every virtual user
   * @param aggregator statistics for the active step, reset at every step boundary
   * @param poolShutdownTimeout how long to wait for a step's threads to exit after shutdown
   */
  public StepRampExecutor(
      LogSink sink,
      RequestExecutor requestExecutor,
      StepStatsAggregator aggregator,
      Duration poolShutdownTimeout) {
    this(sink, requestExecutor, aggregator, poolShutdownTimeout, null);
  }

  @VisibleForTesting
  StepRampExecutor(
      LogSink sink,
      RequestExecutor requestExecutor,
      StepStatsAggregator aggregator,
      Duration poolShutdownTimeout,
      ThreadFactory threadFactoryOverride) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.requestExecutor = Objects.requireNonNull(requestExecutor, "requestExecutor");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.poolShutdownTimeout = Objects.requireNonNull(poolShutdownTimeout, "poolShutdownTimeout");
    this.threadFactoryOverride = threadFactoryOverride;
  }

  /**
   * Runs every step of the ramp.
   *
   * @param runId identifier used in thread names and logs
   * @param parameters step sizes and timings
   * @return one summary per step
   * @throws InterruptedException if interrupted during ramp-up or while waiting for a step
   * @throws RampExecutionException if workers cannot be started or a worker fails
   */
  public StepRampResult execute(String runId, StepRampParameters parameters)
      throws InterruptedException {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(parameters, "parameters");
    if (state != RampState.IDLE) {
      throw new IllegalStateException("Ramp " + runId + " already executed (state=" + state + ")");
    }

    var steps = parameters.steps();
    var rampStarted = System.nanoTime();
    List<StepSummary> summaries = new ArrayList<>(steps.size());

    log.info(
        "Ramp {} planned {} steps {} (duration/step={}, rampUp={})",
        runId,
        steps.size(),
        steps,
        parameters.durationPerStep(),
        parameters.rampUp());
    sink.info("Starting load test...");

    try {
      for (int users : steps) {
        currentStepUsers = users;
        transition(runId, RampState.RAMPING_UP);
        sink.info("Ramping up to {} users...", users);
        aggregator.reset();
        if (!parameters.rampUp().isZero()) {
          TimeUnit.NANOSECONDS.sleep(parameters.rampUp().toNanos());
        }

        transition(runId, RampState.RUNNING);
        var elapsed = runStep(runId, users, parameters.durationPerStep());

        transition(runId, RampState.REPORTING);
        var summary = aggregator.summarize(users, elapsed);
        report(summary);
        summaries.add(summary);
        aggregator.reset();
      }
    } catch (InterruptedException | RuntimeException | Error failure) {
      transition(runId, RampState.FAILED);
      sink.error(
          "Load test aborted during step of {} users: {}",
          currentStepUsers,
          ErrorClassifier.describe(failure));
      throw failure;
    }

    transition(runId, RampState.DONE);
    var result = new StepRampResult(runId, summaries, elapsedMs(rampStarted));
    sink.info("Load test completed!");
    logRunReport(result);
    return result;
  }

  public RampState state() {
    return state;
  }

  /** Concurrency of the step currently (or last) executed, 0 before the first step. */
  public int currentStepUsers() {
    return currentStepUsers;
  }

  /** Runs one step's virtual users and blocks until all of them have returned. */
  private Duration runStep(String runId, int users, Duration durationPerStep)
      throws InterruptedException {
    ExecutorService executor = newFixedThreadPool(users, threadFactory(runId, users));
    List<Future<Long>> futures = new ArrayList<>(users);

    var started = System.nanoTime();
    var deadline = started + durationPerStep.toNanos();
    long recorded = 0;
    try {
      try {
        for (int userIndex = 0; userIndex < users; userIndex++) {
          futures.add(
              executor.submit(
                  new VirtualUserLoop(
                      userIndex, users, deadline, requestExecutor, aggregator, sink)));
        }
      } catch (RuntimeException spawnFailure) {
        throw new RampExecutionException(
            "Could not start virtual user "
                + (futures.size() + 1)
                + "/"
                + users
                + ": "
                + ErrorClassifier.describe(spawnFailure),
            spawnFailure);
      }
      log.debug("Ramp {} step {} launched {} virtual users", runId, users, futures.size());

      for (Future<Long> future : futures) {
        try {
          recorded += future.get();
        } catch (ExecutionException workerFailure) {
          var cause = workerFailure.getCause();
          throw new RampExecutionException(
              "Virtual user failed during step of "
                  + users
                  + " users: "
                  + ErrorClassifier.describe(cause),
              cause);
        }
      }
    } finally {
      shutdown(runId, users, executor);
    }

    var elapsed = Duration.ofNanos(System.nanoTime() - started);
    var aggregated = aggregator.totalRequests();
    if (aggregated != recorded) {
      log.warn(
          "Ramp {} step {}: users recorded {} requests but aggregator holds {}",
          runId,
          users,
          recorded,
          aggregated);
    }
    return elapsed;
  }

  private ThreadFactory threadFactory(String runId, int users) {
    if (threadFactoryOverride != null) {
      return threadFactoryOverride;
    }
    var sequence = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("ramp-" + runId + "-step-" + users + "-user-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  /** Stops the step's pool; on the failure path this interrupts users still running. */
  private void shutdown(String runId, int users, ExecutorService executor) {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(poolShutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn(
            "Ramp {} step {}: virtual users still running {} after shutdown",
            runId,
            users,
            poolShutdownTimeout);
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn(
          "Ramp {} step {}: interrupted while waiting for virtual users to stop", runId, users);
    }
  }

  private void report(StepSummary summary) {
    sink.info("Results for {} concurrent users:", summary.users());
    sink.info("Total Requests: {}", summary.totalRequests());
    sink.info("Successful Requests: {}", summary.successfulRequests());
    sink.info("Failed Requests: {}", summary.failedRequests());
    sink.info("Average Latency: {}ms", format(summary.averageLatencyMs()));
    sink.info("Success Rate: {}%", format(summary.successRatePercent()));
    sink.info(
        "Throughput: {} req/s over {}ms", format(summary.throughputRps()), summary.elapsedMs());
    if (summary.minLatencyMs() != null) {
      sink.info("Latency min/max: {}ms/{}ms", summary.minLatencyMs(), summary.maxLatencyMs());
    }
    if (!summary.errorBreakdown().isEmpty()) {
      sink.info("Failures by type: {}", summary.errorBreakdown());
    }
  }

  private void logRunReport(StepRampResult result) {
    try {
      log.info("Ramp {} run report:\n{}", result.runId(), JsonUtil.toPrettyJson(result));
    } catch (JsonProcessingException e) {
      log.info("Ramp {} run report (unformatted): {}", result.runId(), result);
    }
  }

  private void transition(String runId, RampState next) {
    log.debug("Ramp {} {} -> {} (users={})", runId, state, next, currentStepUsers);
    state = next;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
