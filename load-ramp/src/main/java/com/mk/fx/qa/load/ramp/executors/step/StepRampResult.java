package com.mk.fx.qa.load.ramp.executors.step;

import com.mk.fx.qa.load.ramp.metrics.StepSummary;
import java.util.List;

/**
 * Outcome of a completed ramp.
 *
 * @param runId identifier used in thread names and logs
 * @param steps one summary per executed step, in execution order
 * @param elapsedMs wall-clock duration of the whole ramp, ramp-up pauses included
 */
public record StepRampResult(String runId, List<StepSummary> steps, long elapsedMs) {

  public StepRampResult {
    steps = List.copyOf(steps);
  }

  public long totalRequests() {
    return steps.stream().mapToLong(StepSummary::totalRequests).sum();
  }
}
