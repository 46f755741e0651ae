package com.mk.fx.qa.load.ramp.executors.step;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parameters for a stepped ramp.
 *
 * <p>Steps run at {@code startUsers}, {@code startUsers + incrementBy}, ... for as long as the
 * step size does not exceed {@code maxUsers}. Each step is preceded by {@code rampUp} and runs its
 * workers for {@code durationPerStep}.
 *
 * @param startUsers concurrency of the first step, at least 1
 * @param maxUsers upper bound on the concurrency of any step, at least {@code startUsers}
 * @param incrementBy growth between consecutive steps, at least 1
 * @param durationPerStep how long workers keep issuing requests in each step; zero still lets each
 *     worker issue one request
 * @param rampUp pause before every step, the first included
 */
public record StepRampParameters(
    int startUsers, int maxUsers, int incrementBy, Duration durationPerStep, Duration rampUp) {

  public StepRampParameters {
    Objects.requireNonNull(durationPerStep, "durationPerStep");
    Objects.requireNonNull(rampUp, "rampUp");
    if (startUsers < 1) {
      throw new IllegalArgumentException("startUsers must be >= 1 but was " + startUsers);
    }
    if (maxUsers < startUsers) {
      throw new IllegalArgumentException(
          "maxUsers (" + maxUsers + ") must be >= startUsers (" + startUsers + ")");
    }
    if (incrementBy < 1) {
      throw new IllegalArgumentException("incrementBy must be >= 1 but was " + incrementBy);
    }
    if (durationPerStep.isNegative()) {
      throw new IllegalArgumentException("durationPerStep must not be negative");
    }
    if (rampUp.isNegative()) {
      throw new IllegalArgumentException("rampUp must not be negative");
    }
  }

  /** Concurrency level of every step, in execution order. Never empty. */
  public List<Integer> steps() {
    List<Integer> steps = new ArrayList<>();
    // long arithmetic so a huge increment cannot wrap around below maxUsers
    for (long users = startUsers; users <= maxUsers; users += incrementBy) {
      steps.add((int) users);
    }
    return List.copyOf(steps);
  }
}
