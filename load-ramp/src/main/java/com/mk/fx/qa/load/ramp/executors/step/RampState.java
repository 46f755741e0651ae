package com.mk.fx.qa.load.ramp.executors.step;

/**
 * Lifecycle of a {@link StepRampExecutor}.
 *
 * <pre>
 * IDLE -> RAMPING_UP -> RUNNING -> REPORTING -> (RAMPING_UP | DONE)
 * </pre>
 *
 * Any state may move to {@code FAILED} when the run aborts.
 */
public enum RampState {
  IDLE,
  RAMPING_UP,
  RUNNING,
  REPORTING,
  DONE,
  FAILED
}
