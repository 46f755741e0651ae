package com.mk.fx.qa.load.ramp.monitor;

/**
 * Periodic sampler of an external system, running alongside the ramp on its own schedule. Samples
 * are not aligned with step boundaries.
 *
 * <p>{@link #start()} is called before the first step. {@link #stop()} is called exactly once after
 * the ramp, whether it completed or failed, and writes the sampler's own summary.
 */
public interface MetricsSampler {

  /**
   * Connects and schedules sampling.
   *
   * @throws com.mk.fx.qa.load.ramp.exception.MetricsSamplerException if the external system is
   *     unreachable
   */
  void start();

  /** Cancels sampling, releases resources and writes a summary. */
  void stop();
}
