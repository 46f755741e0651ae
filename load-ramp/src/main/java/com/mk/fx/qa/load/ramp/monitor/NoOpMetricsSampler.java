package com.mk.fx.qa.load.ramp.monitor;

import lombok.extern.slf4j.Slf4j;

/** Used when no datastore is configured for sampling. */
@Slf4j
public final class NoOpMetricsSampler implements MetricsSampler {

  @Override
  public void start() {
    log.info("External metrics sampling disabled (no mongoDBUrl configured)");
  }

  @Override
  public void stop() {
    log.debug("External metrics sampling was disabled, nothing to stop");
  }
}
