package com.mk.fx.qa.load.ramp.monitor;

import com.mk.fx.qa.load.ramp.cfg.RampRunConfig;
import com.mk.fx.qa.load.ramp.log.LogSink;

/** Chooses and builds the external metrics sampler for a run. */
@FunctionalInterface
public interface MetricsSamplerFactory {

  MetricsSampler create(RampRunConfig config, LogSink sink);
}
