package com.mk.fx.qa.load.ramp.monitor;

import com.mk.fx.qa.load.ramp.cfg.RampRunConfig;
import com.mk.fx.qa.load.ramp.cfg.RampRunnerCfg;
import com.mk.fx.qa.load.ramp.log.LogSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** MongoDB sampling when the run names a {@code mongoDBUrl}, none otherwise. */
@Slf4j
@Component
public class MongoMetricsSamplerFactory implements MetricsSamplerFactory {

  private final RampRunnerCfg properties;

  public MongoMetricsSamplerFactory(RampRunnerCfg properties) {
    this.properties = properties;
  }

  @Override
  public MetricsSampler create(RampRunConfig config, LogSink sink) {
    if (!config.hasMongoDBUrl()) {
      return new NoOpMetricsSampler();
    }
    log.info("MongoDB sampling enabled, interval {}", properties.getSamplerInterval());
    return MongoMetricsSampler.connect(
        config.getMongoDBUrl(), properties.getSamplerInterval(), sink);
  }
}
