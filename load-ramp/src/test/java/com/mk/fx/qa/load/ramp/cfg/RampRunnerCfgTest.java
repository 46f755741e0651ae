package com.mk.fx.qa.load.ramp.cfg;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.ramp.log.LogLevel;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class RampRunnerCfgTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  ConfigurationPropertiesAutoConfiguration.class,
                  ValidationAutoConfiguration.class))
          .withUserConfiguration(RampRunnerCfg.class);

  @Test
  void defaults_applyWithoutProperties() {
    contextRunner.run(
        context -> {
          var cfg = context.getBean(RampRunnerCfg.class);
          assertEquals(Duration.ofSeconds(5), cfg.getSamplerInterval());
          assertEquals(5_000, cfg.getDefaultConnectionTimeoutMs());
          assertEquals(30_000, cfg.getDefaultRequestTimeoutMs());
          assertEquals(Duration.ofSeconds(30), cfg.getPoolShutdownTimeout());
          assertEquals(LogLevel.INFO, cfg.getRunLogLevel());
        });
  }

  @Test
  void properties_areBound() {
    contextRunner
        .withPropertyValues(
            "load.ramp.sampler-interval=250ms",
            "load.ramp.default-request-timeout-ms=1000",
            "load.ramp.run-log-level=debug")
        .run(
            context -> {
              var cfg = context.getBean(RampRunnerCfg.class);
              assertEquals(Duration.ofMillis(250), cfg.getSamplerInterval());
              assertEquals(1_000, cfg.getDefaultRequestTimeoutMs());
              assertEquals(LogLevel.DEBUG, cfg.getRunLogLevel());
            });
  }

  @Test
  void invalidTimeout_failsStartup() {
    contextRunner
        .withPropertyValues("load.ramp.default-connection-timeout-ms=0")
        .run(context -> assertNotNull(context.getStartupFailure()));
  }
}
