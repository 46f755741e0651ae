package com.mk.fx.qa.load.ramp.cfg;

import com.mk.fx.qa.load.ramp.log.LogLevel;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Runner-wide settings that do not belong to a single run configuration file. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "load.ramp")
public class RampRunnerCfg {

  /** Interval between two external metrics samples. */
  @NotNull private Duration samplerInterval = Duration.ofSeconds(5);

  /** Used when the run configuration does not set {@code connectionTimeoutMs}. */
  @Positive private int defaultConnectionTimeoutMs = 5_000;

  /** Used when the run configuration does not set {@code requestTimeoutMs}. */
  @Positive private int defaultRequestTimeoutMs = 30_000;

  /** How long a finished step waits for its virtual-user threads to exit. */
  @NotNull private Duration poolShutdownTimeout = Duration.ofSeconds(30);

  @NotNull private LogLevel runLogLevel = LogLevel.INFO;
}
