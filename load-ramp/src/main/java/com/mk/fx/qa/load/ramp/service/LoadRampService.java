package com.mk.fx.qa.load.ramp.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.ramp.cfg.RampRunConfig;
import com.mk.fx.qa.load.ramp.cfg.RampRunnerCfg;
import com.mk.fx.qa.load.ramp.exception.RampConfigurationException;
import com.mk.fx.qa.load.ramp.executors.step.StepRampExecutor;
import com.mk.fx.qa.load.ramp.executors.step.StepRampResult;
import com.mk.fx.qa.load.ramp.log.RunLogFile;
import com.mk.fx.qa.load.ramp.metrics.StepStatsAggregator;
import com.mk.fx.qa.load.ramp.monitor.MetricsSamplerFactory;
import com.mk.fx.qa.load.ramp.processors.RequestExecutor;
import com.mk.fx.qa.load.ramp.processors.rest.RestRequestExecutor;
import com.mk.fx.qa.load.ramp.rest.LoadHttpClient;
import com.mk.fx.qa.load.ramp.rest.Request;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one configured ramp end to end: opens the run log, starts external sampling, drives every
 * step against the target and tears everything down again.
 *
 * <p>The sampler is stopped and the run log closed on every exit path, including a failed or
 * interrupted ramp.
 */
@Slf4j
@Service
public class LoadRampService {

  static final Map<String, String> DEFAULT_HEADERS = Map.of("Content-Type", "application/json");

  private final RampRunnerCfg properties;
  private final MetricsSamplerFactory samplerFactory;

  public LoadRampService(RampRunnerCfg properties, MetricsSamplerFactory samplerFactory) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.samplerFactory = Objects.requireNonNull(samplerFactory, "samplerFactory");
  }

  /**
   * Executes the ramp described by {@code config} against its HTTP target.
   *
   * @return per-step summaries
   * @throws InterruptedException if the run is interrupted
   * @throws RampConfigurationException if the run log cannot be created
   * @throws com.mk.fx.qa.load.ramp.exception.MetricsSamplerException if sampling cannot start
   * @throws com.mk.fx.qa.load.ramp.exception.RampExecutionException if the ramp machinery fails
   */
  public StepRampResult run(RampRunConfig config) throws InterruptedException {
    Objects.requireNonNull(config, "config");
    try (var client = buildClient(config)) {
      var requestExecutor = new RestRequestExecutor(client, buildRequest(config));
      log.info("Ramp target: {}", requestExecutor.describeTarget());
      return run(config, requestExecutor);
    }
  }

  @VisibleForTesting
  StepRampResult run(RampRunConfig config, RequestExecutor requestExecutor)
      throws InterruptedException {
    var runId = UUID.randomUUID().toString().substring(0, 8);
    try (var runLog = openRunLog(config)) {
      var sink = runLog.sink();
      sink.info("Load test started. Logging to: {}", runLog.path());

      var sampler = samplerFactory.create(config, sink);
      sampler.start();
      try {
        var executor =
            new StepRampExecutor(
                sink,
                requestExecutor,
                new StepStatsAggregator(),
                properties.getPoolShutdownTimeout());
        var result = executor.execute(runId, config.toStepParameters());
        log.info(
            "Ramp {} finished: {} steps, {} requests in {}ms",
            runId,
            result.steps().size(),
            result.totalRequests(),
            result.elapsedMs());
        return result;
      } finally {
        sampler.stop();
      }
    }
  }

  private RunLogFile openRunLog(RampRunConfig config) {
    var logDir = Path.of(config.getLogDir());
    try {
      return RunLogFile.open(
          logDir, config.getPrefix(), config.isIncludeConsole(), properties.getRunLogLevel());
    } catch (IOException e) {
      throw new RampConfigurationException(
          "Could not create run log in " + logDir.toAbsolutePath() + ": " + e.getMessage(), e);
    }
  }

  private LoadHttpClient buildClient(RampRunConfig config) {
    int connectionTimeoutMs =
        config.getConnectionTimeoutMs() != null
            ? config.getConnectionTimeoutMs()
            : properties.getDefaultConnectionTimeoutMs();
    int requestTimeoutMs =
        config.getRequestTimeoutMs() != null
            ? config.getRequestTimeoutMs()
            : properties.getDefaultRequestTimeoutMs();

    // header names are case-insensitive, so "content-type" in the config replaces the default
    Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    headers.putAll(DEFAULT_HEADERS);
    if (config.getHeaders() != null) {
      headers.putAll(config.getHeaders());
    }
    return new LoadHttpClient(config.getApiUrl(), connectionTimeoutMs, requestTimeoutMs, headers);
  }

  private static Request buildRequest(RampRunConfig config) {
    var request = new Request();
    request.setMethod(config.httpMethod());
    request.setBody(config.getPayload());
    return request;
  }
}
