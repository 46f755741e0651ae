package com.mk.fx.qa.load.ramp.cfg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.load.ramp.exception.RampConfigurationException;
import com.mk.fx.qa.load.ramp.rest.LoadHttpClient;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads a run configuration file and validates it. Every problem, from a missing file to an
 * out-of-range value, is reported as a {@link RampConfigurationException} before anything runs.
 */
@Slf4j
@Component
public class RampConfigLoader {

  private final ObjectMapper objectMapper;
  private final Validator validator;

  public RampConfigLoader(ObjectMapper objectMapper, Validator validator) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  public RampRunConfig load(Path path) {
    if (path == null) {
      throw new RampConfigurationException("No configuration file given");
    }
    if (!Files.isRegularFile(path)) {
      throw new RampConfigurationException("Configuration file not found: " + path);
    }
    String content;
    try {
      content = Files.readString(path);
    } catch (IOException e) {
      throw new RampConfigurationException(
          "Could not read configuration file " + path + ": " + e.getMessage(), e);
    }
    var config = parse(content, path.toString());
    log.info("Loaded run configuration from {}", path.toAbsolutePath());
    return config;
  }

  /**
   * Parses and validates configuration JSON.
   *
   * @param source where the content came from, used in error messages
   */
  public RampRunConfig parse(String content, String source) {
    RampRunConfig config;
    try {
      config = objectMapper.readValue(content, RampRunConfig.class);
    } catch (JsonProcessingException e) {
      throw new RampConfigurationException(
          "Invalid configuration JSON in " + source + ": " + e.getOriginalMessage(), e);
    }
    if (config == null) {
      throw new RampConfigurationException("Configuration in " + source + " is empty");
    }
    validate(config, source);
    return config;
  }

  private void validate(RampRunConfig config, String source) {
    var violations = validator.validate(config);
    if (!violations.isEmpty()) {
      var details =
          violations.stream()
              .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
              .map(RampConfigLoader::describe)
              .collect(Collectors.joining("; "));
      throw new RampConfigurationException("Invalid configuration in " + source + ": " + details);
    }
    // checks the HTTP client would otherwise only make once the run has started
    try {
      config.httpMethod();
      LoadHttpClient.parseTargetUrl(config.getApiUrl());
      LoadHttpClient.validateHeaders(config.getHeaders());
    } catch (IllegalArgumentException e) {
      throw new RampConfigurationException(
          "Invalid configuration in " + source + ": " + e.getMessage(), e);
    }
  }

  private static String describe(ConstraintViolation<RampRunConfig> violation) {
    return violation.getPropertyPath() + " " + violation.getMessage();
  }
}
