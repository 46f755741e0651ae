package com.mk.fx.qa.load.ramp.cfg;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.load.ramp.executors.step.StepRampParameters;
import com.mk.fx.qa.load.ramp.rest.HttpMethod;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.Map;
import lombok.Getter;

/**
 * Settings of one ramp run, read from the JSON configuration file. Fields left out of the file keep
 * the defaults below. Durations are in seconds and may be fractional.
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class RampRunConfig {

  @JsonProperty("logDir")
  @NotBlank
  private String logDir = "logs";

  @JsonProperty("prefix")
  @NotBlank
  private String prefix = "load_test";

  @JsonProperty("includeConsole")
  private boolean includeConsole = true;

  /** Connection string of the MongoDB instance to sample; no sampling when absent. */
  @JsonProperty("mongoDBUrl")
  private String mongoDBUrl;

  @JsonProperty("apiUrl")
  @NotBlank
  @Pattern(regexp = "^https?://.+", message = "must be an http or https URL")
  private String apiUrl;

  @JsonProperty("method")
  @NotBlank
  private String method = "GET";

  /** Request body, serialized as JSON; none when absent. */
  @JsonProperty("payload")
  private Object payload;

  @JsonProperty("headers")
  private Map<String, String> headers;

  @JsonProperty("startUsers")
  @Min(1)
  private int startUsers = 1;

  @JsonProperty("maxUsers")
  @Min(1)
  private int maxUsers = 100;

  @JsonProperty("incrementBy")
  @Min(1)
  private int incrementBy = 10;

  @JsonProperty("durationPerStep")
  @Positive
  private double durationPerStep = 60;

  @JsonProperty("rampUpTime")
  @PositiveOrZero
  private double rampUpTime = 10;

  @JsonProperty("connectionTimeoutMs")
  @Positive
  private Integer connectionTimeoutMs;

  @JsonProperty("requestTimeoutMs")
  @Positive
  private Integer requestTimeoutMs;

  @JsonIgnore
  @AssertTrue(message = "maxUsers must be greater than or equal to startUsers")
  public boolean isMaxUsersValid() {
    return maxUsers >= startUsers;
  }

  public boolean hasMongoDBUrl() {
    return mongoDBUrl != null && !mongoDBUrl.isBlank();
  }

  /**
   * @throws IllegalArgumentException if {@code method} is not a supported HTTP method
   */
  public HttpMethod httpMethod() {
    return HttpMethod.fromValue(method);
  }

  public StepRampParameters toStepParameters() {
    return new StepRampParameters(
        startUsers, maxUsers, incrementBy, seconds(durationPerStep), seconds(rampUpTime));
  }

  private static Duration seconds(double value) {
    return Duration.ofMillis(Math.round(value * 1000));
  }
}
