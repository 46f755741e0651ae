package com.mk.fx.qa.load.ramp.cfg;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.ramp.exception.RampConfigurationException;
import com.mk.fx.qa.load.ramp.rest.HttpMethod;
import jakarta.validation.Validation;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RampConfigLoaderTest {

  private final RampConfigLoader loader =
      new RampConfigLoader(
          new ObjectMapperConfig().objectMapper(),
          Validation.buildDefaultValidatorFactory().getValidator());

  @TempDir Path tempDir;

  private RampConfigurationException rejected(String json) {
    return assertThrows(RampConfigurationException.class, () -> loader.parse(json, "test.json"));
  }

  @Test
  void load_readsLenientJsonFile() throws Exception {
    var path = Path.of(getClass().getResource("/configs/valid-ramp.json").toURI());

    RampRunConfig config = loader.load(path);

    assertEquals("http://localhost:8080/api/orders", config.getApiUrl());
    assertEquals(HttpMethod.POST, config.httpMethod());
    assertEquals(Map.of("sku", "ABC-1", "quantity", 2), config.getPayload());
    assertEquals(Map.of("X-Trace", "ramp"), config.getHeaders());
    assertEquals("orders", config.getPrefix());
    assertFalse(config.isIncludeConsole());
    assertFalse(config.hasMongoDBUrl());

    var params = config.toStepParameters();
    assertEquals(19, params.steps().size());
    assertEquals(Duration.ofMillis(1500), params.durationPerStep());
    assertEquals(Duration.ZERO, params.rampUp());
  }

  @Test
  void parse_appliesDefaults() {
    RampRunConfig config = loader.parse("{\"apiUrl\": \"https://example.com/health\"}", "inline");

    assertEquals("GET", config.getMethod());
    assertEquals(1, config.getStartUsers());
    assertEquals(100, config.getMaxUsers());
    assertEquals(10, config.getIncrementBy());
    assertEquals(60.0, config.getDurationPerStep());
    assertEquals(10.0, config.getRampUpTime());
    assertEquals("logs", config.getLogDir());
    assertEquals("load_test", config.getPrefix());
    assertTrue(config.isIncludeConsole());
    assertNull(config.getMongoDBUrl());
    assertNull(config.getPayload());
    assertNull(config.getConnectionTimeoutMs());
    assertEquals(Duration.ofSeconds(10), config.toStepParameters().rampUp());
  }

  @Test
  void parse_acceptsMongoUrl() {
    var config =
        loader.parse(
            "{apiUrl: 'http://t', mongoDBUrl: 'mongodb://localhost:27017'}", "inline");

    assertTrue(config.hasMongoDBUrl());
    assertEquals("mongodb://localhost:27017", config.getMongoDBUrl());
  }

  @Test
  void missingApiUrl_isRejected() {
    assertTrue(rejected("{}").getMessage().contains("apiUrl"));
  }

  @Test
  void nonHttpApiUrl_isRejected() {
    assertTrue(rejected("{\"apiUrl\": \"ftp://host/file\"}").getMessage().contains("apiUrl"));
  }

  @Test
  void outOfRangeNumbers_areRejected() {
    assertTrue(
        rejected("{\"apiUrl\": \"http://t\", \"startUsers\": 0}")
            .getMessage()
            .contains("startUsers"));
    assertTrue(
        rejected("{\"apiUrl\": \"http://t\", \"incrementBy\": 0}")
            .getMessage()
            .contains("incrementBy"));
    assertTrue(
        rejected("{\"apiUrl\": \"http://t\", \"durationPerStep\": 0}")
            .getMessage()
            .contains("durationPerStep"));
    assertTrue(
        rejected("{\"apiUrl\": \"http://t\", \"rampUpTime\": -1}")
            .getMessage()
            .contains("rampUpTime"));
    assertTrue(
        rejected("{\"apiUrl\": \"http://t\", \"requestTimeoutMs\": 0}")
            .getMessage()
            .contains("requestTimeoutMs"));
  }

  @Test
  void maxUsersBelowStartUsers_isRejected() {
    var ex = rejected("{\"apiUrl\": \"http://t\", \"startUsers\": 50, \"maxUsers\": 10}");
    assertTrue(ex.getMessage().contains("maxUsers must be greater than or equal to startUsers"));
  }

  @Test
  void unsupportedMethod_isRejected() {
    var ex = rejected("{\"apiUrl\": \"http://t\", \"method\": \"FETCH\"}");
    assertTrue(ex.getMessage().contains("Unsupported HTTP method: FETCH"));
  }

  @Test
  void malformedApiUrl_isRejectedBeforeTheRun() {
    var ex = rejected("{\"apiUrl\": \"http://exa mple.com/x\"}");

    assertTrue(ex.getMessage().startsWith("Invalid configuration in test.json"));
    assertTrue(ex.getMessage().contains("malformed"));
  }

  @Test
  void headersTheHttpClientCannotSend_areRejected() {
    var host = rejected("{apiUrl: 'http://t', headers: {'Host': 'other.example.com'}}");
    assertTrue(host.getMessage().contains("Host"));

    var connection = rejected("{apiUrl: 'http://t', headers: {'Connection': 'close'}}");
    assertTrue(connection.getMessage().contains("Connection"));

    var config =
        loader.parse("{apiUrl: 'http://t', headers: {'content-type': 'text/plain'}}", "inline");
    assertEquals(Map.of("content-type", "text/plain"), config.getHeaders());
  }

  @Test
  void nullForNumber_isRejected() {
    rejected("{\"apiUrl\": \"http://t\", \"maxUsers\": null}");
  }

  @Test
  void malformedOrEmptyJson_isRejected() {
    assertTrue(rejected("{\"apiUrl\": ").getMessage().startsWith("Invalid configuration JSON"));
    assertTrue(rejected("").getMessage().startsWith("Invalid configuration JSON"));
    assertTrue(rejected("null").getMessage().contains("is empty"));
  }

  @Test
  void missingFile_isRejected() {
    var missing = tempDir.resolve("absent.json");

    var ex = assertThrows(RampConfigurationException.class, () -> loader.load(missing));

    assertTrue(ex.getMessage().startsWith("Configuration file not found"));
    assertEquals(RampConfigurationException.EXIT_CODE, ex.getExitCode());
    assertThrows(RampConfigurationException.class, () -> loader.load(null));
  }

  @Test
  void directoryInsteadOfFile_isRejected() throws Exception {
    var dir = Files.createDirectory(tempDir.resolve("config.json"));

    assertThrows(RampConfigurationException.class, () -> loader.load(dir));
  }
}
