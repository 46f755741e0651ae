package com.mk.fx.qa.load.ramp.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * The run configuration is missing, unreadable or invalid. Raised before any step starts; the
 * process exits with a non-zero status.
 */
public class RampConfigurationException extends RuntimeException implements ExitCodeGenerator {

  public static final int EXIT_CODE = 1;

  public RampConfigurationException(String message) {
    super(message);
  }

  public RampConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public int getExitCode() {
    return EXIT_CODE;
  }
}
