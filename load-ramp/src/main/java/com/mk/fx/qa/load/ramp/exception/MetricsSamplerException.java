package com.mk.fx.qa.load.ramp.exception;

/** The external metrics sampler could not be started. */
public class MetricsSamplerException extends RuntimeException {

  public MetricsSamplerException(String message, Throwable cause) {
    super(message, cause);
  }
}
