package com.mk.fx.qa.load.ramp.exception;

/**
 * The ramp could not continue because its own machinery failed: workers could not be started, or
 * a worker died with an exception. Individual request failures never raise this.
 */
public class RampExecutionException extends RuntimeException {

  public RampExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
