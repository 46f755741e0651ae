package com.mk.fx.qa.load.ramp.log;

import java.util.Objects;
import org.slf4j.Logger;

/** {@link LogSink} backed by an SLF4J logger; level filtering and buffering are the backend's. */
public final class Slf4jLogSink implements LogSink {

  private final Logger logger;

  public Slf4jLogSink(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void write(LogLevel level, String message) {
    switch (level) {
      case DEBUG -> logger.debug(message);
      case INFO -> logger.info(message);
      case WARN -> logger.warn(message);
      case ERROR -> logger.error(message);
    }
  }

  @Override
  public boolean isEnabled(LogLevel level) {
    return switch (level) {
      case DEBUG -> logger.isDebugEnabled();
      case INFO -> logger.isInfoEnabled();
      case WARN -> logger.isWarnEnabled();
      case ERROR -> logger.isErrorEnabled();
    };
  }
}
