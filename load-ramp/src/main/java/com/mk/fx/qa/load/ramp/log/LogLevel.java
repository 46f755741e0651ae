package com.mk.fx.qa.load.ramp.log;

/** Severity of a line written to a {@link LogSink}. */
public enum LogLevel {
  DEBUG,
  INFO,
  WARN,
  ERROR
}
