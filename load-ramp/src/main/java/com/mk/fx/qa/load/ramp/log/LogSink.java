package com.mk.fx.qa.load.ramp.log;

import org.slf4j.helpers.MessageFormatter;

/**
 * Destination for the human-readable output of a run: step announcements, step results,
 * per-request failure diagnostics and datastore samples. Components receive the sink they write to
 * rather than reaching for process-wide output streams.
 *
 * <p>Implementations must be safe for concurrent use and must not block callers indefinitely.
 * Ordering between lines written from different threads is not guaranteed.
 */
@FunctionalInterface
public interface LogSink {

  /**
   * Writes a single line.
   *
   * @param level severity of the line
   * @param message fully formatted message
   */
  void write(LogLevel level, String message);

  /** Whether lines at {@code level} would be kept; lets hot paths skip formatting. */
  default boolean isEnabled(LogLevel level) {
    return true;
  }

  default void debug(String format, Object... args) {
    if (isEnabled(LogLevel.DEBUG)) {
      write(LogLevel.DEBUG, format(format, args));
    }
  }

  default void info(String format, Object... args) {
    write(LogLevel.INFO, format(format, args));
  }

  default void warn(String format, Object... args) {
    write(LogLevel.WARN, format(format, args));
  }

  default void error(String format, Object... args) {
    write(LogLevel.ERROR, format(format, args));
  }

  /** Formats with SLF4J {@code {}} placeholders. */
  private static String format(String format, Object... args) {
    if (args == null || args.length == 0) {
      return format;
    }
    return MessageFormatter.arrayFormat(format, args).getMessage();
  }
}
