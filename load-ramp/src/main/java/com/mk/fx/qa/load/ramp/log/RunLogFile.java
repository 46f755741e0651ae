package com.mk.fx.qa.load.ramp.log;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

/**
 * A per-run log file. Opening one attaches a Logback {@link FileAppender} to a dedicated logger
 * whose lines look like {@code [2024-05-01T10:15:30.123Z] [INFO] message}. When console mirroring
 * is on, the same lines also flow to the root logger's appenders.
 *
 * <p>File name: {@code <logDir>/<prefix>_<yyyy-MM-dd_HH-mm-ss-SSS>.txt}, UTC.
 */
@Slf4j
public final class RunLogFile implements AutoCloseable {

  static final String RUN_LOGGER_PREFIX = "load.ramp.run";
  static final String LINE_PATTERN = "[%d{yyyy-MM-dd'T'HH:mm:ss.SSS'Z', UTC}] [%level] %msg%n";

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss-SSS");
  private static final AtomicInteger SEQUENCE = new AtomicInteger();

  private final Path path;
  private final Logger logger;
  private final FileAppender<ILoggingEvent> appender;
  private final LogSink sink;

  private RunLogFile(Path path, Logger logger, FileAppender<ILoggingEvent> appender) {
    this.path = path;
    this.logger = logger;
    this.appender = appender;
    this.sink = new Slf4jLogSink(logger);
  }

  /**
   * Creates the log directory if needed and starts writing to a fresh timestamped file.
   *
   * @param logDir directory for run logs
   * @param prefix file name prefix
   * @param includeConsole whether lines are mirrored to the console appenders
   * @param level lowest level written
   * @return the open run log
   * @throws IOException if the directory cannot be created
   * @throws IllegalStateException if SLF4J is not bound to Logback
   */
  public static RunLogFile open(Path logDir, String prefix, boolean includeConsole, LogLevel level)
      throws IOException {
    Objects.requireNonNull(logDir, "logDir");
    Objects.requireNonNull(prefix, "prefix");
    Objects.requireNonNull(level, "level");
    Files.createDirectories(logDir);

    var loggerFactory = LoggerFactory.getILoggerFactory();
    if (!(loggerFactory instanceof LoggerContext)) {
      throw new IllegalStateException("Run log files require Logback as the SLF4J backend");
    }
    var context = (LoggerContext) loggerFactory;

    var timestamp = FILE_TIMESTAMP.format(LocalDateTime.now(ZoneOffset.UTC));
    var file = logDir.resolve(prefix + "_" + timestamp + ".txt").toAbsolutePath();
    var name = RUN_LOGGER_PREFIX + "." + SEQUENCE.incrementAndGet();

    var encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(LINE_PATTERN);
    encoder.start();

    var appender = new FileAppender<ILoggingEvent>();
    appender.setContext(context);
    appender.setName(name);
    appender.setFile(file.toString());
    appender.setAppend(true);
    appender.setEncoder(encoder);
    appender.start();

    var logger = context.getLogger(name);
    logger.setLevel(toLogbackLevel(level));
    logger.setAdditive(includeConsole);
    logger.addAppender(appender);

    log.debug("Run log {} opened (console mirror={})", file, includeConsole);
    return new RunLogFile(file, logger, appender);
  }

  public Path path() {
    return path;
  }

  public LogSink sink() {
    return sink;
  }

  @Override
  public void close() {
    logger.detachAppender(appender);
    appender.stop();
    log.debug("Run log {} closed", path);
  }

  private static Level toLogbackLevel(LogLevel level) {
    return switch (level) {
      case DEBUG -> Level.DEBUG;
      case INFO -> Level.INFO;
      case WARN -> Level.WARN;
      case ERROR -> Level.ERROR;
    };
  }
}
