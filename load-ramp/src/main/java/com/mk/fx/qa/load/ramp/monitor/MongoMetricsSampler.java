package com.mk.fx.qa.load.ramp.monitor;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.ramp.exception.MetricsSamplerException;
import com.mk.fx.qa.load.ramp.log.LogSink;
import com.mk.fx.qa.load.ramp.metrics.ErrorClassifier;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

/**
 * Samples a MongoDB server's operational metrics on a fixed interval while a ramp runs, writing
 * each sample and a closing summary to the run log.
 *
 * <p>The sampler owns its {@link MongoClient} and closes it on {@link #stop()}. A sample that fails
 * is logged and counted; sampling continues with the next tick.
 */
@Slf4j
public final class MongoMetricsSampler implements MetricsSampler {

  private static final String ADMIN_DATABASE = "admin";
  private static final Duration SCHEDULER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final MongoClient client;
  private final Duration interval;
  private final LogSink sink;
  private final Clock clock;
  private final MongoMetricsAccumulator accumulator = new MongoMetricsAccumulator();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();

  private ScheduledExecutorService scheduler;
  private volatile Instant startedAt;

  public MongoMetricsSampler(MongoClient client, Duration interval, LogSink sink) {
    this(client, interval, sink, Clock.systemUTC());
  }

  @VisibleForTesting
  MongoMetricsSampler(MongoClient client, Duration interval, LogSink sink, Clock clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("Sampling interval must be positive: " + interval);
    }
  }

  /**
   * Creates a sampler with its own client for the given connection string.
   *
   * @throws MetricsSamplerException if the connection string is malformed
   */
  public static MongoMetricsSampler connect(
      String connectionString, Duration interval, LogSink sink) {
    MongoClient client;
    try {
      client = MongoClients.create(connectionString);
    } catch (RuntimeException e) {
      throw new MetricsSamplerException(
          "Invalid MongoDB connection string: " + ErrorClassifier.describe(e), e);
    }
    return new MongoMetricsSampler(client, interval, sink);
  }

  @Override
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Sampler already started");
    }
    try {
      admin().runCommand(new Document("ping", 1));
    } catch (RuntimeException e) {
      stopped.set(true);
      client.close();
      sink.error("Failed to connect to MongoDB: {}", ErrorClassifier.describe(e));
      throw new MetricsSamplerException(
          "Could not connect to MongoDB: " + ErrorClassifier.describe(e), e);
    }
    sink.info("Connected to MongoDB for monitoring");
    startedAt = clock.instant();

    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "mongo-metrics-sampler");
              thread.setDaemon(true);
              return thread;
            });
    scheduler.scheduleAtFixedRate(
        this::collect, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    log.debug("MongoDB sampling scheduled every {}", interval);
  }

  /** Takes one sample. Never throws, so the periodic schedule is never cancelled. */
  @VisibleForTesting
  void collect() {
    try {
      var admin = admin();
      var serverStatus = admin.runCommand(new Document("serverStatus", 1));
      var dbStats = admin.runCommand(new Document("dbStats", 1));
      var currentOp = admin.runCommand(new Document("currentOp", 1).append("active", true));

      var snapshot = MongoMetricsSnapshot.from(clock.instant(), serverStatus, dbStats, currentOp);
      accumulator.record(snapshot);
      sink.info("Current MongoDB Metrics: {}", snapshot.describe());
    } catch (RuntimeException e) {
      accumulator.recordError();
      sink.error("Error collecting MongoDB metrics: {}", ErrorClassifier.describe(e));
    }
  }

  @Override
  public void stop() {
    if (!started.get() || !stopped.compareAndSet(false, true)) {
      return;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        if (!scheduler.awaitTermination(
            SCHEDULER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("MongoDB sampler did not stop within {}", SCHEDULER_SHUTDOWN_TIMEOUT);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while stopping the MongoDB sampler");
      }
    }
    client.close();
    writeSummary();
  }

  @VisibleForTesting
  MongoMetricsAccumulator accumulator() {
    return accumulator;
  }

  private void writeSummary() {
    var duration =
        startedAt == null ? Duration.ZERO : Duration.between(startedAt, clock.instant());
    long reads = accumulator.reads();
    long writes = accumulator.writes();

    sink.info("MongoDB Load Test Summary:");
    sink.info(
        "Duration: {} seconds", String.format(Locale.ROOT, "%.2f", duration.toMillis() / 1000.0));
    sink.info("Samples: {}", accumulator.samples());
    sink.info("Total Operations: {}", reads + writes);
    sink.info("Read Operations: {}", reads);
    sink.info("Write Operations: {}", writes);
    sink.info("Errors: {}", accumulator.errors());
    sink.info(
        "Average Latency: {}ms",
        String.format(Locale.ROOT, "%.2f", accumulator.averageLatencyMs()));
    sink.info("Peak Connections: {}", accumulator.peakConnections());
    sink.info("Active Connections: {}", accumulator.activeConnections());
  }

  private MongoDatabase admin() {
    return client.getDatabase(ADMIN_DATABASE);
  }
}
