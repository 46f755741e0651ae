package com.mk.fx.qa.load.ramp.monitor;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Folds successive {@link MongoMetricsSnapshot}s into run totals. Read and write counts and average
 * latency are differences between the first and the latest sample, so they cover the sampled
 * window only.
 */
final class MongoMetricsAccumulator {

  private final AtomicLong samples = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private final AtomicLong peakConnections = new AtomicLong();
  private final AtomicLong activeConnections = new AtomicLong();

  private volatile MongoMetricsSnapshot first;
  private volatile MongoMetricsSnapshot latest;

  synchronized void record(MongoMetricsSnapshot snapshot) {
    if (first == null) {
      first = snapshot;
    }
    latest = snapshot;
    samples.incrementAndGet();
    activeConnections.set(snapshot.connectionsCurrent());
    peakConnections.accumulateAndGet(snapshot.connectionsCurrent(), Math::max);
  }

  void recordError() {
    errors.incrementAndGet();
  }

  long samples() {
    return samples.get();
  }

  long errors() {
    return errors.get();
  }

  long peakConnections() {
    return peakConnections.get();
  }

  long activeConnections() {
    return activeConnections.get();
  }

  synchronized long reads() {
    return first == null ? 0 : Math.max(0, latest.reads() - first.reads());
  }

  synchronized long writes() {
    return first == null ? 0 : Math.max(0, latest.writes() - first.writes());
  }

  /** Average server-side latency of reads and writes in the window, 0 when none were served. */
  synchronized double averageLatencyMs() {
    if (first == null) {
      return 0.0;
    }
    long ops =
        (latest.readOps() + latest.writeOps()) - (first.readOps() + first.writeOps());
    long micros =
        (latest.readLatencyMicros() + latest.writeLatencyMicros())
            - (first.readLatencyMicros() + first.writeLatencyMicros());
    if (ops <= 0 || micros < 0) {
      return 0.0;
    }
    return micros / (double) ops / 1000.0;
  }
}
