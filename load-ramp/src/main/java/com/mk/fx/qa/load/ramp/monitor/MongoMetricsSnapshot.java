package com.mk.fx.qa.load.ramp.monitor;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * One sample of MongoDB server state, built from the {@code serverStatus}, {@code dbStats} and
 * {@code currentOp} admin commands. Missing or non-numeric fields read as 0.
 *
 * <p>Opcounter and latency fields are cumulative since server start; consumers diff them.
 */
public record MongoMetricsSnapshot(
    Instant timestamp,
    long connectionsCurrent,
    long connectionsAvailable,
    long opInsert,
    long opQuery,
    long opUpdate,
    long opDelete,
    long opGetmore,
    long opCommand,
    long memResidentMb,
    long memVirtualMb,
    long dataSize,
    long storageSize,
    long indexes,
    long activeOperations,
    long networkBytesIn,
    long networkBytesOut,
    long networkRequests,
    long readLatencyMicros,
    long readOps,
    long writeLatencyMicros,
    long writeOps) {

  public static MongoMetricsSnapshot from(
      Instant timestamp, Document serverStatus, Document dbStats, Document currentOp) {
    Objects.requireNonNull(timestamp, "timestamp");
    var connections = sub(serverStatus, "connections");
    var opcounters = sub(serverStatus, "opcounters");
    var mem = sub(serverStatus, "mem");
    var network = sub(serverStatus, "network");
    var opLatencies = sub(serverStatus, "opLatencies");
    var readLatency = sub(opLatencies, "reads");
    var writeLatency = sub(opLatencies, "writes");

    return new MongoMetricsSnapshot(
        timestamp,
        number(connections, "current"),
        number(connections, "available"),
        number(opcounters, "insert"),
        number(opcounters, "query"),
        number(opcounters, "update"),
        number(opcounters, "delete"),
        number(opcounters, "getmore"),
        number(opcounters, "command"),
        number(mem, "resident"),
        number(mem, "virtual"),
        number(dbStats, "dataSize"),
        number(dbStats, "storageSize"),
        number(dbStats, "indexes"),
        inProgressCount(currentOp),
        number(network, "bytesIn"),
        number(network, "bytesOut"),
        number(network, "numRequests"),
        number(readLatency, "latency"),
        number(readLatency, "ops"),
        number(writeLatency, "latency"),
        number(writeLatency, "ops"));
  }

  /** Reads served: queries plus cursor continuations. */
  public long reads() {
    return opQuery + opGetmore;
  }

  public long writes() {
    return opInsert + opUpdate + opDelete;
  }

  public String describe() {
    return "timestamp="
        + timestamp
        + ", connections(current/available)="
        + connectionsCurrent
        + "/"
        + connectionsAvailable
        + ", opcounters(insert/query/update/delete/getmore/command)="
        + opInsert
        + "/"
        + opQuery
        + "/"
        + opUpdate
        + "/"
        + opDelete
        + "/"
        + opGetmore
        + "/"
        + opCommand
        + ", memory(resident/virtual MB)="
        + memResidentMb
        + "/"
        + memVirtualMb
        + ", storage(dataSize/storageSize/indexes)="
        + dataSize
        + "/"
        + storageSize
        + "/"
        + indexes
        + ", activeOperations="
        + activeOperations
        + ", network(bytesIn/bytesOut/requests)="
        + networkBytesIn
        + "/"
        + networkBytesOut
        + "/"
        + networkRequests;
  }

  private static Document sub(Document doc, String key) {
    var value = doc == null ? null : doc.get(key);
    return value instanceof Document ? (Document) value : new Document();
  }

  private static long number(Document doc, String key) {
    var value = doc == null ? null : doc.get(key);
    return value instanceof Number ? ((Number) value).longValue() : 0L;
  }

  private static long inProgressCount(Document currentOp) {
    var value = currentOp == null ? null : currentOp.get("inprog");
    return value instanceof List ? ((List<?>) value).size() : 0L;
  }
}
