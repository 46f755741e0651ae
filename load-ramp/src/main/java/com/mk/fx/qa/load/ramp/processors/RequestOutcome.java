package com.mk.fx.qa.load.ramp.processors;

/**
 * Result of one HTTP attempt.
 *
 * @param statusCode HTTP status, or {@code 0} when no response was received
 * @param latencyMs wall-clock time from dispatch to full response (or to the failure signal)
 * @param success whether the status is in {@code [200, 400)}
 * @param error description of the failure, {@code null} on success
 * @param category failure classification such as {@code HTTP_5xx} or {@code CONNECTION_REFUSED},
 *     {@code null} on success
 */
public record RequestOutcome(
    int statusCode, long latencyMs, boolean success, String error, String category) {

  public static final int NO_STATUS = 0;

  /** Builds the outcome of a request that received a response. */
  public static RequestOutcome fromStatus(int statusCode, long latencyMs) {
    if (isSuccessStatus(statusCode)) {
      return new RequestOutcome(statusCode, latencyMs, true, null, null);
    }
    return new RequestOutcome(
        statusCode, latencyMs, false, "HTTP status " + statusCode, httpCategory(statusCode));
  }

  /** Builds the outcome of a request that never received a response. */
  public static RequestOutcome transportFailure(long latencyMs, String error, String category) {
    return new RequestOutcome(NO_STATUS, latencyMs, false, error, category);
  }

  public static boolean isSuccessStatus(int statusCode) {
    return statusCode >= 200 && statusCode < 400;
  }

  private static String httpCategory(int statusCode) {
    if (statusCode >= 500) return "HTTP_5xx";
    if (statusCode >= 400) return "HTTP_4xx";
    if (statusCode >= 100 && statusCode < 200) return "HTTP_1xx";
    return "HTTP_" + statusCode;
  }
}
