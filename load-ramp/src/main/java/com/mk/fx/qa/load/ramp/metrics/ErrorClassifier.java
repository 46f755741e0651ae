package com.mk.fx.qa.load.ramp.metrics;

/** Maps transport failures to the short categories used in step error breakdowns. */
public final class ErrorClassifier {

  private ErrorClassifier() {
    throw new UnsupportedOperationException("ErrorClassifier cannot be instantiated");
  }

  public static String classify(Throwable t) {
    if (t == null) return "UNKNOWN";
    var rootCause = rootCause(t);
    var clsName = rootCause.getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException", "UnresolvedAddressException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "HttpTimeoutException", "HttpConnectTimeoutException" -> "HTTP_TIMEOUT";
      case "InterruptedException" -> "INTERRUPTED";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }

  /** First non-blank message walking from {@code t} to its root cause, or the root type name. */
  public static String describe(Throwable t) {
    if (t == null) return "unknown error";
    for (Throwable current = t; current != null; current = current.getCause()) {
      var msg = current.getMessage();
      if (msg != null && !msg.isBlank() && !msg.equals("null")) {
        return msg;
      }
    }
    return rootCause(t).getClass().getSimpleName() + " occurred";
  }

  private static Throwable rootCause(Throwable t) {
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    return rootCause;
  }
}
