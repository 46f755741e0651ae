package com.mk.fx.qa.load.ramp.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.Test;

class ErrorClassifierTest {

  @Test
  void classify_usesRootCause() {
    var wrapped = new RuntimeException("outer", new IOException("mid", new ConnectException()));
    assertEquals("CONNECTION_REFUSED", ErrorClassifier.classify(wrapped));
  }

  @Test
  void classify_knownTransportFailures() {
    assertEquals("UNKNOWN_HOST", ErrorClassifier.classify(new UnknownHostException("nope")));
    assertEquals("HTTP_TIMEOUT", ErrorClassifier.classify(new HttpTimeoutException("slow")));
    assertEquals(
        "HTTP_TIMEOUT", ErrorClassifier.classify(new HttpConnectTimeoutException("slow connect")));
    assertEquals("SSL_ERROR", ErrorClassifier.classify(new SSLHandshakeException("bad cert")));
    assertEquals("INTERRUPTED", ErrorClassifier.classify(new InterruptedException()));
  }

  @Test
  void classify_unknownFailure_usesSimpleClassName() {
    assertEquals("IllegalStateException", ErrorClassifier.classify(new IllegalStateException()));
  }

  @Test
  void describe_returnsFirstMessageInCauseChain() {
    var failure = new RuntimeException(null, new IOException("socket closed"));
    assertEquals("socket closed", ErrorClassifier.describe(failure));
  }
}
