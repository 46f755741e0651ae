package com.mk.fx.qa.load.ramp.processors.rest;

import com.mk.fx.qa.load.ramp.metrics.ErrorClassifier;
import com.mk.fx.qa.load.ramp.processors.RequestExecutor;
import com.mk.fx.qa.load.ramp.processors.RequestOutcome;
import com.mk.fx.qa.load.ramp.rest.LoadHttpClient;
import com.mk.fx.qa.load.ramp.rest.LoadHttpException;
import com.mk.fx.qa.load.ramp.rest.Request;
import java.net.http.HttpRequest;
import java.util.Objects;

/**
 * {@link RequestExecutor} over {@link LoadHttpClient}. The HTTP request is prepared once at
 * construction and re-sent on every call, so the body is serialised a single time per run.
 */
public final class RestRequestExecutor implements RequestExecutor {

  private final LoadHttpClient client;
  private final HttpRequest prepared;

  public RestRequestExecutor(LoadHttpClient client, Request request) {
    this.client = Objects.requireNonNull(client, "client");
    this.prepared = client.prepare(Objects.requireNonNull(request, "request"));
  }

  @Override
  public RequestOutcome execute() {
    try {
      var response = client.execute(prepared);
      return RequestOutcome.fromStatus(response.getStatusCode(), response.getResponseTimeMs());
    } catch (LoadHttpException ex) {
      return RequestOutcome.transportFailure(
          ex.getElapsedMs(), ErrorClassifier.describe(ex), ErrorClassifier.classify(ex));
    }
  }

  /** The request as it goes on the wire, e.g. {@code POST http://host/path}. */
  public String describeTarget() {
    return prepared.method() + " " + prepared.uri();
  }
}
