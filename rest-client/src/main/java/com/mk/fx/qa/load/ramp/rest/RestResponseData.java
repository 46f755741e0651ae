package com.mk.fx.qa.load.ramp.rest;

import lombok.Data;

/** Outcome of one exchange; the response body is consumed but not kept. */
@Data
public class RestResponseData {
  private int statusCode;
  private long responseTimeMs;
}
