package com.mk.fx.qa.load.ramp.rest;

import java.util.Map;
import lombok.Data;

@Data
public class Request {
  private HttpMethod method;
  private Map<String, String> headers;
  private Object body;
}
