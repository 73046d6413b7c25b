package com.tasks.api.infra;

import java.util.Map;

/**
 * Uniform response of every operation. {@code body} is already serialized JSON, or empty for 204.
 */
public record Envelope(int statusCode, Map<String, String> headers, String body) {

  public Envelope {
    headers = Map.copyOf(headers);
  }
}
