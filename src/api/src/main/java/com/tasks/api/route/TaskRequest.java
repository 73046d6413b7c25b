package com.tasks.api.route;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * An incoming request as an API gateway hands it over: a route key such as {@code "GET /tasks/{id}"},
 * the parameters already extracted from the path and query string, and the raw body.
 */
public record TaskRequest(
    String routeKey,
    Map<String, String> pathParameters,
    Map<String, String> queryParameters,
    String body
) {

  public TaskRequest {
    pathParameters = pathParameters == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(pathParameters));
    queryParameters = queryParameters == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(queryParameters));
  }

  /**
   * Resolves a concrete request path against the task path templates.
   * Paths that fit no template keep their literal form, so no route matches them.
   */
  public static TaskRequest fromHttp(String method, String path, Map<String, String> queryParameters, String body) {
    String p = path == null ? "" : path;
    if (p.equals(TaskRoute.COLLECTION_PATH)) {
      return new TaskRequest(method + " " + TaskRoute.COLLECTION_PATH, Map.of(), queryParameters, body);
    }

    String prefix = TaskRoute.COLLECTION_PATH + "/";
    if (p.startsWith(prefix) && p.indexOf('/', prefix.length()) < 0) {
      String segment = UriUtils.decode(p.substring(prefix.length()), StandardCharsets.UTF_8);
      Map<String, String> params = segment.isEmpty() ? Map.of() : Map.of(TaskRoute.ID_PARAM, segment);
      return new TaskRequest(method + " " + TaskRoute.ITEM_PATH, params, queryParameters, body);
    }

    return new TaskRequest(method + " " + p, Map.of(), queryParameters, body);
  }
}
