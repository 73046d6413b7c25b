package com.tasks.api.route;

import java.util.Arrays;
import java.util.Optional;

/**
 * The routes served, keyed as {@code "<METHOD> <pathTemplate>"}.
 */
public enum TaskRoute {

  CREATE_TASK("POST", "/tasks"),
  GET_TASK("GET", "/tasks/{id}"),
  UPDATE_TASK("PUT", "/tasks/{id}"),
  DELETE_TASK("DELETE", "/tasks/{id}"),
  LIST_TASKS("GET", "/tasks");

  public static final String ID_PARAM = "id";

  static final String COLLECTION_PATH = "/tasks";
  static final String ITEM_PATH = "/tasks/{id}";

  private final String method;
  private final String pathTemplate;

  TaskRoute(String method, String pathTemplate) {
    this.method = method;
    this.pathTemplate = pathTemplate;
  }

  public String routeKey() {
    return method + " " + pathTemplate;
  }

  public boolean requiresId() {
    return pathTemplate.contains("{" + ID_PARAM + "}");
  }

  public static Optional<TaskRoute> fromRouteKey(String routeKey) {
    if (routeKey == null) return Optional.empty();
    return Arrays.stream(values())
        .filter(r -> r.routeKey().equals(routeKey))
        .findFirst();
  }
}
