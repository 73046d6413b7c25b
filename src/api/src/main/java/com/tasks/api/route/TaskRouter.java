package com.tasks.api.route;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tasks.api.infra.Envelope;
import com.tasks.api.infra.ErrorResponse;
import com.tasks.api.infra.ResponseBuilder;
import com.tasks.api.task.TaskService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Dispatches a {@link TaskRequest} to the matching task operation.
 * Every outcome, including unexpected failures, comes back as an {@link Envelope}.
 */
@Component
@RequiredArgsConstructor
public class TaskRouter {

  private static final Logger log = LoggerFactory.getLogger(TaskRouter.class);

  private final TaskService tasks;
  private final RequestBodyParser bodyParser;
  private final ResponseBuilder responses;

  public Envelope handle(TaskRequest request) {
    log.info("Received {}", request.routeKey());
    try {
      Optional<TaskRoute> route = TaskRoute.fromRouteKey(request.routeKey());
      if (route.isEmpty()) {
        log.warn("No route for {}", request.routeKey());
        return responses.error(404, ErrorResponse.ROUTE_NOT_FOUND, "Route not found.");
      }
      return dispatch(route.get(), request);
    } catch (Exception e) {
      log.error("Request {} failed: {}", request.routeKey(), e.getMessage());
      return responses.error(500, ErrorResponse.INTERNAL_ERROR, "Internal error: " + e.getMessage());
    }
  }

  private Envelope dispatch(TaskRoute route, TaskRequest request) {
    String id = request.pathParameters().get(TaskRoute.ID_PARAM);
    if (route.requiresId() && (id == null || id.isEmpty())) {
      log.warn("Missing id for {}", route.routeKey());
      return responses.error(400, ErrorResponse.VALIDATION_ERROR, "Path parameter 'id' is required.");
    }

    ObjectNode body = bodyParser.parse(request.body());
    return switch (route) {
      case CREATE_TASK -> tasks.create(body);
      case GET_TASK -> tasks.get(id);
      case UPDATE_TASK -> tasks.update(id, body);
      case DELETE_TASK -> tasks.delete(id);
      case LIST_TASKS -> tasks.list(request.queryParameters());
    };
  }
}
