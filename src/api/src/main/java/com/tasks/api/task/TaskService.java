package com.tasks.api.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tasks.api.infra.Envelope;
import com.tasks.api.infra.ErrorResponse;
import com.tasks.api.infra.ResponseBuilder;
import com.tasks.api.task.dto.CreateTaskRequest;
import com.tasks.api.task.store.TaskStore;
import com.tasks.api.task.store.TaskStoreException;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The five task operations. Validation and not-found outcomes are answered here;
 * anything else unexpected propagates to the router.
 */
@Service
@RequiredArgsConstructor
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  static final String MSG_CREATE_REQUIRED = "Fields 'title' and 'date' are required.";
  static final String MSG_NOT_STRING = "Task fields must be strings.";
  static final String MSG_NOT_FOUND = "Task not found.";
  static final String MSG_NOTHING_TO_UPDATE = "Nothing to update.";
  static final String MSG_DATE_REQUIRED = "Query parameter 'date' is required, e.g. /tasks?date=2025-12-04";

  private static final List<String> UPDATABLE = List.of(Task.TITLE, Task.DESCRIPTION, Task.DATE);

  private final TaskStore store;
  private final ResponseBuilder responses;
  private final ObjectMapper objectMapper;
  private final Validator validator;

  public Envelope create(ObjectNode body) {
    CreateTaskRequest req;
    try {
      req = objectMapper.convertValue(body, CreateTaskRequest.class);
    } catch (IllegalArgumentException e) {
      return badRequest(MSG_NOT_STRING);
    }
    if (!validator.validate(req).isEmpty()) {
      return badRequest(MSG_CREATE_REQUIRED);
    }

    Task task = new Task(
        UUID.randomUUID().toString(),
        req.title(),
        req.description() == null ? "" : req.description(),
        req.date()
    );
    store.put(task);
    log.info("Created task id={}", task.id());
    return responses.build(201, task);
  }

  public Envelope get(String id) {
    Optional<Task> task = store.get(id);
    if (task.isEmpty()) {
      return notFound(id);
    }
    return responses.build(200, task.get());
  }

  /**
   * Applies whichever of title, description and date are present in the body, even when empty.
   * Every store failure, a missing id included, is answered with 500.
   */
  public Envelope update(String id, ObjectNode body) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (String name : UPDATABLE) {
      if (!body.has(name)) continue;
      JsonNode value = body.get(name);
      if (value.isContainerNode()) {
        return badRequest(MSG_NOT_STRING);
      }
      fields.put(name, value.isNull() ? "" : value.asText());
    }
    if (fields.isEmpty()) {
      return badRequest(MSG_NOTHING_TO_UPDATE);
    }

    Task updated;
    try {
      updated = store.updateFields(id, fields);
    } catch (TaskStoreException e) {
      log.error("Update of task id={} failed: {}", id, e.getMessage());
      return responses.error(500, ErrorResponse.STORAGE_ERROR, "Failed to update task: " + e.getMessage());
    }
    return responses.build(200, updated);
  }

  public Envelope delete(String id) {
    if (store.get(id).isEmpty()) {
      return notFound(id);
    }
    store.delete(id);
    log.info("Deleted task id={}", id);
    return responses.build(204, null);
  }

  /**
   * Lists every task, or only those with the given date when the {@code date} key is present.
   * A present but empty {@code date} is rejected rather than treated as "no filter".
   */
  public Envelope list(Map<String, String> queryParameters) {
    if (!queryParameters.containsKey(Task.DATE)) {
      return responses.build(200, store.scanAll());
    }
    String date = queryParameters.get(Task.DATE);
    if (date == null || date.isEmpty()) {
      return badRequest(MSG_DATE_REQUIRED);
    }
    return responses.build(200, store.scanByDate(date));
  }

  private Envelope badRequest(String message) {
    log.warn("Rejected request: {}", message);
    return responses.error(400, ErrorResponse.VALIDATION_ERROR, message);
  }

  private Envelope notFound(String id) {
    log.warn("Task not found: id={}", id);
    return responses.error(404, ErrorResponse.NOT_FOUND, MSG_NOT_FOUND);
  }
}
