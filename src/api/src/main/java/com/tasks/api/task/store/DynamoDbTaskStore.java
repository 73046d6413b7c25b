package com.tasks.api.task.store;

import com.tasks.api.task.Task;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Tasks in a DynamoDB table with a string partition key {@code id}.
 * <p>
 * Attribute names are always aliased in expressions since {@code date} is a reserved word.
 */
public class DynamoDbTaskStore implements TaskStore {

  private static final List<String> MUTABLE_FIELDS = List.of(Task.TITLE, Task.DESCRIPTION, Task.DATE);

  private final DynamoDbClient dynamo;
  private final String table;

  public DynamoDbTaskStore(DynamoDbClient dynamo, String table) {
    this.dynamo = dynamo;
    this.table = table;
  }

  @Override
  public Optional<Task> get(String id) {
    GetItemResponse resp = call("get", () -> dynamo.getItem(GetItemRequest.builder()
        .tableName(table)
        .key(key(id))
        .consistentRead(true)
        .build()));
    if (!resp.hasItem() || resp.item().isEmpty()) return Optional.empty();
    return Optional.of(toTask(resp.item()));
  }

  @Override
  public void put(Task task) {
    Map<String, AttributeValue> item = new HashMap<>();
    item.put(Task.ID, AttributeValue.fromS(task.id()));
    item.put(Task.TITLE, attribute(task.title()));
    item.put(Task.DESCRIPTION, attribute(task.description()));
    item.put(Task.DATE, attribute(task.date()));
    call("put", () -> dynamo.putItem(PutItemRequest.builder().tableName(table).item(item).build()));
  }

  @Override
  public Task updateFields(String id, Map<String, String> fields) {
    List<String> assignments = new ArrayList<>();
    Map<String, String> names = new HashMap<>();
    Map<String, AttributeValue> values = new HashMap<>();
    names.put("#id", Task.ID);
    for (String field : MUTABLE_FIELDS) {
      if (!fields.containsKey(field)) continue;
      assignments.add("#" + field + " = :" + field);
      names.put("#" + field, field);
      values.put(":" + field, AttributeValue.fromS(fields.get(field)));
    }
    if (assignments.isEmpty()) {
      throw new IllegalArgumentException("no updatable fields in " + fields.keySet());
    }

    UpdateItemRequest req = UpdateItemRequest.builder()
        .tableName(table)
        .key(key(id))
        .updateExpression("SET " + String.join(", ", assignments))
        .conditionExpression("attribute_exists(#id)")
        .expressionAttributeNames(names)
        .expressionAttributeValues(values)
        .returnValues(ReturnValue.ALL_NEW)
        .build();

    UpdateItemResponse resp;
    try {
      resp = call("update", () -> dynamo.updateItem(req));
    } catch (TaskStoreException e) {
      if (e.getCause() instanceof ConditionalCheckFailedException) {
        throw new TaskNotFoundException(id, e.getCause());
      }
      throw e;
    }
    return toTask(resp.attributes());
  }

  @Override
  public void delete(String id) {
    call("delete", () -> dynamo.deleteItem(DeleteItemRequest.builder().tableName(table).key(key(id)).build()));
  }

  @Override
  public List<Task> scanAll() {
    return scan(ScanRequest.builder().tableName(table).build());
  }

  @Override
  public List<Task> scanByDate(String date) {
    return scan(ScanRequest.builder()
        .tableName(table)
        .filterExpression("#date = :date")
        .expressionAttributeNames(Map.of("#date", Task.DATE))
        .expressionAttributeValues(Map.of(":date", AttributeValue.fromS(date)))
        .build());
  }

  private List<Task> scan(ScanRequest req) {
    return call("scan", () -> {
      List<Task> out = new ArrayList<>();
      // the paginator follows LastEvaluatedKey across 1 MB pages
      for (Map<String, AttributeValue> item : dynamo.scanPaginator(req).items()) {
        out.add(toTask(item));
      }
      return out;
    });
  }

  private <T> T call(String op, Supplier<T> action) {
    try {
      return action.get();
    } catch (SdkException e) {
      throw new TaskStoreException("DynamoDB " + op + " on table " + table + " failed: " + e.getMessage(), e);
    }
  }

  private static Map<String, AttributeValue> key(String id) {
    return Map.of(Task.ID, AttributeValue.fromS(id));
  }

  static Task toTask(Map<String, AttributeValue> item) {
    Object description = value(item.get(Task.DESCRIPTION));
    return new Task(
        item.containsKey(Task.ID) ? item.get(Task.ID).s() : null,
        value(item.get(Task.TITLE)),
        description == null ? "" : description,
        value(item.get(Task.DATE))
    );
  }

  /**
   * Numbers stay {@link BigDecimal} so they reach the response as JSON numbers.
   */
  private static Object value(AttributeValue av) {
    if (av == null) return null;
    return switch (av.type()) {
      case S -> av.s();
      case N -> new BigDecimal(av.n());
      case BOOL -> av.bool();
      case NUL -> null;
      default -> av.toString();
    };
  }

  private static AttributeValue attribute(Object value) {
    if (value == null) return AttributeValue.fromNul(true);
    if (value instanceof BigDecimal d) return AttributeValue.fromN(d.toPlainString());
    if (value instanceof Number n) return AttributeValue.fromN(n.toString());
    if (value instanceof Boolean b) return AttributeValue.fromBool(b);
    return AttributeValue.fromS(value.toString());
  }
}
