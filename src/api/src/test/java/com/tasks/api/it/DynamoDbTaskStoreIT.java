package com.tasks.api.it;

import com.tasks.api.task.Task;
import com.tasks.api.task.store.DynamoDbTaskStore;
import com.tasks.api.task.store.TaskNotFoundException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

import java.net.URI;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the DynamoDB store against DynamoDB Local. Needs Docker; executed by failsafe in {@code mvn verify}.
 */
@Testcontainers(disabledWithoutDocker = true)
class DynamoDbTaskStoreIT {

  @Container
  static final GenericContainer<?> dynamo = new GenericContainer<>("amazon/dynamodb-local:2.5.2")
      .withCommand("-jar DynamoDBLocal.jar -inMemory -sharedDb")
      .withExposedPorts(8000);

  static final String table = "Tasks";
  static DynamoDbClient client;
  static DynamoDbTaskStore store;

  @BeforeAll
  static void createTable() {
    System.out.println("[IT] Testcontainers Docker available: " + DockerClientFactory.instance().isDockerAvailable());
    client = DynamoDbClient.builder()
        .httpClient(UrlConnectionHttpClient.create())
        .endpointOverride(URI.create("http://" + dynamo.getHost() + ":" + dynamo.getMappedPort(8000)))
        .region(Region.US_EAST_1)
        .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create("local", "local")))
        .build();

    client.createTable(CreateTableRequest.builder()
        .tableName(table)
        .keySchema(KeySchemaElement.builder().attributeName("id").keyType(KeyType.HASH).build())
        .attributeDefinitions(AttributeDefinition.builder()
            .attributeName("id").attributeType(ScalarAttributeType.S).build())
        .billingMode(BillingMode.PAY_PER_REQUEST)
        .build());

    store = new DynamoDbTaskStore(client, table);
  }

  @AfterAll
  static void closeClient() {
    if (client != null) {
      client.close();
    }
  }

  @Test
  void crudAgainstRealTable() {
    String id = UUID.randomUUID().toString();
    store.put(new Task(id, "Buy milk", "", "2025-12-04"));

    assertEquals(new Task(id, "Buy milk", "", "2025-12-04"), store.get(id).orElseThrow());

    Task updated = store.updateFields(id, Map.of("description", "2L", "date", "2025-12-05"));
    assertEquals(new Task(id, "Buy milk", "2L", "2025-12-05"), updated);

    assertTrue(store.scanByDate("2025-12-05").stream().anyMatch(t -> t.id().equals(id)));
    assertTrue(store.scanByDate("2025-12-04").stream().noneMatch(t -> t.id().equals(id)));
    assertTrue(store.scanAll().stream().anyMatch(t -> t.id().equals(id)));

    store.delete(id);
    assertTrue(store.get(id).isEmpty());
  }

  @Test
  void updateOfMissingKeyDoesNotCreateIt() {
    String id = UUID.randomUUID().toString();

    assertThrows(TaskNotFoundException.class, () -> store.updateFields(id, Map.of("title", "x")));
    assertTrue(store.get(id).isEmpty());
  }
}
