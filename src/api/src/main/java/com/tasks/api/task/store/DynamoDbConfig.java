package com.tasks.api.task.store;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URI;

@Configuration
@ConditionalOnProperty(name = "tasks.store.type", havingValue = "dynamodb", matchIfMissing = true)
public class DynamoDbConfig {

  @Bean(destroyMethod = "close")
  public DynamoDbClient dynamoDbClient(
      @Value("${tasks.dynamodb.endpoint:}") String endpoint,
      @Value("${tasks.dynamodb.region:us-east-1}") String region,
      @Value("${tasks.dynamodb.access-key:}") String accessKey,
      @Value("${tasks.dynamodb.secret-key:}") String secretKey
  ) {
    var builder = DynamoDbClient.builder()
        .httpClient(UrlConnectionHttpClient.create())
        .region(Region.of(region));

    if (endpoint != null && !endpoint.isBlank()) {
      builder.endpointOverride(URI.create(endpoint));
    }

    if (accessKey != null && !accessKey.isBlank()) {
      builder.credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey)));
    }

    return builder.build();
  }

  @Bean
  public TaskStore dynamoDbTaskStore(DynamoDbClient dynamoDbClient,
                                     @Value("${tasks.dynamodb.table:Tasks}") String table) {
    return new DynamoDbTaskStore(dynamoDbClient, table);
  }
}
