package com.tasks.api.task.store;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "tasks.store.type", havingValue = "memory")
public class InMemoryStoreConfig {

  @Bean
  public TaskStore inMemoryTaskStore() {
    return new InMemoryTaskStore();
  }
}
