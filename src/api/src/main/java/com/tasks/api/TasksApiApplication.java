package com.tasks.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TasksApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(TasksApiApplication.class, args);
  }
}
