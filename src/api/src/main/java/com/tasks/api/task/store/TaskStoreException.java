package com.tasks.api.task.store;

public class TaskStoreException extends RuntimeException {

  public TaskStoreException(String message) {
    super(message);
  }

  public TaskStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
