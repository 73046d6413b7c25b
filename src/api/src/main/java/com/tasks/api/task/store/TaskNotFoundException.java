package com.tasks.api.task.store;

public class TaskNotFoundException extends TaskStoreException {

  private final String taskId;

  public TaskNotFoundException(String taskId) {
    super("Task does not exist: " + taskId);
    this.taskId = taskId;
  }

  public TaskNotFoundException(String taskId, Throwable cause) {
    super("Task does not exist: " + taskId, cause);
    this.taskId = taskId;
  }

  public String taskId() {
    return taskId;
  }
}
