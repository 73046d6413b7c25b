package com.tasks.api.task.store;

import com.tasks.api.task.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store. Contents are lost on restart.
 */
public class InMemoryTaskStore implements TaskStore {

  private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();

  @Override
  public Optional<Task> get(String id) {
    return Optional.ofNullable(tasks.get(id));
  }

  @Override
  public void put(Task task) {
    tasks.put(task.id(), task);
  }

  @Override
  public Task updateFields(String id, Map<String, String> fields) {
    Task updated = tasks.computeIfPresent(id, (key, current) -> new Task(
        current.id(),
        assigned(fields, Task.TITLE, current.title()),
        assigned(fields, Task.DESCRIPTION, current.description()),
        assigned(fields, Task.DATE, current.date())
    ));
    if (updated == null) {
      throw new TaskNotFoundException(id);
    }
    return updated;
  }

  private static Object assigned(Map<String, String> fields, String name, Object current) {
    return fields.containsKey(name) ? fields.get(name) : current;
  }

  @Override
  public void delete(String id) {
    tasks.remove(id);
  }

  @Override
  public List<Task> scanAll() {
    return new ArrayList<>(tasks.values());
  }

  @Override
  public List<Task> scanByDate(String date) {
    return tasks.values().stream()
        .filter(t -> date.equals(t.date()))
        .toList();
  }
}
