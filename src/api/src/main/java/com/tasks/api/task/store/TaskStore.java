package com.tasks.api.task.store;

import com.tasks.api.task.Task;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value access to the task collection, keyed by {@link Task#id()}.
 * <p>
 * Implementations throw {@link TaskStoreException} for any storage failure.
 * No ordering is guaranteed for scan results.
 */
public interface TaskStore {

  Optional<Task> get(String id);

  /**
   * Inserts or fully replaces the record with the same id.
   */
  void put(Task task);

  /**
   * Assigns only the given fields (keys are {@code title}, {@code description}, {@code date})
   * and returns the complete record after the update.
   *
   * @throws TaskNotFoundException if no record exists for {@code id}
   */
  Task updateFields(String id, Map<String, String> fields);

  void delete(String id);

  List<Task> scanAll();

  /**
   * Full scan keeping records whose {@code date} equals the given value as a string.
   */
  List<Task> scanByDate(String date);
}
