package com.tasks.api.task;

/**
 * A single task record. {@code date} is kept as the caller sent it (expected {@code YYYY-MM-DD}).
 * <p>
 * The collection is schemaless, so the non-key attributes hold whatever the store returns:
 * strings for records written by this service, {@link java.math.BigDecimal} for numeric attributes.
 */
public record Task(String id, Object title, Object description, Object date) {

  public static final String ID = "id";
  public static final String TITLE = "title";
  public static final String DESCRIPTION = "description";
  public static final String DATE = "date";
}
