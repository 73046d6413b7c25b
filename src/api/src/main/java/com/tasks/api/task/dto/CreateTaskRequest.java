package com.tasks.api.task.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotEmpty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateTaskRequest(
    @NotEmpty String title,
    String description,
    @NotEmpty String date
) {
}
