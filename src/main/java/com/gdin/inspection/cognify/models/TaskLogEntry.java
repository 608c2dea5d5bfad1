package com.gdin.inspection.cognify.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskLogEntry {

    @JsonProperty("task")
    private String task;

    @JsonProperty("status")
    private TaskStatus status;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("finished_at")
    private Instant finishedAt;

    @JsonProperty("seconds")
    private Double seconds;

    @JsonProperty("succeeded_units")
    private Integer succeededUnits;

    @JsonProperty("failed_units")
    private Integer failedUnits;

    @JsonProperty("message")
    private String message;
}
