package com.gdin.inspection.cognify.index.pipeline.context;

import com.gdin.inspection.cognify.models.TaskStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineRunResult {
    String workflow;
    TaskStatus status;
    Object result;
    List<Exception> errors;
}
