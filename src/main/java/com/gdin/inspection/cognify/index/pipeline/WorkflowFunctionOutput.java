package com.gdin.inspection.cognify.index.pipeline;

import com.gdin.inspection.cognify.storage.PersistBatch;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowFunctionOutput {
    Object result;
    @Builder.Default
    boolean stop = false;
    /** 本任务产出、需在下游任务开始前写入关系库的数据 */
    @Builder.Default
    PersistBatch flush = PersistBatch.empty();
    int succeededUnits;
}
