package com.gdin.inspection.cognify.index.update;

import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.GraphEntityType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一个分片去重合并后的结果，交给写入器持久化。
 */
@Value
@Builder
public class DeduplicationResult {
    String chunkId;
    List<GraphEntity> entities;
    List<GraphEntityType> entityTypes;
    List<Edge> edges;

    int newEntities;
    int mergedEntities;
    int newEdges;
    int existingEdges;
    int typeConflicts;
    int droppedRelations;
}
