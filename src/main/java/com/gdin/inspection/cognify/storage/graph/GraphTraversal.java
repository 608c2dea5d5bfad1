package com.gdin.inspection.cognify.storage.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 从锚点出发的无向广度优先遍历。
 */
@Value
@Builder
public class GraphTraversal {
    String datasetId;
    List<String> startIds;
    @Builder.Default
    int maxDepth = 2;
    /** 返回节点数上限（含锚点） */
    @Builder.Default
    int limit = 100;
}
