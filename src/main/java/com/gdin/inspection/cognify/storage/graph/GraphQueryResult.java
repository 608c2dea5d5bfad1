package com.gdin.inspection.cognify.storage.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class GraphQueryResult {
    /** 按 (跳数, id) 升序 */
    List<GraphNode> nodes;
    List<GraphEdge> edges;
    /** nodeId -> 距最近锚点的跳数 */
    Map<String, Integer> hops;
}
