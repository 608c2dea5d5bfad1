package com.gdin.inspection.cognify.storage.graph;

import com.gdin.inspection.cognify.models.EdgeKey;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class GraphEdge {
    String sourceId;
    String relation;
    String targetId;
    String datasetId;
    Map<String, Object> properties;

    public EdgeKey key() {
        return new EdgeKey(sourceId, relation, targetId);
    }
}
