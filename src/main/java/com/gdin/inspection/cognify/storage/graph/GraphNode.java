package com.gdin.inspection.cognify.storage.graph;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class GraphNode {
    String id;
    String datasetId;
    /** 数据点类型，作为图库标签 */
    String label;
    Map<String, Object> properties;

    public String stringProperty(String key) {
        Object v = properties == null ? null : properties.get(key);
        return v == null ? null : String.valueOf(v);
    }
}
