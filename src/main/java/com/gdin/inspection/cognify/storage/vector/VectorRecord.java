package com.gdin.inspection.cognify.storage.vector;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class VectorRecord {
    String id;
    String datasetId;
    String type;
    /** 检索结果展示用的文本片段 */
    String text;
    float[] embedding;
    Map<String, Object> metadata;
}
