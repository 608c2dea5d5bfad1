package com.gdin.inspection.cognify.storage.vector;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class VectorMatch {
    String id;
    String datasetId;
    String type;
    String text;
    double score;
    Map<String, Object> metadata;
}
