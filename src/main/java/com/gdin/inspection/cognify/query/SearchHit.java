package com.gdin.inspection.cognify.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchHit {

    @JsonProperty("id")
    String id;

    @JsonProperty("type")
    String type;

    @JsonProperty("score")
    double score;

    @JsonProperty("snippet")
    String snippet;

    @JsonProperty("semantic_score")
    Double semanticScore;

    @JsonProperty("structural_score")
    Double structuralScore;

    /** 结构检索中距锚点的跳数 */
    @JsonProperty("hops")
    Integer hops;

    @JsonProperty("metadata")
    Map<String, Object> metadata;
}
