package com.gdin.inspection.cognify.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 实体上记录的一条出边：关系标签 + 目标实体 id。
 */
@Value
@Builder
@Jacksonized
public class EntityRelation {

    @JsonProperty("label")
    String label;

    @JsonProperty("target_id")
    String targetId;

    public String asKey() {
        return label + "->" + targetId;
    }
}
