package com.gdin.inspection.cognify.index.extract;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 抽取适配器的输出：候选实体与候选关系，尚未做本体映射和去重。
 */
@Value
@Builder
public class ExtractedGraph {
    @Singular
    List<CandidateEntity> entities;
    @Singular
    List<CandidateRelation> relations;

    public static ExtractedGraph empty() {
        return ExtractedGraph.builder().build();
    }
}
