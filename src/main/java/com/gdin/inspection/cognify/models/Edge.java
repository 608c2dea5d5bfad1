package com.gdin.inspection.cognify.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 图中的一条边。(source, relation, target) 唯一，provenance 记录产生该边的所有分片。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Edge {

    @JsonProperty("id")
    private String id;

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("source_id")
    private String sourceId;

    @JsonProperty("relation")
    private String relation;

    @JsonProperty("target_id")
    private String targetId;

    @JsonProperty("provenance")
    @Builder.Default
    private Set<String> provenance = new LinkedHashSet<>();

    @JsonProperty("properties")
    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @JsonIgnore
    public EdgeKey key() {
        return new EdgeKey(sourceId, relation, targetId);
    }

    public synchronized boolean addProvenance(String chunkId) {
        return chunkId != null && provenance.add(chunkId);
    }
}
