package com.gdin.inspection.cognify.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class DeletionReport {

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("document_id")
    private String documentId;

    @JsonProperty("chunks_deleted")
    private int chunksDeleted;

    @JsonProperty("summaries_deleted")
    private int summariesDeleted;

    @JsonProperty("entities_deleted")
    private int entitiesDeleted;

    @JsonProperty("entity_types_deleted")
    private int entityTypesDeleted;

    @JsonProperty("nodes_deleted")
    private int nodesDeleted;

    @JsonProperty("edges_deleted")
    private int edgesDeleted;

    @JsonProperty("edges_trimmed")
    private int edgesTrimmed;

    @JsonProperty("entities_rewritten")
    private int entitiesRewritten;
}
