package com.gdin.inspection.cognify.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DocumentChunk extends DataPoint {

    @JsonProperty("document_id")
    private String documentId;

    @JsonProperty("chunk_index")
    private int chunkIndex;

    @JsonProperty("text")
    private String text;

    @JsonProperty("token_count")
    private int tokenCount;

    @JsonProperty("category")
    private DocumentCategory category;

    /**
     * 分片包含的实体与摘要 id，按抽取顺序追加，不重复。
     */
    @JsonProperty("contains")
    @Builder.Default
    private List<String> contains = new ArrayList<>();

    public synchronized void addContains(String dataPointId) {
        if (dataPointId != null && !contains.contains(dataPointId)) {
            contains.add(dataPointId);
        }
    }

    @Override
    public DataPointType getType() {
        return DataPointType.DOCUMENT_CHUNK;
    }

    @Override
    public String embeddableText() {
        return text;
    }

    @Override
    protected String fingerprintSource() {
        return documentId + "|" + chunkIndex + "|" + text + "|" + String.join(",", contains);
    }
}
