package com.gdin.inspection.cognify.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true, exclude = "rawContent")
public class Document extends DataPoint {

    @JsonProperty("name")
    private String name;

    @JsonProperty("mime_type")
    private String mimeType;

    @JsonProperty("category")
    private DocumentCategory category;

    @JsonProperty("content_hash")
    private String contentHash;

    @JsonProperty("size_bytes")
    private Long sizeBytes;

    /**
     * 原始字节，由切片器负责按 UTF-8 严格解码。
     */
    @JsonIgnore
    private byte[] rawContent;

    @Override
    public DataPointType getType() {
        return DataPointType.DOCUMENT;
    }

    @Override
    public String embeddableText() {
        return null;
    }

    @Override
    protected String fingerprintSource() {
        return contentHash + "|" + name + "|" + mimeType + "|" + category;
    }
}
