package com.gdin.inspection.cognify.models;

import cn.hutool.crypto.SecureUtil;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 三库共用的数据点基类。
 * <p>
 * id 由 {@link com.gdin.inspection.cognify.util.DataPointIds} 按内容确定性生成，
 * 同一个 id 在关系库、向量库、图库中指向同一个逻辑对象。
 */
@Data
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class DataPoint {

    @JsonProperty("id")
    private String id;

    @JsonProperty("dataset_id")
    private String datasetId;

    @JsonProperty("metadata")
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * 向量只进向量库，不参与关系库 payload 与指纹。
     */
    @JsonIgnore
    private float[] embedding;

    @JsonProperty("type")
    public abstract DataPointType getType();

    /**
     * 需要向量化的文本，返回 null 表示该类型不进向量库。
     */
    @JsonIgnore
    public abstract String embeddableText();

    /**
     * 参与指纹计算的内容，内容不变则指纹不变，写入器据此跳过未变化的数据点。
     */
    protected abstract String fingerprintSource();

    @JsonIgnore
    public String fingerprint() {
        return SecureUtil.sha256(getType().name() + "|" + datasetId + "|" + fingerprintSource());
    }

    @JsonIgnore
    public boolean isEmbeddable() {
        return embeddableText() != null;
    }
}
