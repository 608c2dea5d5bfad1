package com.gdin.inspection.cognify.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @NotBlank
    @JsonProperty("query")
    private String query;

    @JsonProperty("mode")
    private SearchMode mode;

    /** 为空时检索全部数据集 */
    @JsonProperty("dataset_id")
    private String datasetId;

    @Min(1)
    @JsonProperty("top_k")
    private Integer topK;

    /** 结构检索的显式锚点实体名，为空时从查询文本中识别 */
    @JsonProperty("anchor_entity")
    private String anchorEntity;

    @Min(0)
    @Max(5)
    @JsonProperty("depth")
    private Integer depth;
}
