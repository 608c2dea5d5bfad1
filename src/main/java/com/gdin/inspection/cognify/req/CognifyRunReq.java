package com.gdin.inspection.cognify.req;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "提交认知化 run")
public class CognifyRunReq {

    @NotBlank
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "数据集 id", example = "demo")
    private String datasetId;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "pipeline 名称，默认 cognify", example = "cognify")
    private String pipelineName;

    @NotEmpty
    @Valid
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "文档列表")
    private List<DocumentReq> documents;
}
