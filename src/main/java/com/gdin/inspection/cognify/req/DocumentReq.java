package com.gdin.inspection.cognify.req;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "待认知化的文档")
public class DocumentReq {

    @NotBlank
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "文档名（用于识别类型）", example = "alice.txt")
    private String name;

    @NotNull
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "文档内容", example = "Alice met Bob in Paris.")
    private String content;

    @Builder.Default
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "内容编码：text / base64", example = "text")
    private String encoding = "text";

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "mime 类型，为空时按扩展名识别")
    private String mimeType;
}
