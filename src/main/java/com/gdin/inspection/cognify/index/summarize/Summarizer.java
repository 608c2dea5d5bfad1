package com.gdin.inspection.cognify.index.summarize;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.exception.InvalidSummaryInputsException;
import com.gdin.inspection.cognify.models.CodeSummary;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.DocumentCategory;
import com.gdin.inspection.cognify.models.DocumentChunk;
import com.gdin.inspection.cognify.models.TextSummary;
import com.gdin.inspection.cognify.util.DataPointIds;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * 分片摘要。文本分片产出 {@link TextSummary}，代码分片产出 {@link CodeSummary}，与输入一一对应。
 * <p>
 * 输入在调用时整体校验；返回的流是惰性的，只能消费一次，每个元素被消费时才调用模型。
 * 摘要只引用来源分片，不修改分片。
 */
@Slf4j
@Service
public class Summarizer {

    @Resource
    private SummaryGenerator summaryGenerator;

    public Summarizer() {
    }

    public Summarizer(SummaryGenerator summaryGenerator) {
        this.summaryGenerator = summaryGenerator;
    }

    /**
     * @throws InvalidSummaryInputsException 输入为空引用、含非分片元素或分片没有可摘要的文本
     */
    public Stream<DataPoint> summarize(List<?> inputs) {
        if (inputs == null) {
            throw new InvalidSummaryInputsException(null, "摘要输入不能为 null");
        }
        for (Object o : inputs) {
            if (!(o instanceof DocumentChunk chunk)) {
                throw new InvalidSummaryInputsException(null, "摘要输入必须是分片: " + (o == null ? "null" : o.getClass().getSimpleName()));
            }
            if (StrUtil.isBlank(chunk.getText())) {
                throw new InvalidSummaryInputsException(chunk.getId(), "分片没有可摘要的文本: " + chunk.getId());
            }
        }
        return inputs.stream()
                .map(DocumentChunk.class::cast)
                .map(this::summarizeOne);
    }

    private DataPoint summarizeOne(DocumentChunk chunk) {
        boolean code = chunk.getCategory() == DocumentCategory.CODE;
        String text = summaryGenerator.summarize(chunk.getText(), chunk.getCategory());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("document_id", chunk.getDocumentId());
        metadata.put("chunk_index", chunk.getChunkIndex());
        if (code) {
            return CodeSummary.builder()
                    .id(DataPointIds.summaryId(chunk.getDatasetId(), DataPointType.CODE_SUMMARY, chunk.getId()))
                    .datasetId(chunk.getDatasetId())
                    .text(text)
                    .summarizes(chunk.getId())
                    .metadata(metadata)
                    .build();
        }
        return TextSummary.builder()
                .id(DataPointIds.summaryId(chunk.getDatasetId(), DataPointType.TEXT_SUMMARY, chunk.getId()))
                .datasetId(chunk.getDatasetId())
                .text(text)
                .madeFrom(chunk.getId())
                .metadata(metadata)
                .build();
    }
}
