package com.gdin.inspection.cognify.index.workflows;

import com.gdin.inspection.cognify.index.pipeline.UnitExecutor;
import com.gdin.inspection.cognify.index.pipeline.context.PipelineRunContext;
import com.gdin.inspection.cognify.index.summarize.Summarizer;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.DocumentChunk;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.EdgeKey;
import com.gdin.inspection.cognify.models.Relations;
import com.gdin.inspection.cognify.util.DataPointIds;
import jakarta.annotation.Resource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * summarize_chunks：每个分片一条摘要，摘要通过 made_from 边指回分片。
 */
@Slf4j
@Service
public class SummarizeChunksWorkflow {

    public static final String TASK = "summarize_chunks";

    @Value
    public static class ChunkSummary {
        String chunkId;
        DataPoint summary;
        Edge madeFrom;
    }

    @Resource
    private Summarizer summarizer;

    @Resource
    private UnitExecutor unitExecutor;

    public Map<String, ChunkSummary> run(List<DocumentChunk> chunks, PipelineRunContext context) {
        List<ChunkSummary> results = unitExecutor.map(TASK, chunks, DocumentChunk::getId, chunk -> {
            DataPoint summary = summarizer.summarize(List.of(chunk)).findFirst().orElseThrow();
            EdgeKey key = new EdgeKey(summary.getId(), Relations.MADE_FROM, chunk.getId());
            Edge edge = Edge.builder()
                    .id(DataPointIds.edgeId(chunk.getDatasetId(), key))
                    .datasetId(chunk.getDatasetId())
                    .sourceId(summary.getId())
                    .relation(Relations.MADE_FROM)
                    .targetId(chunk.getId())
                    .build();
            edge.addProvenance(chunk.getId());
            chunk.addContains(summary.getId());
            return new ChunkSummary(chunk.getId(), summary, edge);
        }, context);

        Map<String, ChunkSummary> out = new LinkedHashMap<>();
        for (ChunkSummary s : results) {
            out.put(s.getChunkId(), s);
        }
        log.info("run {} 摘要完成: {} 条", context.getRun().getId(), out.size());
        return out;
    }
}
