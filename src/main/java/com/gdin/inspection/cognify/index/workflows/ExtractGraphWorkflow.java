package com.gdin.inspection.cognify.index.workflows;

import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.index.extract.ExtractedGraph;
import com.gdin.inspection.cognify.index.extract.ExtractionSchema;
import com.gdin.inspection.cognify.index.extract.GraphExtractionAdapter;
import com.gdin.inspection.cognify.index.ontology.OntologyProvider;
import com.gdin.inspection.cognify.index.ontology.OntologySnapshot;
import com.gdin.inspection.cognify.index.pipeline.UnitExecutor;
import com.gdin.inspection.cognify.index.pipeline.context.PipelineRunContext;
import com.gdin.inspection.cognify.index.update.DeduplicationResult;
import com.gdin.inspection.cognify.index.update.GraphDeduplicator;
import com.gdin.inspection.cognify.models.DocumentChunk;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * extract_graph：分片并发抽图，并与图库现状去重合并。
 * 抽取失败的分片被剔除，其它分片照常进入下游。
 */
@Slf4j
@Service
public class ExtractGraphWorkflow {

    public static final String TASK = "extract_graph";

    @Resource
    private GraphExtractionAdapter graphExtractionAdapter;

    @Resource
    private GraphDeduplicator graphDeduplicator;

    @Resource
    private OntologyProvider ontologyProvider;

    @Resource
    private UnitExecutor unitExecutor;

    @Resource
    private CognifyProperties cognifyProperties;

    /**
     * @return chunkId → 去重结果，按分片顺序
     */
    public Map<String, DeduplicationResult> run(List<DocumentChunk> chunks, PipelineRunContext context) {
        OntologySnapshot snapshot = ontologyProvider.snapshot();
        ExtractionSchema schema = ExtractionSchema.builder()
                .entityTypes(cognifyProperties.getExtraction().getEntityTypes())
                .build();

        List<DeduplicationResult> results = unitExecutor.map(TASK, chunks, DocumentChunk::getId, chunk -> {
            ExtractedGraph graph = graphExtractionAdapter.extract(chunk.getId(), chunk.getText(), schema);
            return graphDeduplicator.deduplicate(chunk, graph, snapshot);
        }, context);

        Map<String, DeduplicationResult> out = new LinkedHashMap<>();
        int entities = 0;
        int edges = 0;
        int conflicts = 0;
        for (DeduplicationResult r : results) {
            out.put(r.getChunkId(), r);
            entities += r.getEntities().size();
            edges += r.getEdges().size();
            conflicts += r.getTypeConflicts();
        }
        log.info("run {} 抽图完成: chunks={}, entities={}, edges={}, typeConflicts={}",
                context.getRun().getId(), out.size(), entities, edges, conflicts);
        return out;
    }
}
