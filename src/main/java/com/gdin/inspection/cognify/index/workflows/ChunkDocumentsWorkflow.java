package com.gdin.inspection.cognify.index.workflows;

import com.gdin.inspection.cognify.index.chunk.Chunker;
import com.gdin.inspection.cognify.index.chunk.ChunkingStrategy;
import com.gdin.inspection.cognify.index.pipeline.UnitExecutor;
import com.gdin.inspection.cognify.index.pipeline.context.PipelineRunContext;
import com.gdin.inspection.cognify.models.Document;
import com.gdin.inspection.cognify.models.DocumentChunk;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * chunk_documents：文档并发切片。解码失败的文档只中止它自己。
 */
@Slf4j
@Service
public class ChunkDocumentsWorkflow {

    public static final String TASK = "chunk_documents";

    @Resource
    private Chunker chunker;

    @Resource
    private UnitExecutor unitExecutor;

    /**
     * @return documentId → 按 chunkIndex 排序的分片
     */
    public Map<String, List<DocumentChunk>> run(List<Document> documents, PipelineRunContext context) {
        ChunkingStrategy strategy = chunker.defaultStrategy();
        List<Map.Entry<String, List<DocumentChunk>>> chunked = unitExecutor.map(TASK, documents, Document::getId, doc -> {
            List<DocumentChunk> chunks = new ArrayList<>();
            for (DocumentChunk c : chunker.chunk(doc, strategy)) {
                chunks.add(c);
            }
            log.debug("文档切片完成: id={}, name={}, chunks={}", doc.getId(), doc.getName(), chunks.size());
            return Map.entry(doc.getId(), chunks);
        }, context);

        Map<String, List<DocumentChunk>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<DocumentChunk>> e : chunked) {
            out.put(e.getKey(), e.getValue());
        }
        return out;
    }
}
