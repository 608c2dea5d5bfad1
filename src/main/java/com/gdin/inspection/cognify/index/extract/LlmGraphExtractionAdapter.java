package com.gdin.inspection.cognify.index.extract;

import cn.hutool.core.exceptions.ExceptionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.ExtractionException;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import com.gdin.inspection.cognify.index.prompts.GraphExtractionPrompts;
import com.gdin.inspection.cognify.util.RetryExecutor;
import dev.langchain4j.model.chat.ChatModel;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;

/**
 * 基于 tuple 协议的大模型图抽取。
 * <p>
 * 模型调用走 {@link RetryExecutor}：超时和 IO 类错误重试，其它错误包装为 {@link ExtractionException}。
 * 输出里一条记录都解析不出来且输出不含结束标记时，视为模型输出异常。
 */
@Slf4j
@Service
public class LlmGraphExtractionAdapter implements GraphExtractionAdapter {

    @Resource
    private ChatModel chatModel;

    @Resource
    private RetryExecutor retryExecutor;

    @Resource
    private CognifyProperties cognifyProperties;

    @Override
    public ExtractedGraph extract(String chunkId, String text, ExtractionSchema schema) {
        if (StrUtil.isBlank(text)) return ExtractedGraph.empty();

        CognifyProperties.Extraction cfg = cognifyProperties.getExtraction();
        String prompt = GraphExtractionPrompts.build(
                text,
                schema == null ? cfg.getEntityTypes() : schema.getEntityTypes(),
                cfg.getRecordDelimiter(),
                cfg.getTupleDelimiter(),
                cfg.getCompletionDelimiter());

        String output = retryExecutor.call("extract_graph[" + chunkId + "]", () -> {
            try {
                return chatModel.chat(prompt);
            } catch (RuntimeException e) {
                if (ExceptionUtil.isCausedBy(e, IOException.class)) {
                    throw new TransientStoreException("抽取模型调用失败: " + e.getMessage(), e);
                }
                throw new ExtractionException(chunkId, "抽取模型调用失败: " + e.getMessage(), e);
            }
        }, Duration.ofSeconds(cfg.getTimeoutSeconds()));

        TupleRecordParser parser = new TupleRecordParser(
                cfg.getTupleDelimiter(), cfg.getRecordDelimiter(), cfg.getCompletionDelimiter());
        ExtractedGraph graph = parser.parse(output);
        if (graph.getEntities().isEmpty() && graph.getRelations().isEmpty()
                && StrUtil.isNotBlank(output) && !output.contains(cfg.getCompletionDelimiter())) {
            throw new ExtractionException(chunkId, "抽取结果无法解析: " + StrUtil.brief(output, 200), null);
        }
        log.debug("chunk {} 抽取到实体 {} 个，关系 {} 条", chunkId, graph.getEntities().size(), graph.getRelations().size());
        return graph;
    }
}
