package com.gdin.inspection.cognify.index.summarize;

import cn.hutool.core.exceptions.ExceptionUtil;
import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.CognifyException;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import com.gdin.inspection.cognify.index.prompts.SummarizePrompts;
import com.gdin.inspection.cognify.models.DocumentCategory;
import com.gdin.inspection.cognify.util.RetryExecutor;
import dev.langchain4j.model.chat.ChatModel;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;

@Service
public class LlmSummaryGenerator implements SummaryGenerator {

    @Resource
    private ChatModel chatModel;

    @Resource
    private RetryExecutor retryExecutor;

    @Resource
    private CognifyProperties cognifyProperties;

    @Override
    public String summarize(String text, DocumentCategory category) {
        String prompt = category == DocumentCategory.CODE ? SummarizePrompts.code(text) : SummarizePrompts.text(text);
        Duration timeout = Duration.ofSeconds(cognifyProperties.getExtraction().getTimeoutSeconds());
        String out = retryExecutor.call("summarize", () -> {
            try {
                return chatModel.chat(prompt);
            } catch (RuntimeException e) {
                if (ExceptionUtil.isCausedBy(e, IOException.class)) {
                    throw new TransientStoreException("摘要模型调用失败: " + e.getMessage(), e);
                }
                throw new CognifyException("摘要模型调用失败: " + e.getMessage(), e);
            }
        }, timeout);
        return out == null ? "" : out.trim();
    }
}
