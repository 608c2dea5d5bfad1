package com.gdin.inspection.cognify.index.summarize;

import com.gdin.inspection.cognify.models.DocumentCategory;

/**
 * 摘要模型边界。每次调用都会重新请求模型，结果不保证相同。
 */
public interface SummaryGenerator {

    String summarize(String text, DocumentCategory category);
}
