package com.gdin.inspection.cognify.index.extract;

/**
 * 抽取模型的边界：文本 + schema → 候选图。
 * 结果可能不确定，调用方不能假设两次调用返回相同内容。
 * 可重试的失败抛 {@link com.gdin.inspection.cognify.exception.TransientStoreException}，
 * 其它失败抛 {@link com.gdin.inspection.cognify.exception.ExtractionException}。
 */
public interface GraphExtractionAdapter {

    ExtractedGraph extract(String chunkId, String text, ExtractionSchema schema);
}
