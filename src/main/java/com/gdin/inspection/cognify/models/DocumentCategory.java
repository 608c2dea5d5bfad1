package com.gdin.inspection.cognify.models;

/**
 * 文档分类结果，决定摘要生成 TextSummary 还是 CodeSummary。
 */
public enum DocumentCategory {
    TEXT,
    CODE
}
