package com.gdin.inspection.cognify.models;

/**
 * 单个文档在某条 pipeline 上的处理状态，用于增量加载。
 */
public enum DataItemStatus {
    PROCESSING,
    COMPLETED,
    FAILED
}
