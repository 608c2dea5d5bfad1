package com.gdin.inspection.cognify.exception;

import lombok.Getter;

/**
 * 抽取模型调用失败或返回无法解析的内容，失败单元为分片。
 */
@Getter
public class ExtractionException extends CognifyException {

    private final String chunkId;

    public ExtractionException(String chunkId, String message, Throwable cause) {
        super(message, cause);
        this.chunkId = chunkId;
    }
}
