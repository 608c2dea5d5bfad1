package com.gdin.inspection.cognify.exception;

/**
 * 可重试的外部错误：网络超时、存储暂不可用、模型限流等。
 */
public class TransientStoreException extends CognifyException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
