package com.gdin.inspection.cognify.exception;

/**
 * 认知化管道与检索层的异常基类。
 */
public class CognifyException extends RuntimeException {

    public CognifyException(String message) {
        super(message);
    }

    public CognifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
