package com.gdin.inspection.cognify.exception;

/**
 * 文档内容不是合法 UTF-8。
 */
public class DecodingException extends UnitInputException {

    public DecodingException(String documentId, String message, Throwable cause) {
        super(documentId, message, cause);
    }
}
