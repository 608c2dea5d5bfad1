package com.gdin.inspection.cognify.exception;

/**
 * 配置或管道结构错误（未注册的任务、依赖环、非法 schema），run 直接失败。
 */
public class FatalPipelineException extends CognifyException {

    public FatalPipelineException(String message) {
        super(message);
    }

    public FatalPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
