package com.gdin.inspection.cognify.exception;

import lombok.Getter;

/**
 * 输入错误：只中止出错的单元（文档或分片），不重试，run 继续处理其它单元。
 */
@Getter
public class UnitInputException extends CognifyException {

    private final String unitId;

    public UnitInputException(String unitId, String message) {
        super(message);
        this.unitId = unitId;
    }

    public UnitInputException(String unitId, String message, Throwable cause) {
        super(message, cause);
        this.unitId = unitId;
    }
}
