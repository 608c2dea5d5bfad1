package com.gdin.inspection.cognify.exception;

public class InvalidSummaryInputsException extends UnitInputException {

    public InvalidSummaryInputsException(String unitId, String message) {
        super(unitId, message);
    }
}
