package com.github.salilvnair.convstage.engine.exception;

public class StageRuleValidationException extends ConvStageException {

    public StageRuleValidationException(String message) {
        super(ConvStageErrorCode.VALIDATION_FAILED, message);
    }

    public StageRuleValidationException(ConvStageErrorCode code, String message) {
        super(code, message);
    }

    public StageRuleValidationException(ConvStageErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
