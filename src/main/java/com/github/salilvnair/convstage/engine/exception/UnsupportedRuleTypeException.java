package com.github.salilvnair.convstage.engine.exception;

import lombok.Getter;

@Getter
public class UnsupportedRuleTypeException extends ConvStageException {

    private final String inputType;

    public UnsupportedRuleTypeException(String inputType) {
        super(ConvStageErrorCode.UNSUPPORTED_RULE_TYPE, "Unsupported stage rule input_type '" + inputType + "'");
        this.inputType = inputType;
    }
}
