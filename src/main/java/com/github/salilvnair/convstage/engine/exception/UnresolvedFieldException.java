package com.github.salilvnair.convstage.engine.exception;

import lombok.Getter;

@Getter
public class UnresolvedFieldException extends ConvStageException {

    private final String column;

    public UnresolvedFieldException(String column) {
        super(ConvStageErrorCode.UNRESOLVED_FIELD, "Prospect record has no value for column '" + column + "'");
        this.column = column;
    }
}
