package com.github.salilvnair.convstage.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class ConvStageException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public ConvStageException(
            ConvStageErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ConvStageException(
            ConvStageErrorCode code,
            String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ConvStageException(
            ConvStageErrorCode code,
            String overrideMessage,
            Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ConvStageException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

}
