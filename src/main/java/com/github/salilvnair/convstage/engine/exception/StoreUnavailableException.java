package com.github.salilvnair.convstage.engine.exception;

public class StoreUnavailableException extends ConvStageException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ConvStageErrorCode.STORE_UNAVAILABLE, message, cause);
    }

    public StoreUnavailableException(ConvStageErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
