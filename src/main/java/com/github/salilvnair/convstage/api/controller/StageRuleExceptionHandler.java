package com.github.salilvnair.convstage.api.controller;

import com.github.salilvnair.convstage.engine.exception.ConvStageException;
import com.github.salilvnair.convstage.engine.exception.StageRuleNotFoundException;
import com.github.salilvnair.convstage.engine.exception.StageRuleValidationException;
import com.github.salilvnair.convstage.engine.exception.StoreUnavailableException;
import com.github.salilvnair.convstage.engine.exception.UnresolvedFieldException;
import com.github.salilvnair.convstage.engine.exception.UnsupportedRuleTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice(assignableTypes = StageRuleController.class)
public class StageRuleExceptionHandler {

    @ExceptionHandler(StageRuleValidationException.class)
    public ResponseEntity<ErrorPayload> validation(StageRuleValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(StageRuleNotFoundException.class)
    public ResponseEntity<ErrorPayload> notFound(StageRuleNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler({UnresolvedFieldException.class, UnsupportedRuleTypeException.class})
    public ResponseEntity<ErrorPayload> unresolvable(ConvStageException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorPayload> unavailable(StoreUnavailableException ex) {
        log.error("ConvStage: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    private ResponseEntity<ErrorPayload> respond(HttpStatus status, ConvStageException ex) {
        return ResponseEntity.status(status)
                .body(new ErrorPayload(ex.getErrorCode(), ex.getMessage(), ex.isRecoverable()));
    }

    // ----------------------------------------
    // Error payload (operator/engine contract)
    // ----------------------------------------
    record ErrorPayload(
            String errorCode,
            String message,
            boolean recoverable
    ) {}
}
