package com.health.consult.controller;

import com.health.consult.dto.ErrorResponse;
import com.health.consult.exception.ConsultationException;
import com.health.consult.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConsultationException.class)
    public ResponseEntity<ErrorResponse> handleConsultation(ConsultationException e) {
        log.debug("Request failed: {} {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(e.getCode().getHttpStatus())
                .body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        return ResponseEntity.status(ErrorCode.VALIDATION_ERROR.getHttpStatus())
                .body(new ErrorResponse(ErrorCode.VALIDATION_ERROR, e.getMessage()));
    }
}
