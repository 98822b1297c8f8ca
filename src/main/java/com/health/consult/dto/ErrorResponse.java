package com.health.consult.dto;

import com.health.consult.exception.ErrorCode;

public record ErrorResponse(ErrorCode error, String message) {
}
