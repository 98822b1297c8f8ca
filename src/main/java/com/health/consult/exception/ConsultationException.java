package com.health.consult.exception;

public class ConsultationException extends RuntimeException {

    private final ErrorCode code;

    public ConsultationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static ConsultationException notFound(String message) {
        return new ConsultationException(ErrorCode.NOT_FOUND, message);
    }

    public static ConsultationException invalidState(String message) {
        return new ConsultationException(ErrorCode.INVALID_STATE, message);
    }

    public static ConsultationException sequenceViolation(String message) {
        return new ConsultationException(ErrorCode.SEQUENCE_VIOLATION, message);
    }

    public static ConsultationException invalidAnswer(String message) {
        return new ConsultationException(ErrorCode.INVALID_ANSWER, message);
    }

    public static ConsultationException validation(String message) {
        return new ConsultationException(ErrorCode.VALIDATION_ERROR, message);
    }

    public static ConsultationException conflictingRequest(String message) {
        return new ConsultationException(ErrorCode.CONFLICTING_REQUEST, message);
    }

    public static ConsultationException alreadyPaid(String message) {
        return new ConsultationException(ErrorCode.ALREADY_PAID, message);
    }

    public static ConsultationException amountMismatch(String message) {
        return new ConsultationException(ErrorCode.AMOUNT_MISMATCH, message);
    }

    public static ConsultationException invalidTime(String message) {
        return new ConsultationException(ErrorCode.INVALID_TIME, message);
    }

    public static ConsultationException sessionNotOwned(String message) {
        return new ConsultationException(ErrorCode.SESSION_NOT_OWNED, message);
    }

    public static ConsultationException forbidden(String message) {
        return new ConsultationException(ErrorCode.FORBIDDEN, message);
    }
}
