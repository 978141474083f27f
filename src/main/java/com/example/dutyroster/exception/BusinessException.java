package com.example.dutyroster.exception;

public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Object[] parameters;

    public BusinessException(ErrorCode errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause, Object... parameters) {
        super(message, cause);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public static BusinessException notFound(String message, Object... parameters) {
        return new BusinessException(ErrorCode.NOT_FOUND, message, parameters);
    }

    public static BusinessException validation(String message, Object... parameters) {
        return new BusinessException(ErrorCode.VALIDATION, message, parameters);
    }

    public static BusinessException forbidden(String message, Object... parameters) {
        return new BusinessException(ErrorCode.FORBIDDEN, message, parameters);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }
}
