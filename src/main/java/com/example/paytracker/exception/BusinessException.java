package com.example.paytracker.exception;

/**
 * Failure at the service boundary: unknown ids, duplicate registrations, malformed input.
 * The computation core never throws this for business data; it reports diagnostics as data instead.
 */
public class BusinessException extends RuntimeException {

    public static final String NOT_FOUND_SUFFIX = "_NOT_FOUND";

    private final String errorCode;
    private final Object[] parameters;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
        this.parameters = new Object[0];
    }

    public BusinessException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public BusinessException(String errorCode, String message, Throwable cause, Object... parameters) {
        super(message, cause);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public static BusinessException notFound(String entity, Object id) {
        return new BusinessException(entity.toUpperCase() + NOT_FOUND_SUFFIX, entity + " not found (id=" + id + ")", id);
    }

    public boolean isNotFound() {
        return errorCode != null && errorCode.endsWith(NOT_FOUND_SUFFIX);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }
}
