package com.gdin.inspection.citegraph.exception;

public class InvalidFilterException extends GraphException {

    public InvalidFilterException(String message) {
        super(ErrorCode.INVALID_FILTER, message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(ErrorCode.INVALID_FILTER, message, cause);
    }
}
