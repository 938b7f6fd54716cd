package com.gdin.inspection.citegraph.exception;

public class InsufficientDataException extends GraphException {

    public InsufficientDataException(String message) {
        super(ErrorCode.INSUFFICIENT_DATA, message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(ErrorCode.INSUFFICIENT_DATA, message, cause);
    }
}
