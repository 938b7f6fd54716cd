package com.gdin.inspection.citegraph.exception;

public class EdgeNotFoundException extends GraphException {

    public EdgeNotFoundException(String message) {
        super(ErrorCode.EDGE_NOT_FOUND, message);
    }

    public EdgeNotFoundException(String message, Throwable cause) {
        super(ErrorCode.EDGE_NOT_FOUND, message, cause);
    }
}
