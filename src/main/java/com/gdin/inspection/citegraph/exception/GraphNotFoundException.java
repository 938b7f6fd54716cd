package com.gdin.inspection.citegraph.exception;

public class GraphNotFoundException extends GraphException {

    public GraphNotFoundException(String message) {
        super(ErrorCode.GRAPH_NOT_FOUND, message);
    }

    public GraphNotFoundException(String message, Throwable cause) {
        super(ErrorCode.GRAPH_NOT_FOUND, message, cause);
    }
}
