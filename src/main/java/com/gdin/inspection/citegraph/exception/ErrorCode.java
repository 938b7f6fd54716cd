package com.gdin.inspection.citegraph.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    SOURCE_UNAVAILABLE(HttpStatus.BAD_GATEWAY),
    NO_PAPERS_RESOLVED(HttpStatus.UNPROCESSABLE_ENTITY),
    GRAPH_NOT_FOUND(HttpStatus.NOT_FOUND),
    NODE_NOT_FOUND(HttpStatus.NOT_FOUND),
    EDGE_NOT_FOUND(HttpStatus.NOT_FOUND),
    INSUFFICIENT_DATA(HttpStatus.BAD_REQUEST),
    EXTRACTION_FAILED(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_FILTER(HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    CANCELLED(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
