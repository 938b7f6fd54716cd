package com.gdin.inspection.citegraph.exception;

import lombok.Getter;

/**
 * 引用网络引擎的统一异常基类。
 */
@Getter
public class GraphException extends RuntimeException {

    private final ErrorCode code;

    public GraphException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GraphException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * 单条重试是否有意义。
     */
    public boolean isRetryable() {
        return false;
    }
}
