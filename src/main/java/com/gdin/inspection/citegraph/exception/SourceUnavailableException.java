package com.gdin.inspection.citegraph.exception;

/**
 * 元数据源重试耗尽后仍不可用。
 */
public class SourceUnavailableException extends GraphException {

    public SourceUnavailableException(String message) {
        super(ErrorCode.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(ErrorCode.SOURCE_UNAVAILABLE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
