package com.gdin.inspection.citegraph.exception;

/**
 * 文本理解服务超时、报错或给出无法解析的结果。单条可重试，不应中断批处理。
 */
public class ExtractionFailedException extends GraphException {

    public ExtractionFailedException(String message) {
        super(ErrorCode.EXTRACTION_FAILED, message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(ErrorCode.EXTRACTION_FAILED, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
