package com.gdin.inspection.citegraph.exception;

import lombok.Getter;

import java.util.List;

/**
 * 所有种子论文都无法解析时抛出。若元数据源不可用，cause 为 SourceUnavailableException。
 */
@Getter
public class NoPapersResolvedException extends GraphException {

    private final List<String> seeds;

    public NoPapersResolvedException(List<String> seeds, Throwable cause) {
        super(cause instanceof SourceUnavailableException ? ErrorCode.SOURCE_UNAVAILABLE : ErrorCode.NO_PAPERS_RESOLVED,
                "没有任何种子论文可以解析: " + seeds, cause);
        this.seeds = List.copyOf(seeds);
    }
}
