package com.gdin.inspection.citegraph.graph.batch;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 批处理的取消标记，只在两个子任务之间检查。
 */
public class CancellationToken {

    @Getter
    private final String jobId;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationToken(String jobId) {
        this.jobId = jobId;
    }

    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
