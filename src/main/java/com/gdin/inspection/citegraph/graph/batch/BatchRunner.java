package com.gdin.inspection.citegraph.graph.batch;

import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.exception.GraphException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 有界并发地逐条执行子任务。
 * <p>
 * 单条失败只记录在结果里，不影响其它条目；取消只在开始下一条前检查，
 * 已经完成的写回保留。返回顺序与输入顺序一致，与完成先后无关。
 */
@Slf4j
@Component
public class BatchRunner {

    private final GraphProperties.Compare props;

    @Autowired
    public BatchRunner(GraphProperties graphProperties) {
        this(graphProperties.getCompare());
    }

    public BatchRunner(GraphProperties.Compare props) {
        this.props = props;
    }

    public int clampParallel(Integer requested) {
        int p = requested == null ? props.getMaxParallel() : requested;
        return Math.max(1, Math.min(p, props.getMaxParallelCap()));
    }

    public <T> List<ItemOutcome> run(List<T> items, Function<T, String> idOf, Integer maxParallel,
                                     CancellationToken token, Consumer<T> work) {
        if (items.isEmpty()) return List.of();
        CancellationToken t = token == null ? CancellationToken.none() : token;
        int threads = Math.min(clampParallel(maxParallel), items.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>(items.size());
            for (T item : items) {
                futures.add(CompletableFuture.supplyAsync(() -> runOne(item, idOf.apply(item), t, work), pool));
            }
            List<ItemOutcome> outcomes = new ArrayList<>(items.size());
            for (CompletableFuture<ItemOutcome> future : futures) {
                outcomes.add(future.join());
            }
            BatchStats stats = BatchStats.of(outcomes);
            log.info("批处理完成(job={})：共 {} 条，成功 {}，失败 {}，取消 {}",
                    t.getJobId(), stats.getTotal(), stats.getSucceeded(), stats.getFailed(), stats.getCancelled());
            return outcomes;
        } finally {
            pool.shutdown();
        }
    }

    private static <T> ItemOutcome runOne(T item, String id, CancellationToken token, Consumer<T> work) {
        if (token.isCancelled()) return ItemOutcome.cancelled(id);
        try {
            work.accept(item);
            return ItemOutcome.succeeded(id);
        } catch (GraphException e) {
            log.warn("子任务 {} 失败[{}]: {}", id, e.getCode(), e.getMessage());
            return ItemOutcome.failed(id, e.getCode().name(), e.getMessage(), e.isRetryable());
        } catch (RuntimeException e) {
            log.error("子任务 {} 出现未预期的异常", id, e);
            return ItemOutcome.failed(id, "INTERNAL_ERROR", e.getMessage(), true);
        }
    }
}
