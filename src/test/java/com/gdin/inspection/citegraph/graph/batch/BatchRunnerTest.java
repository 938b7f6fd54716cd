package com.gdin.inspection.citegraph.graph.batch;

import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.exception.ExtractionFailedException;
import com.gdin.inspection.citegraph.exception.NodeNotFoundException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

public class BatchRunnerTest {

    private final BatchRunner runner = new BatchRunner(new GraphProperties.Compare());

    @Test
    public void testFailuresAreIsolatedAndOrderIsKept() {
        Set<String> done = ConcurrentHashMap.newKeySet();
        List<ItemOutcome> outcomes = runner.run(List.of("e1", "e2", "e3", "e4"), Function.identity(), 3, null, id -> {
            if (id.equals("e2")) throw new ExtractionFailedException("timeout");
            if (id.equals("e3")) throw new NodeNotFoundException("g", List.of("X"));
            if (id.equals("e4")) throw new IllegalStateException("bug");
            done.add(id);
        });

        Assertions.assertEquals(List.of("e1", "e2", "e3", "e4"), outcomes.stream().map(ItemOutcome::getItemId).toList());
        Assertions.assertEquals(ItemStatus.SUCCEEDED, outcomes.get(0).getStatus());
        Assertions.assertEquals("EXTRACTION_FAILED", outcomes.get(1).getErrorCode());
        Assertions.assertTrue(outcomes.get(1).isRetryable());
        Assertions.assertEquals("NODE_NOT_FOUND", outcomes.get(2).getErrorCode());
        Assertions.assertFalse(outcomes.get(2).isRetryable());
        Assertions.assertEquals("INTERNAL_ERROR", outcomes.get(3).getErrorCode());
        Assertions.assertEquals(Set.of("e1"), done);

        BatchStats stats = BatchStats.of(outcomes);
        Assertions.assertEquals(4, stats.getTotal());
        Assertions.assertEquals(1, stats.getSucceeded());
        Assertions.assertEquals(3, stats.getFailed());
    }

    @Test
    public void testCancelledBeforeStartRunsNothing() {
        CancellationToken token = new CancellationToken("job-1");
        token.cancel();
        Set<String> done = ConcurrentHashMap.newKeySet();
        List<ItemOutcome> outcomes = runner.run(List.of("a", "b"), Function.identity(), 1, token, done::add);
        Assertions.assertTrue(done.isEmpty());
        for (ItemOutcome o : outcomes) {
            Assertions.assertEquals(ItemStatus.CANCELLED, o.getStatus());
            Assertions.assertEquals("CANCELLED", o.getErrorCode());
            Assertions.assertTrue(o.isRetryable());
        }
    }

    @Test
    public void testCancelMidwayKeepsCompletedWork() {
        CancellationToken token = new CancellationToken("job-2");
        Set<String> done = ConcurrentHashMap.newKeySet();
        // 单线程顺序执行，第二条完成后取消
        List<ItemOutcome> outcomes = runner.run(List.of("a", "b", "c", "d"), Function.identity(), 1, token, id -> {
            done.add(id);
            if (id.equals("b")) token.cancel();
        });
        Assertions.assertEquals(Set.of("a", "b"), done);
        Assertions.assertEquals(List.of(ItemStatus.SUCCEEDED, ItemStatus.SUCCEEDED, ItemStatus.CANCELLED, ItemStatus.CANCELLED),
                outcomes.stream().map(ItemOutcome::getStatus).toList());
    }

    @Test
    public void testClampParallel() {
        Assertions.assertEquals(5, runner.clampParallel(null));
        Assertions.assertEquals(1, runner.clampParallel(0));
        Assertions.assertEquals(1, runner.clampParallel(-3));
        Assertions.assertEquals(16, runner.clampParallel(100));
        Assertions.assertTrue(runner.run(List.<String>of(), Function.identity(), 2, null, s -> { }).isEmpty());
    }
}
