package com.gdin.inspection.citegraph.graph.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class BatchStats {

    @JsonProperty("total")
    int total;

    @JsonProperty("succeeded")
    int succeeded;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("cancelled")
    int cancelled;

    public static BatchStats of(List<ItemOutcome> outcomes) {
        int ok = 0, failed = 0, cancelled = 0;
        for (ItemOutcome o : outcomes) {
            switch (o.getStatus()) {
                case SUCCEEDED -> ok++;
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
            }
        }
        return new BatchStats(outcomes.size(), ok, failed, cancelled);
    }
}
