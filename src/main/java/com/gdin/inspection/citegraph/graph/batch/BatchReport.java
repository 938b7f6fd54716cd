package com.gdin.inspection.citegraph.graph.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import lombok.Value;

import java.util.List;

/**
 * 批处理结果：写回后的图、汇总统计、逐条结果（与输入顺序一致）。
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchReport {

    @JsonProperty("job_id")
    String jobId;

    @JsonProperty("graph")
    ResearchGraph graph;

    @JsonProperty("stats")
    BatchStats stats;

    @JsonProperty("items")
    List<ItemOutcome> items;
}
