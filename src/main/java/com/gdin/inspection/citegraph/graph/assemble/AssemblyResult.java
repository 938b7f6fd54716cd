package com.gdin.inspection.citegraph.graph.assemble;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import lombok.Value;

@Value
public class AssemblyResult {

    @JsonProperty("graph")
    ResearchGraph graph;

    @JsonProperty("stats")
    AssemblyStats stats;

    @JsonProperty("graph_id")
    public String getGraphId() {
        return graph.getId();
    }
}
