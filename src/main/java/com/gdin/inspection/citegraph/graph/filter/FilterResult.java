package com.gdin.inspection.citegraph.graph.filter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import lombok.Value;

@Value
public class FilterResult {

    @JsonProperty("filtered_graph")
    ResearchGraph filteredGraph;

    @JsonProperty("match_count")
    int matchCount;
}
