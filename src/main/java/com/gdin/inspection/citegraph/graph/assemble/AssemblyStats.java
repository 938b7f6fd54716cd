package com.gdin.inspection.citegraph.graph.assemble;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssemblyStats {

    @JsonProperty("total_papers")
    int totalPapers;

    @JsonProperty("input_papers")
    int inputPapers;

    @JsonProperty("intermediate_papers")
    int intermediatePapers;

    @JsonProperty("total_edges")
    int totalEdges;

    @JsonProperty("candidates_considered")
    int candidatesConsidered;

    @JsonProperty("unresolved_seeds")
    int unresolvedSeeds;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("unresolved_seed_ids")
    List<String> unresolvedSeedIds;

    @JsonProperty("duplicate_seeds")
    int duplicateSeeds;

    @JsonProperty("duplicate_edges_merged")
    int duplicateEdgesMerged;

    @JsonProperty("failed_fetches")
    int failedFetches;

    @JsonProperty("date_range")
    Map<String, Integer> dateRange;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("warnings")
    List<String> warnings;

    /**
     * 写进图 metadata 的统计项。
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total_papers", totalPapers);
        m.put("input_papers", inputPapers);
        m.put("intermediate_papers", intermediatePapers);
        m.put("total_citations", totalEdges);
        m.put("unresolved_seeds", unresolvedSeeds);
        m.put("duplicate_edges_merged", duplicateEdgesMerged);
        if (dateRange != null) m.put("date_range", dateRange);
        return m;
    }
}
