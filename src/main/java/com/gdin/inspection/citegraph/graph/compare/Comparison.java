package com.gdin.inspection.citegraph.graph.compare;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 两篇论文的比较结果，不落图，除非显式写回边。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Comparison {

    @JsonProperty("paper_a_id")
    String paperAId;

    @JsonProperty("paper_b_id")
    String paperBId;

    @JsonProperty("paper_a_title")
    String paperATitle;

    @JsonProperty("paper_b_title")
    String paperBTitle;

    @JsonProperty("relationship_type")
    RelationshipType relationshipType;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("similarities")
    List<String> similarities;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("differences")
    List<String> differences;

    @JsonProperty("architecture_diff")
    String architectureDiff;

    @JsonProperty("contribution_diff")
    String contributionDiff;

    @JsonProperty("method_diff")
    String methodDiff;
}
