package com.gdin.inspection.citegraph.graph.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 引用边：fromPaper 引用了 toPaper。
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CitationEdge {

    public static final String TYPE_REFERENCE = "reference";

    @JsonProperty("id")
    String id;

    @JsonProperty("from_paper")
    String fromPaper;

    @JsonProperty("to_paper")
    String toPaper;

    @Builder.Default
    @JsonProperty("contribution_type")
    String contributionType = TYPE_REFERENCE;

    @Builder.Default
    @JsonProperty("strength")
    double strength = 1.0;

    @JsonProperty("context")
    String context;

    @JsonProperty("delta_description")
    String deltaDescription;

    public String pairKey() {
        return fromPaper + "->" + toPaper;
    }
}
