package com.gdin.inspection.citegraph.graph.compare;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * 引用边上的创新点：shortLabel 作为边标签，fullInsight 写入 delta_description。
 */
@Value
public class EdgeInnovation {

    @JsonProperty("short_label")
    String shortLabel;

    @JsonProperty("full_insight")
    String fullInsight;
}
