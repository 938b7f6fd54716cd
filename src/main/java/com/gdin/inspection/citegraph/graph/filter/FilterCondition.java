package com.gdin.inspection.citegraph.graph.filter;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "过滤条件")
public class FilterCondition {

    @JsonProperty("field")
    @Schema(description = "节点字段或属性名", example = "citation_count")
    private String field;

    @JsonProperty("operator")
    @Schema(description = "运算符：== != > >= < <= contains", example = ">=")
    private String operator;

    @JsonProperty("value")
    @Schema(description = "比较值：字符串、数值或布尔", example = "100")
    private Object value;
}
