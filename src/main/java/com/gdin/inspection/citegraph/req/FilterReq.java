package com.gdin.inspection.citegraph.req;

import com.gdin.inspection.citegraph.graph.filter.FilterCondition;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@Schema(description = "过滤请求")
public class FilterReq {
    @NotBlank(message = "graphId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "图 id")
    private String graphId;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "过滤条件，为空时保留全部节点")
    private List<FilterCondition> conditions = new ArrayList<>();

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "条件组合方式 AND / OR", example = "AND")
    private String logic = "AND";
}
