package com.gdin.inspection.citegraph.req;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@Schema(description = "聚类请求")
public class ClusterReq {
    @NotBlank(message = "graphId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "图 id")
    private String graphId;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "聚类方法 content / citation / hybrid", example = "hybrid")
    private String method = "hybrid";

    @Min(value = 1, message = "nClusters 至少为 1")
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "簇数", example = "5")
    @JsonProperty("nClusters")
    private Integer nClusters = 5;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "hybrid 的内容权重", example = "0.7")
    private Double contentWeight;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "hybrid 的引用权重", example = "0.3")
    private Double citationWeight;
}
