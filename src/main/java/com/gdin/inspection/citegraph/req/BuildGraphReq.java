package com.gdin.inspection.citegraph.req;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@Schema(description = "组建引用网络请求")
public class BuildGraphReq {
    @NotEmpty(message = "种子论文不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "种子论文标识：S2 id、DOI、arXiv id 或标题",
            example = "[\"arXiv:1706.03762\", \"10.18653/v1/N19-1423\"]")
    private List<String> seedIdentifiers;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "是否发现中间论文", example = "true")
    private Boolean includeIntermediate = true;

    @Min(value = 1, message = "maxDepth 至少为 1")
    @Max(value = 2, message = "maxDepth 最大为 2")
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "扩展深度", example = "1")
    private Integer maxDepth = 1;

    @Min(value = 0, message = "maxIntermediate 不能为负数")
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "中间论文上限，不填用配置值", example = "50")
    private Integer maxIntermediate;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "图名称", example = "Transformer lineage")
    private String name;
}
