package com.gdin.inspection.citegraph.req;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@Schema(description = "影响路径请求")
public class PathReq {
    @NotBlank(message = "graphId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "图 id")
    private String graphId;

    @NotBlank(message = "sourceId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "起点论文 id")
    private String sourceId;

    @NotBlank(message = "targetId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "终点论文 id")
    private String targetId;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "shortest / strongest", example = "shortest")
    private String ranking;
}
