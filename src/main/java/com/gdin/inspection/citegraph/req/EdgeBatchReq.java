package com.gdin.inspection.citegraph.req;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@Schema(description = "逐边批处理请求")
public class EdgeBatchReq {
    @NotBlank(message = "graphId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "图 id")
    private String graphId;

    @Min(value = 1, message = "maxParallel 至少为 1")
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "最大并发，不填用配置值", example = "5")
    private Integer maxParallel;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "任务 id，用于取消，不填自动生成")
    private String jobId;
}
