package com.gdin.inspection.citegraph.req;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@Schema(description = "属性抽取请求")
public class ExtractReq {
    @NotBlank(message = "graphId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "图 id")
    private String graphId;

    @NotEmpty(message = "抽取器不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "抽取器名称", example = "[\"keywords\"]")
    private List<String> extractors;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "已运行过也重新抽取", example = "false")
    private Boolean force = false;

    @Min(value = 1, message = "maxParallel 至少为 1")
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "最大并发")
    private Integer maxParallel;

    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "任务 id，用于取消")
    private String jobId;
}
