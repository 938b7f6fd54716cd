package com.gdin.inspection.citegraph.req;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@Schema(description = "两篇论文比较请求")
public class CompareReq {
    @NotBlank(message = "graphId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "图 id")
    private String graphId;

    @NotBlank(message = "paperAId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "论文 A 的节点 id")
    private String paperAId;

    @NotBlank(message = "paperBId 不能为空")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "论文 B 的节点 id")
    private String paperBId;
}
