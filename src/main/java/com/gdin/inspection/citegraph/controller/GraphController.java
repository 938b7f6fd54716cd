package com.gdin.inspection.citegraph.controller;

import com.gdin.inspection.citegraph.graph.assemble.AssemblyResult;
import com.gdin.inspection.citegraph.graph.batch.BatchReport;
import com.gdin.inspection.citegraph.graph.cluster.ClusterMethod;
import com.gdin.inspection.citegraph.graph.cluster.ClusterResult;
import com.gdin.inspection.citegraph.graph.compare.Comparison;
import com.gdin.inspection.citegraph.graph.filter.FilterLogic;
import com.gdin.inspection.citegraph.graph.filter.FilterResult;
import com.gdin.inspection.citegraph.graph.models.CitationEdge;
import com.gdin.inspection.citegraph.graph.models.GraphSummary;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import com.gdin.inspection.citegraph.graph.path.PathRanking;
import com.gdin.inspection.citegraph.graph.path.PathResult;
import com.gdin.inspection.citegraph.req.BuildGraphReq;
import com.gdin.inspection.citegraph.req.ClusterReq;
import com.gdin.inspection.citegraph.req.CompareReq;
import com.gdin.inspection.citegraph.req.EdgeBatchReq;
import com.gdin.inspection.citegraph.req.ExtractReq;
import com.gdin.inspection.citegraph.req.FilterReq;
import com.gdin.inspection.citegraph.req.PathReq;
import com.gdin.inspection.citegraph.resp.ResultData;
import com.gdin.inspection.citegraph.service.CitationGraphService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 引用网络接口
 */
@Slf4j
@Tag(name = "引用网络", description = "组网、聚类、过滤、影响路径与论文比较")
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class GraphController {

    private final CitationGraphService citationGraphService;

    @Operation(summary = "组建引用网络", description = "解析种子论文，按需发现连接种子的中间论文，结果保存并返回图 id")
    @PostMapping("/graph/build")
    public ResultData<AssemblyResult> build(@Valid @RequestBody BuildGraphReq req) {
        return ResultData.success(citationGraphService.build(req.getSeedIdentifiers(),
                !Boolean.FALSE.equals(req.getIncludeIntermediate()), req.getMaxDepth(), req.getMaxIntermediate(), req.getName()));
    }

    @Operation(summary = "聚类", description = "content / citation / hybrid 三种方法，cluster_id 写回节点属性")
    @PostMapping("/graph/cluster")
    public ResultData<ClusterResult> cluster(@Valid @RequestBody ClusterReq req) {
        return ResultData.success(citationGraphService.cluster(req.getGraphId(), ClusterMethod.fromValue(req.getMethod()),
                req.getNClusters(), req.getContentWeight(), req.getCitationWeight()));
    }

    @Operation(summary = "查看最近一次聚类结果")
    @GetMapping("/graph/{graphId}/clusters")
    public ResultData<ClusterResult> clusters(@Parameter(description = "图 id") @PathVariable String graphId) {
        return ResultData.success(citationGraphService.clusters(graphId));
    }

    @Operation(summary = "按属性过滤", description = "返回新的子图，不保存")
    @PostMapping("/graph/filter")
    public ResultData<FilterResult> filter(@Valid @RequestBody FilterReq req) {
        return ResultData.success(citationGraphService.filter(req.getGraphId(), req.getConditions(), FilterLogic.fromValue(req.getLogic())));
    }

    @Operation(summary = "影响路径", description = "沿引用方向查找两篇论文之间的路径")
    @PostMapping("/graph/path")
    public ResultData<PathResult> path(@Valid @RequestBody PathReq req) {
        return ResultData.success(citationGraphService.path(req.getGraphId(), req.getSourceId(), req.getTargetId(),
                PathRanking.fromValue(req.getRanking())));
    }

    @Operation(summary = "比较两篇论文")
    @PostMapping("/graph/compare")
    public ResultData<Comparison> compare(@Valid @RequestBody CompareReq req) {
        return ResultData.success(citationGraphService.compare(req.getGraphId(), req.getPaperAId(), req.getPaperBId()));
    }

    @Operation(summary = "逐边比较", description = "比较每条边的引用方与被引方并写回边，单条失败不影响其它边")
    @PostMapping("/graph/compare-edges")
    public ResultData<BatchReport> compareEdges(@Valid @RequestBody EdgeBatchReq req) {
        return ResultData.success(citationGraphService.compareEdges(req.getGraphId(), req.getMaxParallel(), req.getJobId()));
    }

    @Operation(summary = "单条边重试比较")
    @PostMapping("/graph/{graphId}/edges/{edgeId}/compare")
    public ResultData<CitationEdge> compareSingleEdge(@Parameter(description = "图 id") @PathVariable String graphId,
                                                      @Parameter(description = "边 id") @PathVariable String edgeId) {
        return ResultData.success(citationGraphService.compareSingleEdge(graphId, edgeId));
    }

    @Operation(summary = "抽取边上的创新点", description = "short_label 写入 context，full_insight 写入 delta_description")
    @PostMapping("/graph/innovations")
    public ResultData<BatchReport> innovations(@Valid @RequestBody EdgeBatchReq req) {
        return ResultData.success(citationGraphService.extractEdgeInnovations(req.getGraphId(), req.getMaxParallel(), req.getJobId()));
    }

    @Operation(summary = "运行属性抽取器")
    @PostMapping("/graph/extract")
    public ResultData<BatchReport> extract(@Valid @RequestBody ExtractReq req) {
        return ResultData.success(citationGraphService.extract(req.getGraphId(), req.getExtractors(), req.getMaxParallel(),
                Boolean.TRUE.equals(req.getForce()), req.getJobId()));
    }

    @Operation(summary = "获取图")
    @GetMapping("/graph/{graphId}")
    public ResultData<ResearchGraph> get(@Parameter(description = "图 id") @PathVariable String graphId) {
        return ResultData.success(citationGraphService.get(graphId));
    }

    @Operation(summary = "列出所有图")
    @GetMapping("/graphs")
    public ResultData<List<GraphSummary>> list() {
        return ResultData.success(citationGraphService.list());
    }

    @Operation(summary = "删除图")
    @DeleteMapping("/graph/{graphId}")
    public ResultData<Void> delete(@Parameter(description = "图 id") @PathVariable String graphId) {
        citationGraphService.delete(graphId);
        return ResultData.success();
    }

    @Operation(summary = "取消批处理任务", description = "已完成的写回保留，尚未开始的条目标记为取消")
    @DeleteMapping("/graph/jobs/{jobId}")
    public ResultData<Boolean> cancel(@Parameter(description = "任务 id") @PathVariable String jobId) {
        return ResultData.success(citationGraphService.cancel(jobId));
    }
}
