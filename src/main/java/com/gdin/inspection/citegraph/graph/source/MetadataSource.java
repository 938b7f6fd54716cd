package com.gdin.inspection.citegraph.graph.source;

import com.gdin.inspection.citegraph.exception.SourceUnavailableException;
import com.gdin.inspection.citegraph.graph.models.PaperRecord;

import java.util.List;
import java.util.Optional;

/**
 * 论文元数据源。三个操作都是幂等的，不修改调用方的任何状态。
 * 找不到论文不算错误：resolve 返回 empty，references / citers 返回空列表。
 */
public interface MetadataSource {

    /**
     * 按标识符（S2 paperId、DOI、arXiv id、CorpusId 或标题）查找论文。
     *
     * @throws SourceUnavailableException 重试耗尽后仍不可用
     */
    Optional<PaperRecord> resolve(String identifier);

    /**
     * 该论文引用的论文。
     */
    List<PaperRecord> references(String identifier);

    /**
     * 引用了该论文的论文。
     */
    List<PaperRecord> citers(String identifier);
}
