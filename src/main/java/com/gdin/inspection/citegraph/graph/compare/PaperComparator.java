package com.gdin.inspection.citegraph.graph.compare;

import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.exception.ExtractionFailedException;
import com.gdin.inspection.citegraph.graph.cluster.TfidfVectorizer;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.prompts.PaperComparePromptsZh;
import com.gdin.inspection.citegraph.util.LlmResponseUtil;
import com.gdin.inspection.citegraph.util.TokenUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 两篇论文的比较。没有任何共同内容词的两篇直接判为 unrelated，不调用文本理解服务。
 */
@Slf4j
@Component
public class PaperComparator {

    static final int MAX_AUTHORS = 5;

    @Resource
    private TokenUtil tokenUtil;

    @Resource
    private GraphProperties graphProperties;

    public Comparison compare(PaperNode paperA, PaperNode paperB, TextUnderstandingService collaborator) {
        if (!shareContentTerm(paperA, paperB)) {
            log.info("论文 {} 与 {} 没有共同内容词，直接判为 unrelated", paperA.getId(), paperB.getId());
            return base(paperA, paperB).relationshipType(RelationshipType.UNRELATED).build();
        }
        if (collaborator == null) throw new ExtractionFailedException("文本理解服务未启用");

        String prompt = PaperComparePromptsZh.COMPARE_PROMPT
                .replace("{title_a}", StrUtil.nullToEmpty(paperA.getTitle()))
                .replace("{authors_a}", authors(paperA))
                .replace("{text_a}", paperText(paperA))
                .replace("{title_b}", StrUtil.nullToEmpty(paperB.getTitle()))
                .replace("{authors_b}", authors(paperB))
                .replace("{text_b}", paperText(paperB));

        String answer = collaborator.complete(PaperComparePromptsZh.SYSTEM_PROMPT, prompt);
        JSONObject json;
        try {
            json = LlmResponseUtil.getJSONResponse(answer);
        } catch (JSONException e) {
            throw new ExtractionFailedException("比较结果不是合法 JSON: " + paperA.getId() + " vs " + paperB.getId(), e);
        }

        Comparison comparison = base(paperA, paperB)
                .relationshipType(RelationshipType.normalize(json.getString("relationship_type")))
                .similarities(stringList(json.get("similarities")))
                .differences(stringList(json.get("differences")))
                .architectureDiff(StrUtil.emptyToNull(json.getString("architecture_diff")))
                .contributionDiff(StrUtil.emptyToNull(json.getString("contribution_diff")))
                .methodDiff(StrUtil.emptyToNull(json.getString("method_diff")))
                .build();
        log.debug("比较完成 {} vs {}: {}", paperA.getId(), paperB.getId(), comparison.getRelationshipType());
        return comparison;
    }

    static boolean shareContentTerm(PaperNode a, PaperNode b) {
        Set<String> termsA = new HashSet<>(TfidfVectorizer.tokenize(a.contentText()));
        for (String t : TfidfVectorizer.tokenize(b.contentText())) {
            if (termsA.contains(t)) return true;
        }
        return false;
    }

    private String paperText(PaperNode paper) {
        String text = StrUtil.isNotBlank(paper.getFullText()) ? paper.getFullText() : paper.getAbstractText();
        if (StrUtil.isBlank(text)) return "(abstract not available)";
        return tokenUtil.truncate(text, graphProperties.getCompare().getMaxPaperTokens());
    }

    private static String authors(PaperNode paper) {
        List<String> authors = paper.getAuthors();
        return String.join(", ", authors.subList(0, Math.min(MAX_AUTHORS, authors.size())));
    }

    private static Comparison.ComparisonBuilder base(PaperNode a, PaperNode b) {
        return Comparison.builder()
                .paperAId(a.getId())
                .paperBId(b.getId())
                .paperATitle(a.getTitle())
                .paperBTitle(b.getTitle());
    }

    /**
     * 模型偶尔把列表写成单个字符串，这里都接受。
     */
    static List<String> stringList(Object raw) {
        List<String> out = new ArrayList<>();
        if (raw instanceof Collection<?> c) {
            for (Object o : c) {
                if (o != null && StrUtil.isNotBlank(String.valueOf(o))) out.add(String.valueOf(o).trim());
            }
        } else if (raw != null && StrUtil.isNotBlank(String.valueOf(raw))) {
            out.add(String.valueOf(raw).trim());
        }
        return out;
    }
}
