package com.gdin.inspection.citegraph.graph.compare;

import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.inspection.citegraph.config.properties.GraphProperties;
import com.gdin.inspection.citegraph.exception.ExtractionFailedException;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.prompts.EdgeInnovationPromptsZh;
import com.gdin.inspection.citegraph.util.LlmResponseUtil;
import com.gdin.inspection.citegraph.util.TokenUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * 抽取引用方从被引方那里采用了什么。
 */
@Slf4j
@Component
public class EdgeInnovationExtractor {

    static final int MAX_LABEL_WORDS = 10;
    static final String FALLBACK_LABEL = "citation";
    static final String FALLBACK_INSIGHT = "Insufficient abstract data to determine the specific contribution.";

    @Resource
    private TokenUtil tokenUtil;

    @Resource
    private GraphProperties graphProperties;

    /**
     * @param citing 引用方（边的 from）
     * @param cited  被引方（边的 to）
     */
    public EdgeInnovation extract(PaperNode citing, PaperNode cited, TextUnderstandingService collaborator) {
        if (StrUtil.isBlank(citing.getAbstractText()) && StrUtil.isBlank(cited.getAbstractText())) {
            return new EdgeInnovation(FALLBACK_LABEL, FALLBACK_INSIGHT);
        }
        if (collaborator == null) throw new ExtractionFailedException("文本理解服务未启用");

        String prompt = EdgeInnovationPromptsZh.INNOVATION_PROMPT
                .replace("{title_a}", StrUtil.nullToEmpty(citing.getTitle()))
                .replace("{abstract_a}", abstractOf(citing))
                .replace("{title_b}", StrUtil.nullToEmpty(cited.getTitle()))
                .replace("{abstract_b}", abstractOf(cited));
        String answer = collaborator.complete(EdgeInnovationPromptsZh.SYSTEM_PROMPT, prompt);

        JSONObject json;
        try {
            json = LlmResponseUtil.getJSONResponse(answer);
        } catch (JSONException e) {
            throw new ExtractionFailedException("创新点结果不是合法 JSON: " + citing.getId() + " -> " + cited.getId(), e);
        }
        String label = shortenLabel(StrUtil.blankToDefault(json.getString("short_label"), FALLBACK_LABEL));
        return new EdgeInnovation(label, StrUtil.nullToEmpty(json.getString("full_insight")).trim());
    }

    static String shortenLabel(String label) {
        String[] words = label.trim().split("\\s+");
        if (words.length <= MAX_LABEL_WORDS) return label.trim();
        return String.join(" ", Arrays.copyOf(words, MAX_LABEL_WORDS)) + "...";
    }

    private String abstractOf(PaperNode paper) {
        if (StrUtil.isBlank(paper.getAbstractText())) return EdgeInnovationPromptsZh.MISSING_ABSTRACT;
        return tokenUtil.truncate(paper.getAbstractText(), graphProperties.getCompare().getMaxPaperTokens());
    }
}
