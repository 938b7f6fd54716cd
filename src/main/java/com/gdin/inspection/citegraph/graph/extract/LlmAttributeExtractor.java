package com.gdin.inspection.citegraph.graph.extract;

import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.inspection.citegraph.exception.ExtractionFailedException;
import com.gdin.inspection.citegraph.graph.compare.TextUnderstandingService;
import com.gdin.inspection.citegraph.graph.models.AttributeValue;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import com.gdin.inspection.citegraph.util.LlmResponseUtil;
import com.gdin.inspection.citegraph.util.TokenUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 用文本理解服务按提示词抽取结构化属性，回答里 JSON 的每个顶层字段都成为一个属性。
 */
@Slf4j
public class LlmAttributeExtractor implements Extractor {

    private final String name;
    private final String systemPrompt;
    private final String promptTemplate;
    private final TextUnderstandingService collaborator;
    private final TokenUtil tokenUtil;
    private final int maxPaperTokens;

    public LlmAttributeExtractor(String name, String systemPrompt, String promptTemplate,
                                 TextUnderstandingService collaborator, TokenUtil tokenUtil, int maxPaperTokens) {
        this.name = name;
        this.systemPrompt = systemPrompt;
        this.promptTemplate = promptTemplate;
        this.collaborator = collaborator;
        this.tokenUtil = tokenUtil;
        this.maxPaperTokens = maxPaperTokens;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Map<String, AttributeValue> extract(PaperNode paper, ResearchGraph graph) {
        String text = StrUtil.isNotBlank(paper.getFullText()) ? paper.getFullText() : paper.getAbstractText();
        if (StrUtil.isBlank(text)) {
            throw new ExtractionFailedException("论文没有摘要或全文，无法抽取 " + name + ": " + paper.getId());
        }
        String prompt = promptTemplate
                .replace("{title}", StrUtil.nullToEmpty(paper.getTitle()))
                .replace("{text}", tokenUtil.truncate(text, maxPaperTokens));
        String answer = collaborator.complete(systemPrompt, prompt);

        JSONObject json;
        try {
            json = LlmResponseUtil.getJSONResponse(answer);
        } catch (JSONException e) {
            throw new ExtractionFailedException(name + " 抽取结果不是合法 JSON: " + paper.getId(), e);
        }
        Map<String, AttributeValue> attrs = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : json.entrySet()) {
            AttributeValue v = toAttribute(e.getValue());
            if (v != null) attrs.put(e.getKey(), v);
        }
        log.debug("{} 抽取 {}：{} 个属性", name, paper.getId(), attrs.size());
        return attrs;
    }

    static AttributeValue toAttribute(Object raw) {
        if (raw == null) return null;
        if (raw instanceof String s) return StrUtil.isBlank(s) ? null : AttributeValue.of(s.trim());
        if (raw instanceof Number n) return AttributeValue.of(n);
        if (raw instanceof Boolean b) return AttributeValue.of(b.booleanValue());
        if (raw instanceof Collection<?> c) {
            List<String> items = new ArrayList<>(c.size());
            for (Object o : c) {
                if (o == null) continue;
                items.add(o instanceof String s ? s : JSON.toJSONString(o));
            }
            return AttributeValue.of(items);
        }
        // 嵌套对象按 JSON 字符串保存
        return AttributeValue.of(JSON.toJSONString(raw));
    }
}
