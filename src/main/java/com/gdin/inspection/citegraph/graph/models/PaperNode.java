package com.gdin.inspection.citegraph.graph.models;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaperNode {

    @JsonProperty("id")
    String id;

    @JsonProperty("title")
    String title;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("authors")
    List<String> authors;

    @JsonProperty("publication_date")
    LocalDate publicationDate;

    @JsonProperty("year")
    Integer year;

    @JsonProperty("venue")
    String venue;

    @JsonProperty("doi")
    String doi;

    @JsonProperty("arxiv_id")
    String arxivId;

    @JsonProperty("url")
    String url;

    @JsonProperty("abstract")
    String abstractText;

    @JsonProperty("full_text")
    String fullText;

    @JsonProperty("citation_count")
    Integer citationCount;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("attributes")
    Map<String, AttributeValue> attributes;

    @JsonProperty("paper_source")
    PaperSource paperSource;

    public Optional<AttributeValue> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * 合并属性，同名 key 覆盖，来源等身份字段保持不变。
     */
    public PaperNode withAttributes(Map<String, AttributeValue> extra) {
        if (extra == null || extra.isEmpty()) return this;
        Map<String, AttributeValue> merged = new LinkedHashMap<>(attributes);
        merged.putAll(extra);
        return toBuilder().clearAttributes().attributes(merged).build();
    }

    /**
     * 用于向量化和比较的文本：有全文用全文，否则标题加摘要。
     */
    @JsonIgnore
    public String contentText() {
        if (StrUtil.isNotBlank(fullText)) return fullText;
        return StrUtil.blankToDefault(title, "") + " " + StrUtil.blankToDefault(abstractText, "");
    }

    @JsonIgnore
    public Integer effectiveYear() {
        if (year != null) return year;
        return publicationDate == null ? null : publicationDate.getYear();
    }
}
