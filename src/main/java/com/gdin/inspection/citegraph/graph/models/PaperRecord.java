package com.gdin.inspection.citegraph.graph.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * 外部元数据源（或 PDF 抽取服务）给出的论文记录，字段都可能缺失。
 * influential / citationContext 只在引用列表里出现，描述的是这条引用本身。
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaperRecord {

    @JsonProperty("paper_id")
    String paperId;

    @JsonProperty("title")
    String title;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("authors")
    List<String> authors;

    @JsonProperty("year")
    Integer year;

    @JsonProperty("publication_date")
    LocalDate publicationDate;

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

    @JsonProperty("influential")
    Boolean influential;

    @JsonProperty("citation_context")
    String citationContext;

    public PaperNode toNode(String nodeId, PaperSource source) {
        return PaperNode.builder()
                .id(nodeId)
                .title(title)
                .authors(authors)
                .year(year)
                .publicationDate(publicationDate)
                .venue(venue)
                .doi(doi)
                .arxivId(arxivId)
                .url(url)
                .abstractText(abstractText)
                .fullText(fullText)
                .citationCount(citationCount == null ? 0 : citationCount)
                .paperSource(source)
                .build();
    }
}
