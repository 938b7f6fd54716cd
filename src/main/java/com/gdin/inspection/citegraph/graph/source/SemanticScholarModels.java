package com.gdin.inspection.citegraph.graph.source;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Semantic Scholar Graph API v1 的响应结构，只保留用到的字段。
 */
final class SemanticScholarModels {

    private SemanticScholarModels() {
    }

    @Data
    static class Paper {
        @JsonProperty("paperId")
        private String paperId;
        @JsonProperty("externalIds")
        private Map<String, Object> externalIds;
        @JsonProperty("title")
        private String title;
        @JsonProperty("authors")
        private List<Author> authors;
        @JsonProperty("year")
        private Integer year;
        @JsonProperty("publicationDate")
        private String publicationDate;
        @JsonProperty("venue")
        private String venue;
        @JsonProperty("abstract")
        private String abstractText;
        @JsonProperty("citationCount")
        private Integer citationCount;
        @JsonProperty("url")
        private String url;
    }

    @Data
    static class Author {
        @JsonProperty("authorId")
        private String authorId;
        @JsonProperty("name")
        private String name;
    }

    @Data
    static class SearchPage {
        @JsonProperty("total")
        private Integer total;
        @JsonProperty("data")
        private List<Paper> data;
    }

    /**
     * references / citations 接口的一页，citedPaper 与 citingPaper 二选一。
     */
    @Data
    static class LinkPage {
        @JsonProperty("offset")
        private Integer offset;
        @JsonProperty("next")
        private Integer next;
        @JsonProperty("data")
        private List<Link> data;
    }

    @Data
    static class Link {
        @JsonProperty("isInfluential")
        private Boolean isInfluential;
        @JsonProperty("contexts")
        private List<String> contexts;
        @JsonProperty("citedPaper")
        private Paper citedPaper;
        @JsonProperty("citingPaper")
        private Paper citingPaper;
    }
}
