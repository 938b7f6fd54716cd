package com.gdin.inspection.citegraph.graph.compare;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gdin.inspection.citegraph.exception.ExtractionFailedException;

import java.util.Locale;
import java.util.Map;

public enum RelationshipType {
    EXTENDS("extends"),
    COMPARES("compares"),
    BUILDS_ON("builds_on"),
    SIMILAR("similar"),
    UNRELATED("unrelated");

    // 模型常见的近义说法
    private static final Map<String, RelationshipType> SYNONYMS = Map.ofEntries(
            Map.entry("extension", EXTENDS),
            Map.entry("extend", EXTENDS),
            Map.entry("extended", EXTENDS),
            Map.entry("compare", COMPARES),
            Map.entry("comparison", COMPARES),
            Map.entry("compared", COMPARES),
            Map.entry("build_on", BUILDS_ON),
            Map.entry("builds_upon", BUILDS_ON),
            Map.entry("built_on", BUILDS_ON),
            Map.entry("addresses_similar_problem", SIMILAR),
            Map.entry("similarity", SIMILAR),
            Map.entry("none", UNRELATED),
            Map.entry("no_relation", UNRELATED),
            Map.entry("not_related", UNRELATED)
    );

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 大小写、空格、连字符都归一成下划线再匹配。
     *
     * @throws ExtractionFailedException 不在词表内
     */
    public static RelationshipType normalize(String raw) {
        if (raw == null || raw.isBlank()) throw new ExtractionFailedException("关系类型为空");
        String key = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
        for (RelationshipType t : values()) {
            if (t.value.equals(key)) return t;
        }
        RelationshipType synonym = SYNONYMS.get(key);
        if (synonym != null) return synonym;
        throw new ExtractionFailedException("无法识别的关系类型: " + raw);
    }
}
