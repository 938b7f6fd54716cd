package com.gdin.inspection.citegraph.graph.path;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gdin.inspection.citegraph.exception.InvalidRequestException;

/**
 * SHORTEST：按跳数的无权最短路；STRONGEST：以 (1 - strength) 为代价的加权最短路。
 */
public enum PathRanking {
    SHORTEST("shortest"),
    STRONGEST("strongest");

    private final String value;

    PathRanking(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PathRanking fromValue(String value) {
        if (value == null) return SHORTEST;
        for (PathRanking r : values()) {
            if (r.value.equalsIgnoreCase(value)) return r;
        }
        throw new InvalidRequestException("未知的路径排序方式: " + value);
    }
}
