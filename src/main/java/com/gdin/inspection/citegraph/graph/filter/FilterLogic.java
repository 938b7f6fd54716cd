package com.gdin.inspection.citegraph.graph.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gdin.inspection.citegraph.exception.InvalidFilterException;

public enum FilterLogic {
    AND, OR;

    @JsonCreator
    public static FilterLogic fromValue(String value) {
        if (value == null) return AND;
        for (FilterLogic l : values()) {
            if (l.name().equalsIgnoreCase(value.trim())) return l;
        }
        throw new InvalidFilterException("不支持的条件组合方式: " + value);
    }
}
