package com.gdin.inspection.citegraph.graph.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 论文来源：用户给定的种子论文，或者组网时发现的中间论文。
 */
public enum PaperSource {
    INPUT("input"),
    INTERMEDIATE("intermediate");

    private final String value;

    PaperSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PaperSource fromValue(String value) {
        for (PaperSource s : values()) {
            if (s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("未知的论文来源: " + value);
    }
}
