package com.gdin.inspection.citegraph.graph.cluster;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gdin.inspection.citegraph.exception.InvalidRequestException;

public enum ClusterMethod {
    CONTENT("content"),
    CITATION("citation"),
    HYBRID("hybrid");

    private final String value;

    ClusterMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ClusterMethod fromValue(String value) {
        for (ClusterMethod m : values()) {
            if (m.value.equalsIgnoreCase(value)) return m;
        }
        throw new InvalidRequestException("未知的聚类方法: " + value + "，可选 content / citation / hybrid");
    }
}
