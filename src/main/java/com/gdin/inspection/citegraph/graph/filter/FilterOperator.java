package com.gdin.inspection.citegraph.graph.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gdin.inspection.citegraph.exception.InvalidFilterException;

import java.util.List;

public enum FilterOperator {
    EQ("==", "eq", "="),
    NE("!=", "ne"),
    GT(">", "gt"),
    GE(">=", "ge", "gte"),
    LT("<", "lt"),
    LE("<=", "le", "lte"),
    CONTAINS("contains");

    private final String symbol;
    private final List<String> aliases;

    FilterOperator(String symbol, String... aliases) {
        this.symbol = symbol;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this == GT || this == GE || this == LT || this == LE;
    }

    @JsonCreator
    public static FilterOperator fromValue(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase();
            for (FilterOperator op : values()) {
                if (op.symbol.equals(v) || op.aliases.contains(v)) return op;
            }
        }
        throw new InvalidFilterException("不支持的过滤运算符: " + value);
    }
}
