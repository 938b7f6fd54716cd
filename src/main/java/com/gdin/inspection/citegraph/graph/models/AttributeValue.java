package com.gdin.inspection.citegraph.graph.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 节点属性值：字符串 / 数值 / 布尔 / 字符串列表 四选一。
 * 任意抽取器都可以写入任意 key，但读取方通过类型化访问器拿值，不直接接触 Object。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AttributeValue {

    public enum Kind {
        STRING, NUMBER, BOOLEAN, STRING_LIST
    }

    private final Kind kind;

    @Getter(lombok.AccessLevel.NONE)
    private final Object value;

    private AttributeValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static AttributeValue of(String value) {
        if (value == null) throw new IllegalArgumentException("属性值不能为空");
        return new AttributeValue(Kind.STRING, value);
    }

    public static AttributeValue of(Number value) {
        if (value == null) throw new IllegalArgumentException("属性值不能为空");
        return new AttributeValue(Kind.NUMBER, value);
    }

    public static AttributeValue of(boolean value) {
        return new AttributeValue(Kind.BOOLEAN, value);
    }

    public static AttributeValue of(Collection<String> values) {
        if (values == null) throw new IllegalArgumentException("属性值不能为空");
        return new AttributeValue(Kind.STRING_LIST, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    /**
     * 从 JSON 原始值还原，嵌套对象不支持。
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AttributeValue from(Object raw) {
        if (raw instanceof AttributeValue av) return av;
        if (raw instanceof String s) return of(s);
        if (raw instanceof Number n) return of(n);
        if (raw instanceof Boolean b) return of(b.booleanValue());
        if (raw instanceof Collection<?> c) {
            List<String> items = new ArrayList<>(c.size());
            for (Object o : c) {
                if (o != null) items.add(String.valueOf(o));
            }
            return of(items);
        }
        throw new IllegalArgumentException("不支持的属性值类型: " + (raw == null ? "null" : raw.getClass().getSimpleName()));
    }

    @JsonValue
    public Object raw() {
        return value;
    }

    /**
     * 字符串视图：列表用逗号拼接，数值整数不带小数点。
     */
    public String asString() {
        switch (kind) {
            case STRING_LIST:
                return String.join(", ", asStringList());
            case NUMBER:
                Number n = (Number) value;
                double d = n.doubleValue();
                if (d == Math.rint(d) && !Double.isInfinite(d)) return String.valueOf((long) d);
                return String.valueOf(d);
            default:
                return String.valueOf(value);
        }
    }

    public Optional<Double> asNumber() {
        if (kind == Kind.NUMBER) return Optional.of(((Number) value).doubleValue());
        if (kind == Kind.STRING) {
            try {
                return Optional.of(Double.parseDouble(((String) value).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Boolean> asBoolean() {
        if (kind == Kind.BOOLEAN) return Optional.of((Boolean) value);
        if (kind == Kind.STRING) {
            String s = ((String) value).trim();
            if ("true".equalsIgnoreCase(s)) return Optional.of(Boolean.TRUE);
            if ("false".equalsIgnoreCase(s)) return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public List<String> asStringList() {
        if (kind == Kind.STRING_LIST) return (List<String>) value;
        return List.of(asString());
    }
}
