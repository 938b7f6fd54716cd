package com.gdin.inspection.citegraph.graph.filter;

import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.citegraph.exception.InvalidFilterException;
import com.gdin.inspection.citegraph.graph.models.AttributeValue;
import com.gdin.inspection.citegraph.graph.models.CitationEdge;
import com.gdin.inspection.citegraph.graph.models.PaperNode;
import com.gdin.inspection.citegraph.graph.models.ResearchGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 按节点字段 / 属性过滤图。
 * <p>
 * 字段先查顶层字段，再查 attributes；节点缺该字段时条件不成立。
 * 列表值：== / contains 任一元素满足即可，!= 要求没有元素相等。
 * 结果只保留两端都命中的边；重复过滤结果不变。
 */
@Slf4j
@Component
public class FilterEngine {

    static final String FILTERED_SUFFIX = " (filtered)";

    private static final Map<String, Function<PaperNode, Object>> FIELDS = new LinkedHashMap<>();

    static {
        FIELDS.put("id", PaperNode::getId);
        FIELDS.put("title", PaperNode::getTitle);
        FIELDS.put("authors", PaperNode::getAuthors);
        FIELDS.put("venue", PaperNode::getVenue);
        FIELDS.put("abstract", PaperNode::getAbstractText);
        FIELDS.put("full_text", PaperNode::getFullText);
        FIELDS.put("doi", PaperNode::getDoi);
        FIELDS.put("arxiv_id", PaperNode::getArxivId);
        FIELDS.put("url", PaperNode::getUrl);
        FIELDS.put("publication_date", n -> n.getPublicationDate() == null ? null : n.getPublicationDate().toString());
        FIELDS.put("year", PaperNode::effectiveYear);
        FIELDS.put("citation_count", PaperNode::getCitationCount);
        FIELDS.put("paper_source", n -> n.getPaperSource() == null ? null : n.getPaperSource().getValue());
    }

    public FilterResult filter(ResearchGraph graph, List<FilterCondition> conditions, FilterLogic logic) {
        FilterLogic l = logic == null ? FilterLogic.AND : logic;
        List<Compiled> compiled = compile(conditions == null ? List.of() : conditions);

        List<PaperNode> kept = new ArrayList<>();
        Set<String> keptIds = new HashSet<>();
        for (PaperNode node : graph.getNodes()) {
            if (matches(node, compiled, l)) {
                kept.add(node);
                keptIds.add(node.getId());
            }
        }
        List<CitationEdge> edges = new ArrayList<>();
        for (CitationEdge e : graph.getEdges()) {
            if (keptIds.contains(e.getFromPaper()) && keptIds.contains(e.getToPaper())) edges.add(e);
        }

        Map<String, Object> filterInfo = new LinkedHashMap<>();
        filterInfo.put("source_graph_id", graph.getId());
        filterInfo.put("logic", l.name());
        filterInfo.put("conditions", compiled.stream().map(Compiled::describe).toList());
        filterInfo.put("match_count", kept.size());
        Map<String, Object> metadata = new LinkedHashMap<>(graph.getMetadata());
        metadata.put("filter", filterInfo);

        String name = StrUtil.blankToDefault(graph.getName(), ResearchGraph.DEFAULT_NAME);
        ResearchGraph filtered = graph.toBuilder()
                .id(IdUtil.randomUUID())
                .name(name.endsWith(FILTERED_SUFFIX) ? name : name + FILTERED_SUFFIX)
                .clearNodes().nodes(kept)
                .clearEdges().edges(edges)
                .clearMetadata().metadata(metadata)
                .build();
        log.info("过滤图 {}：{} 个条件({})，命中 {}/{} 个节点，保留边 {}",
                graph.getId(), compiled.size(), l, kept.size(), graph.getNodes().size(), edges.size());
        return new FilterResult(filtered, kept.size());
    }

    private static boolean matches(PaperNode node, List<Compiled> conditions, FilterLogic logic) {
        if (conditions.isEmpty()) return true;
        if (logic == FilterLogic.AND) {
            for (Compiled c : conditions) {
                if (!c.test(node)) return false;
            }
            return true;
        }
        for (Compiled c : conditions) {
            if (c.test(node)) return true;
        }
        return false;
    }

    /**
     * 校验运算符与比较值，任何一个不合法都整体拒绝。
     * 非顶层字段一律按属性名处理，图里没有该属性时只是匹配不到。
     */
    private static List<Compiled> compile(List<FilterCondition> conditions) {
        List<Compiled> compiled = new ArrayList<>(conditions.size());
        for (FilterCondition c : conditions) {
            if (c == null || StrUtil.isBlank(c.getField())) throw new InvalidFilterException("过滤字段不能为空");
            String field = c.getField().trim();
            FilterOperator op = FilterOperator.fromValue(c.getOperator());
            Object value = c.getValue();
            if (value == null) throw new InvalidFilterException("过滤值不能为空: " + field);
            if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
                throw new InvalidFilterException("过滤值必须是字符串、数值或布尔: " + field);
            }
            if (op.isOrdering() && value instanceof Boolean) {
                throw new InvalidFilterException("布尔值不能做大小比较: " + field);
            }
            compiled.add(new Compiled(field, op, value));
        }
        return compiled;
    }

    private record Compiled(String field, FilterOperator op, Object expected) {

        String describe() {
            return field + " " + op.getSymbol() + " " + expected;
        }

        boolean test(PaperNode node) {
            Object actual = resolve(node);
            if (actual == null) return false;
            if (actual instanceof Collection<?> list) {
                if (op == FilterOperator.NE) {
                    for (Object o : list) {
                        if (o != null && equalsValue(o, expected)) return false;
                    }
                    return true;
                }
                for (Object o : list) {
                    if (o != null && testScalar(o)) return true;
                }
                return false;
            }
            return testScalar(actual);
        }

        private Object resolve(PaperNode node) {
            Function<PaperNode, Object> getter = FIELDS.get(field);
            if (getter != null) {
                Object v = getter.apply(node);
                if (v != null) return v;
            }
            AttributeValue av = node.getAttributes().get(field);
            return av == null ? null : av.raw();
        }

        private boolean testScalar(Object actual) {
            switch (op) {
                case EQ:
                    return equalsValue(actual, expected);
                case NE:
                    return !equalsValue(actual, expected);
                case CONTAINS:
                    return String.valueOf(actual).toLowerCase(Locale.ROOT)
                            .contains(String.valueOf(expected).toLowerCase(Locale.ROOT));
                default:
                    Integer cmp = compare(actual, expected);
                    if (cmp == null) return false;
                    return switch (op) {
                        case GT -> cmp > 0;
                        case GE -> cmp >= 0;
                        case LT -> cmp < 0;
                        default -> cmp <= 0;
                    };
            }
        }

        private static boolean equalsValue(Object actual, Object expected) {
            Double a = toNumber(actual);
            Double b = toNumber(expected);
            if (a != null && b != null) return Double.compare(a, b) == 0;
            if (actual instanceof Boolean || expected instanceof Boolean) {
                return String.valueOf(actual).equalsIgnoreCase(String.valueOf(expected));
            }
            return String.valueOf(actual).equals(String.valueOf(expected));
        }

        /**
         * 两边都是数值时按数值比较，否则按字符串比较（ISO 日期可直接比较）。
         */
        private static Integer compare(Object actual, Object expected) {
            if (actual instanceof Boolean) return null;
            Double a = toNumber(actual);
            Double b = toNumber(expected);
            if (a != null && b != null) return Double.compare(a, b);
            if (a != null || b != null) {
                // 一边数值一边非数值，无可比性
                if (!(actual instanceof String) || !(expected instanceof String)) return null;
            }
            return String.valueOf(actual).compareTo(String.valueOf(expected));
        }

        private static Double toNumber(Object v) {
            if (v instanceof Number n) return n.doubleValue();
            if (v instanceof String s) {
                String t = s.trim();
                if (t.isEmpty()) return null;
                try {
                    return Double.parseDouble(t);
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            return null;
        }
    }
}
