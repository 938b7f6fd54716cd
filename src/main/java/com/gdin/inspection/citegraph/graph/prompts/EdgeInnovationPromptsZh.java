package com.gdin.inspection.citegraph.graph.prompts;

public class EdgeInnovationPromptsZh {

    public static final String SYSTEM_PROMPT = """
你是一名科研分析专家。已知论文 A 引用了论文 B，
请指出论文 A 具体采用了论文 B 的哪个思路、方法、技术或结论。
回答要具体、技术化，聚焦于被采用或被继续发展的那一项贡献。""";

    public static final String INNOVATION_PROMPT = """
论文 A（引用方）:
标题: {title_a}
摘要: {abstract_a}

论文 B（被引方）:
标题: {title_b}
摘要: {abstract_b}

论文 A 使用或发展了论文 B 的哪个具体思路、方法或结论？

只返回如下 JSON：
{
  "short_label": "不超过 8 个词，概括被采用的创新点",
  "full_insight": "2-3 段说明：(1) A 从 B 中拿了什么；(2) 如何改造或扩展；(3) A 的做法有何不同"
}""";

    public static final String MISSING_ABSTRACT = "(abstract not available)";
}
