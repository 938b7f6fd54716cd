package com.gdin.inspection.citegraph.graph.prompts;

public class AttributeExtractionPromptsZh {

    public static final String SYSTEM_PROMPT = "你是一名科研助理，负责从论文中抽取结构化信息。";

    public static final String CONTRIBUTIONS_PROMPT = """
阅读下面的论文，列出它的主要贡献（最多 5 条），并给出一句话的问题描述。

标题: {title}
正文: {text}

只返回如下 JSON：
{
  "contributions": ["贡献1", "贡献2"],
  "problem": "一句话描述论文要解决的问题"
}""";

    public static final String ARCHITECTURE_PROMPT = """
阅读下面的论文，说明它提出或使用的模型 / 系统架构。

标题: {title}
正文: {text}

只返回如下 JSON：
{
  "architecture": "架构名称或类型，无法判断时填 unknown",
  "components": ["组件1", "组件2"],
  "is_novel_architecture": true
}""";
}
