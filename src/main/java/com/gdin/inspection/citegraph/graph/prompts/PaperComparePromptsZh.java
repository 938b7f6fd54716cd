package com.gdin.inspection.citegraph.graph.prompts;

public class PaperComparePromptsZh {

    public static final String SYSTEM_PROMPT = "你是一名科研助理，负责比较两篇学术论文的异同。";

    public static final String COMPARE_PROMPT = """
请比较下面两篇论文，找出它们的相同点与不同点。

论文一:
标题: {title_a}
作者: {authors_a}
正文: {text_a}

论文二:
标题: {title_b}
作者: {authors_b}
正文: {text_b}

请分析：
1. 两篇论文的主要相同点；
2. 两篇论文的主要不同点；
3. 两者关系，只能从 extends、compares、builds_on、similar、unrelated 中选择一个；
4. 如适用，说明架构、贡献、方法上的差异。

只返回如下 JSON，不要输出其它内容：
{
  "similarities": ["相同点1", "相同点2"],
  "differences": ["不同点1", "不同点2"],
  "relationship_type": "extends|compares|builds_on|similar|unrelated",
  "architecture_diff": "架构差异",
  "contribution_diff": "贡献差异",
  "method_diff": "方法差异"
}""";
}
