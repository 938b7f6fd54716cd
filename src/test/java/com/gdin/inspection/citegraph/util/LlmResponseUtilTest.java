package com.gdin.inspection.citegraph.util;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LlmResponseUtilTest {

    @Test
    public void testRemoveThink() {
        Assertions.assertEquals("answer", LlmResponseUtil.removeThink("<think>\nreasoning...\n</think>answer").trim());
    }

    @Test
    public void testJsonInsideCodeFence() {
        String answer = """
                <think>先看两篇摘要</think>
                结果如下：
                ```json
                {"relationship_type": "extends", "similarities": ["both use {attention}"], "nested": {"a": 1}}
                ```
                以上。
                """;
        JSONObject json = LlmResponseUtil.getJSONResponse(answer);
        Assertions.assertEquals("extends", json.getString("relationship_type"));
        Assertions.assertEquals("both use {attention}", json.getJSONArray("similarities").getString(0));
        Assertions.assertEquals(1, json.getJSONObject("nested").getIntValue("a"));
    }

    @Test
    public void testNoJson() {
        Assertions.assertThrows(JSONException.class, () -> LlmResponseUtil.getJSONResponse("I cannot compare these papers."));
        Assertions.assertThrows(JSONException.class, () -> LlmResponseUtil.getJSONResponse("{\"a\": "));
    }
}
