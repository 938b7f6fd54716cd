package com.gdin.inspection.citegraph.util;

import com.alibaba.fastjson2.JSONObject;
import dev.langchain4j.service.TokenStream;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * 大模型流式响应的收集与清洗。
 */
@Slf4j
public class LlmResponseUtil {

    private static final Pattern THINK = Pattern.compile("<think>.*?</think>", Pattern.DOTALL);
    private static final Pattern CODE_FENCE = Pattern.compile("```[a-zA-Z]*");

    private LlmResponseUtil() {
    }

    public static String removeThink(String response) {
        // 去掉<think></think>标签以及其中的所有内容
        return THINK.matcher(response).replaceAll("");
    }

    /**
     * 启动流并等待完成，最多等 timeoutMillis。超时、出错或返回为空都会抛异常。
     */
    public static String getResponse(TokenStream tokenStream, String id, long timeoutMillis)
            throws InterruptedException, TimeoutException {
        StringBuilder result = new StringBuilder();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        long startTime = System.currentTimeMillis();
        tokenStream.onPartialResponse(s -> {
                    synchronized (result) {
                        result.append(s);
                    }
                })
                .onCompleteResponse(chatResponse -> {
                    log.debug("LLM [{}] 耗时: {}ms", id, System.currentTimeMillis() - startTime);
                    latch.countDown();
                })
                .onError(throwable -> {
                    log.warn("LLM [{}] 调用出错: {}", id, throwable.getMessage());
                    failure.set(throwable);
                    latch.countDown();
                })
                .start();
        if (!latch.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
            throw new TimeoutException("LLM [" + id + "] 超过 " + timeoutMillis + "ms 未返回");
        }
        if (failure.get() != null) throw new IllegalStateException("调用失败: " + failure.get().getMessage(), failure.get());
        String answer;
        synchronized (result) {
            answer = result.toString();
        }
        if (answer.isBlank()) throw new IllegalStateException("调用失败, 返回为空");
        return answer;
    }

    public static String getResponseWithoutThink(TokenStream tokenStream, String id, long timeoutMillis)
            throws InterruptedException, TimeoutException {
        return removeThink(getResponse(tokenStream, id, timeoutMillis));
    }

    /**
     * 从回答中取出第一个完整的 JSON 对象：去掉 think 和代码块标记，按花括号配对截取。
     *
     * @throws com.alibaba.fastjson2.JSONException 没有 JSON 对象或无法解析
     */
    public static JSONObject getJSONResponse(String response) {
        String answer = CODE_FENCE.matcher(removeThink(response)).replaceAll("");
        String json = extractFirstObject(answer);
        if (json == null) throw new com.alibaba.fastjson2.JSONException("回答中没有 JSON 对象");
        JSONObject obj = JSONObject.parseObject(json);
        if (obj == null) throw new com.alibaba.fastjson2.JSONException("JSON 为空");
        return obj;
    }

    static String extractFirstObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) return null;
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') inString = true;
            else if (c == '{') depth++;
            else if (c == '}') {
                depth--;
                if (depth == 0) return text.substring(start, i + 1);
            }
        }
        return null;
    }
}
