package com.gdin.inspection.citegraph.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;

public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 外部接口字段很多，只取需要的
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private IOUtil() {
    }

    /**
     * json序列化(不降类型信息序列化到json字符串中)
     */
    public static String jsonSerializeWithNoType(Object obj) throws JsonProcessingException {
        return jsonSerializeWithNoType(obj, false);
    }

    public static String jsonSerializeWithNoType(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) return null;
        return pretty ? simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj) : simpleMapper.writeValueAsString(obj);
    }

    /**
     * json反序列化(json字符串中不包含类型信息)
     */
    public static <T> T jsonDeserializeWithNoType(InputStream is, Class<T> clazz) throws IOException {
        return simpleMapper.readValue(is, clazz);
    }

    public static <T> T jsonDeserializeWithNoType(String content, Class<T> clazz) throws IOException {
        return content == null ? null : simpleMapper.readValue(content, clazz);
    }
}
