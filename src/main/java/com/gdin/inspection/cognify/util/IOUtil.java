package com.gdin.inspection.cognify.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.Set;

@Slf4j
public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * json序列化(不将类型信息序列化到json字符串中)
     */
    public static String jsonSerializeWithNoType(Object obj) throws JsonProcessingException {
        return jsonSerializeWithNoType(obj, false);
    }

    public static String jsonSerializeWithNoType(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) {
            return null;
        } else {
            return pretty ? simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj) : simpleMapper.writeValueAsString(obj);
        }
    }

    /**
     * json反序列化(json字符串中不包含类型信息)
     */
    public static <T> T jsonDeserializeWithNoType(InputStream is, Class<T> clazz) throws IOException {
        return simpleMapper.readValue(is, clazz);
    }

    /**
     * json反序列化(json字符串中不包含类型信息)
     */
    public static <T> T jsonDeserializeWithNoType(String content, Class<T> clazz) throws JsonProcessingException {
        return content == null ? null : simpleMapper.readValue(content, clazz);
    }

    /**
     * 解析字符串集合，保持原有顺序。
     */
    public static Set<String> parseStringSet(String json) {
        try {
            if (json == null || json.isBlank()) {
                return new LinkedHashSet<>();
            }
            return simpleMapper.readValue(json, new TypeReference<LinkedHashSet<String>>() {
            });
        } catch (JsonProcessingException e) {
            log.error("JSON解析失败: {}", json, e);
            throw new IllegalStateException("JSON解析失败: " + json, e);
        }
    }
}
