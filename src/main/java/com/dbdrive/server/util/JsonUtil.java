package com.dbdrive.server.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.dbdrive.server.exception.JsonException;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static String serializeToString(Object object) throws JsonException {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new JsonException("serializeToString failed. object is %s".formatted(object), e);
        }
    }

    // blank json is an empty map
    public static Map<String, Object> deserializeToMap(String jsonString) throws JsonException {
        if (StringUtils.isBlank(jsonString)) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(jsonString, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new JsonException("deserializeToMap failed. jsonString is not a json object", e);
        }
    }

    public static <T> T deserializeObjectToPojo(Object source, Class<T> clazz) throws JsonException {
        try {
            return objectMapper.convertValue(source, clazz);
        } catch (IllegalArgumentException e) {
            throw new JsonException("deserializeObjectToPojo failed. target is %s".formatted(clazz.getSimpleName()), e);
        }
    }

    public static <T> T deserializeStringToPojo(String jsonString, Class<T> clazz) throws JsonException {
        try {
            return objectMapper.readValue(jsonString, clazz);
        } catch (JsonProcessingException e) {
            throw new JsonException("deserializeStringToPojo failed. jsonString is %s".formatted(jsonString), e);
        }
    }
}
