package com.cumulo.service.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

final class JsonUtil {
    private static final ObjectMapper M = new ObjectMapper();

    private JsonUtil() {}

    static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON encode failed", e);
        }
    }

    static <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return M.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON decode failed", e);
        }
    }
}
