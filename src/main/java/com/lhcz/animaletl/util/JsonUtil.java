package com.lhcz.animaletl.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.lhcz.animaletl.model.Animal;

import java.util.List;

public class JsonUtil {
    private static final ObjectMapper mapper = new ObjectMapper();

    static {
        // 数字一律按 long / BigDecimal 读，避免 id 被截断成 double
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.enable(DeserializationFeature.USE_LONG_FOR_INTS);
        // "{}garbage" 这类带尾巴的响应直接判为非法
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    private JsonUtil() {}

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static JsonNode readTree(String body) throws JsonProcessingException {
        return mapper.readTree(body);
    }

    public static ArrayNode toJsonArray(List<Animal> animals) {
        ArrayNode array = mapper.createArrayNode();
        for (Animal animal : animals) {
            array.add(animal.toJson());
        }
        return array;
    }

    public static String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON conversion failed", e);
        }
    }
}
