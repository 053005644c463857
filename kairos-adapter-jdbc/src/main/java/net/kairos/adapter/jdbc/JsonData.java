package net.kairos.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/** JSON codec of the JOB_DATA column. */
public final class JsonData {
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonData(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonData() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    public String write(Map<String, Object> data) {
        if (data == null || data.isEmpty()) return null;
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("job data is not serializable as JSON", e);
        }
    }

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return mapper.readValue(json, MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("unreadable JOB_DATA: " + json, e);
        }
    }
}
