package io.tasker4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Convenience base class holding the parameter map a one-shot job was constructed with.
 */
public abstract class AbstractOneShotJob implements OneShotJob {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Object> params;

    protected AbstractOneShotJob(Map<String, Object> params) {
        this.params = params == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    @Override
    public Map<String, Object> getParams() {
        return params;
    }

    protected String stringParam(String key) {
        Object v = params.get(key);
        return v == null ? null : v.toString();
    }

    @Override
    public String toJson() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("taskClass", getClass().getName());
        view.put("taskParams", params);
        try {
            return MAPPER.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            return "{\"taskClass\":\"" + getClass().getName() + "\"}";
        }
    }
}
