package com.linlay.taskrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

abstract class AbstractPlanTool implements BaseTool {

    protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    protected JsonNode text(String value) {
        return OBJECT_MAPPER.getNodeFactory().textNode(value);
    }

    protected String readString(Map<?, ?> map, String key) {
        if (map == null || key == null) {
            return null;
        }
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
