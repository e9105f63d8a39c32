package com.linlay.taskrunner.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, BaseTool> toolsByName;

    public ToolRegistry(List<BaseTool> tools) {
        this.toolsByName = tools.stream().collect(Collectors.toMap(
                tool -> normalizeName(tool.name()),
                Function.identity(),
                (left, right) -> {
                    log.warn("Duplicate tool name '{}', keeping the first registration", left.name());
                    return left;
                },
                LinkedHashMap::new
        ));
    }

    /**
     * Every registered tool, plan declaration included. Bound to direct execution.
     */
    public List<BaseTool> list() {
        return List.copyOf(toolsByName.values());
    }

    /**
     * Tools bound to plan-step execution. Excludes plan declaration so steps cannot nest plans.
     */
    public List<BaseTool> executorTools() {
        return toolsByName.values().stream()
                .filter(tool -> !PlanCreateTool.NAME.equals(normalizeName(tool.name())))
                .toList();
    }

    private String normalizeName(String raw) {
        return raw == null || raw.isBlank() ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
