package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fallback of a branch node: a node id, or {@code {"action": "terminate", "reason": ...}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefaultRoute {

    public static final String TERMINATE = "terminate";

    private String nodeId;
    private boolean terminate;
    private String reason;

    public static DefaultRoute toNode(String nodeId) {
        return DefaultRoute.builder().nodeId(nodeId).build();
    }

    public static DefaultRoute terminate(String reason) {
        return DefaultRoute.builder().terminate(true).reason(reason).build();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DefaultRoute fromJson(Object raw) {
        if (raw instanceof String) {
            return toNode((String) raw);
        }
        if (raw instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) raw;
            Object reason = map.get("reason");
            if (TERMINATE.equals(map.get("action"))) {
                return terminate(reason != null ? reason.toString() : null);
            }
            Object next = map.get("next");
            if (next != null) {
                return toNode(next.toString());
            }
        }
        return new DefaultRoute();
    }

    @JsonValue
    public Object toJson() {
        if (!terminate) {
            return nodeId;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action", TERMINATE);
        map.put("reason", reason);
        return map;
    }
}
