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
 * A branch predicate. Either a flat expression such as
 * {@code "sessions_delta_pct > 15 AND orders_delta_pct >= -5"}, or the older structured
 * form {@code {"field": ..., "op": ..., "value": ...}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchCondition {

    private String expression;

    private String field;
    private String op;
    private Object value;

    public static BranchCondition expression(String expression) {
        return BranchCondition.builder().expression(expression).build();
    }

    public static BranchCondition structured(String field, String op, Object value) {
        return BranchCondition.builder().field(field).op(op).value(value).build();
    }

    public boolean isExpression() {
        return expression != null;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BranchCondition fromJson(Object raw) {
        if (raw instanceof String) {
            return expression((String) raw);
        }
        if (raw instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) raw;
            Object field = map.get("field");
            Object op = map.get("op");
            return structured(field != null ? field.toString() : null,
                    op != null ? op.toString() : null,
                    map.get("value"));
        }
        return new BranchCondition();
    }

    @JsonValue
    public Object toJson() {
        if (isExpression()) {
            return expression;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("field", field);
        map.put("op", op);
        map.put("value", value);
        return map;
    }
}
