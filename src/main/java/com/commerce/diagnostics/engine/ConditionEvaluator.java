package com.commerce.diagnostics.engine;

import com.commerce.diagnostics.model.BranchCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates branch predicates against an execution context.
 *
 * Grammar is flat: {@code leaf (AND leaf)* (OR leaf (AND leaf)*)*} with
 * {@code leaf := field op literal} and {@code op} one of {@code > >= < <= == !=}.
 * There is no grouping. A literal that is not a number is resolved as a field, so
 * field-to-field comparisons work. Anything unparseable or unresolved is false.
 */
@Component
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private static final Pattern LEAF = Pattern.compile("^([\\w.]+)\\s*(>=|<=|>|<|==|!=)\\s*([-\\w.]+)$");
    private static final String OR = " OR ";
    private static final String AND = " AND ";

    public boolean evaluate(BranchCondition condition, ExecutionContext context) {
        if (condition == null) {
            return false;
        }
        if (condition.isExpression()) {
            return evaluateExpression(condition.getExpression(), context);
        }
        if (condition.getField() == null) {
            return false;
        }
        Object actual = context.lookup(condition.getField());
        return compare(actual, condition.getOp(), normalizeLiteral(condition.getValue()));
    }

    public boolean evaluateExpression(String expression, ExecutionContext context) {
        if (expression == null) {
            return false;
        }
        String expr = expression.trim();

        if (expr.contains(OR)) {
            for (String part : expr.split(Pattern.quote(OR))) {
                if (evaluateExpression(part, context)) {
                    return true;
                }
            }
            return false;
        }

        if (expr.contains(AND)) {
            for (String part : expr.split(Pattern.quote(AND))) {
                if (!evaluateExpression(part, context)) {
                    return false;
                }
            }
            return true;
        }

        Matcher leaf = LEAF.matcher(expr);
        if (!leaf.matches()) {
            log.warn("Invalid branch expression: '{}'", expr);
            return false;
        }

        Object left = context.lookup(leaf.group(1));
        String literal = leaf.group(3);
        Double number = parseNumber(literal);
        Object right = number != null ? number : context.lookup(literal);

        return compare(left, leaf.group(2), right);
    }

    static boolean compare(Object left, String op, Object right) {
        if (left == null || right == null || op == null) {
            return false;
        }

        Double l = asNumber(left);
        Double r = asNumber(right);
        if (l != null && r != null) {
            int cmp = Double.compare(l, r);
            switch (op) {
                case ">":  return cmp > 0;
                case ">=": return cmp >= 0;
                case "<":  return cmp < 0;
                case "<=": return cmp <= 0;
                case "==": return l.doubleValue() == r.doubleValue();
                case "!=": return l.doubleValue() != r.doubleValue();
                default:   return false;
            }
        }

        if (left instanceof String && right instanceof String) {
            int cmp = ((String) left).compareTo((String) right);
            switch (op) {
                case ">":  return cmp > 0;
                case ">=": return cmp >= 0;
                case "<":  return cmp < 0;
                case "<=": return cmp <= 0;
                case "==": return cmp == 0;
                case "!=": return cmp != 0;
                default:   return false;
            }
        }

        // mixed or boolean operands only support equality
        boolean equal = Objects.equals(String.valueOf(left), String.valueOf(right));
        switch (op) {
            case "==": return equal;
            case "!=": return !equal;
            default:   return false;
        }
    }

    private static Object normalizeLiteral(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return value;
    }

    private static Double asNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            return parseNumber((String) value);
        }
        return null;
    }

    private static Double parseNumber(String text) {
        try {
            double parsed = Double.parseDouble(text);
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
