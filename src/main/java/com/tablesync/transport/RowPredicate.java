package com.tablesync.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a single PostgREST-style filter ({@code column=op.value}) against a row.
 *
 * <p>Supported operators: {@code eq}, {@code neq}, {@code in.(a,b,...)}, {@code is.null} and
 * {@code not.is.null}. Values compare as strings. A filter that cannot be parsed matches every
 * row: it only narrows traffic, so failing open loses nothing but bandwidth.
 */
final class RowPredicate implements Predicate<Map<String, Object>> {

    private static final Logger log = LoggerFactory.getLogger(RowPredicate.class);

    static final RowPredicate ALWAYS = new RowPredicate("", row -> true);

    private final String expression;
    private final Predicate<Map<String, Object>> test;

    private RowPredicate(String expression, Predicate<Map<String, Object>> test) {
        this.expression = expression;
        this.test = test;
    }

    static RowPredicate parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return ALWAYS;
        }
        int separator = expression.indexOf('=');
        if (separator <= 0) {
            return unparseable(expression);
        }
        String column = expression.substring(0, separator).trim();
        String condition = expression.substring(separator + 1).trim();

        if (condition.equals("is.null")) {
            return new RowPredicate(expression, row -> row.get(column) == null);
        }
        if (condition.equals("not.is.null")) {
            return new RowPredicate(expression, row -> row.get(column) != null);
        }
        if (condition.startsWith("eq.")) {
            String expected = condition.substring(3);
            return new RowPredicate(expression, row -> expected.equals(asString(row.get(column))));
        }
        if (condition.startsWith("neq.")) {
            String expected = condition.substring(4);
            return new RowPredicate(expression, row -> !expected.equals(asString(row.get(column))));
        }
        if (condition.startsWith("in.(") && condition.endsWith(")")) {
            List<String> allowed = splitList(condition.substring(4, condition.length() - 1));
            return new RowPredicate(expression, row -> allowed.contains(asString(row.get(column))));
        }
        return unparseable(expression);
    }

    @Override
    public boolean test(Map<String, Object> row) {
        return test.test(row != null ? row : Map.of());
    }

    @Override
    public String toString() {
        return expression;
    }

    private static RowPredicate unparseable(String expression) {
        log.warn("Unsupported filter '{}'; delivering all rows", expression);
        return new RowPredicate(expression, row -> true);
    }

    private static List<String> splitList(String values) {
        List<String> result = new ArrayList<>();
        for (String value : values.split(",")) {
            String trimmed = value.trim();
            if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
                trimmed = trimmed.substring(1, trimmed.length() - 1);
            }
            result.add(trimmed);
        }
        return result;
    }

    private static String asString(Object value) {
        return Objects.toString(value, null);
    }
}
