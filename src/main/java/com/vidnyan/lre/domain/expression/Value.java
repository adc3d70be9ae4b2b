package com.vidnyan.lre.domain.expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Typed value of a case variable or of an intermediate expression result.
 * Closed set: boolean, number, string, list, null.
 */
public sealed interface Value
        permits Value.BoolValue, Value.NumberValue, Value.StringValue, Value.ListValue, Value.NullValue {

    NullValue NULL = new NullValue();
    BoolValue TRUE = new BoolValue(true);
    BoolValue FALSE = new BoolValue(false);

    /**
     * Truthiness used by NOT/AND/OR: null, false, zero, empty string and empty list are false.
     */
    boolean isTruthy();

    /**
     * Text form used when rendering templates.
     */
    String render();

    record BoolValue(boolean value) implements Value {
        @Override
        public boolean isTruthy() {
            return value;
        }

        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    record NumberValue(BigDecimal value) implements Value {
        public NumberValue {
            if (value == null) {
                throw new IllegalArgumentException("Number value must not be null");
            }
        }

        public static NumberValue of(long value) {
            return new NumberValue(BigDecimal.valueOf(value));
        }

        @Override
        public boolean isTruthy() {
            return value.signum() != 0;
        }

        @Override
        public String render() {
            return value.toPlainString();
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("String value must not be null");
            }
        }

        @Override
        public boolean isTruthy() {
            return !value.isEmpty();
        }

        @Override
        public String render() {
            return value;
        }
    }

    record ListValue(List<Value> values) implements Value {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public boolean isTruthy() {
            return !values.isEmpty();
        }

        @Override
        public String render() {
            return values.stream().map(Value::render).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    record NullValue() implements Value {
        @Override
        public boolean isTruthy() {
            return false;
        }

        @Override
        public String render() {
            return "null";
        }
    }

    static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Resolves a raw Java object (as produced by Jackson or by a caller-built map) into a Value.
     *
     * @throws IllegalArgumentException for types outside the closed value set
     */
    static Value of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof Boolean bool) {
            return of(bool.booleanValue());
        }
        if (raw instanceof BigDecimal decimal) {
            return new NumberValue(decimal);
        }
        if (raw instanceof BigInteger integer) {
            return new NumberValue(new BigDecimal(integer));
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return NumberValue.of(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            double number = ((Number) raw).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new IllegalArgumentException("Non-finite number: " + raw);
            }
            return new NumberValue(BigDecimal.valueOf(number));
        }
        if (raw instanceof CharSequence text) {
            return new StringValue(text.toString());
        }
        if (raw instanceof Enum<?> constant) {
            return new StringValue(constant.name());
        }
        if (raw instanceof Collection<?> collection) {
            List<Value> values = new ArrayList<>(collection.size());
            for (Object element : collection) {
                values.add(of(element));
            }
            return new ListValue(values);
        }
        throw new IllegalArgumentException("Unsupported variable type: " + raw.getClass().getName());
    }
}
