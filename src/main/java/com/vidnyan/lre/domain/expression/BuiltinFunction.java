package com.vidnyan.lre.domain.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The closed set of functions an expression may call.
 */
public enum BuiltinFunction {

    /** Smallest numeric argument; null arguments are ignored, no arguments left gives null. */
    MIN {
        @Override
        public Value apply(List<Value> arguments) {
            return numericArguments(arguments).stream()
                    .min(Comparator.naturalOrder())
                    .<Value>map(Value.NumberValue::new)
                    .orElse(Value.NULL);
        }
    },

    /** Largest numeric argument; null arguments are ignored, no arguments left gives null. */
    MAX {
        @Override
        public Value apply(List<Value> arguments) {
            return numericArguments(arguments).stream()
                    .max(Comparator.naturalOrder())
                    .<Value>map(Value.NumberValue::new)
                    .orElse(Value.NULL);
        }
    },

    /** List arguments count their size, other non-null arguments count 1, null counts 0. */
    COUNT {
        @Override
        public Value apply(List<Value> arguments) {
            long count = 0;
            for (Value argument : arguments) {
                if (argument instanceof Value.ListValue list) {
                    count += list.values().size();
                } else if (!(argument instanceof Value.NullValue)) {
                    count++;
                }
            }
            return Value.NumberValue.of(count);
        }
    },

    /** Sum of numeric arguments; anything else contributes zero. */
    SUM {
        @Override
        public Value apply(List<Value> arguments) {
            BigDecimal total = BigDecimal.ZERO;
            for (Value argument : arguments) {
                if (argument instanceof Value.NumberValue number) {
                    total = total.add(number.value());
                }
            }
            return new Value.NumberValue(total);
        }
    };

    public abstract Value apply(List<Value> arguments);

    public static Optional<BuiltinFunction> lookup(String name) {
        for (BuiltinFunction function : values()) {
            if (function.name().equals(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    private static List<BigDecimal> numericArguments(List<Value> arguments) {
        List<BigDecimal> numbers = new ArrayList<>();
        for (Value argument : arguments) {
            if (argument instanceof Value.NumberValue number) {
                numbers.add(number.value());
            } else if (!(argument instanceof Value.NullValue)) {
                throw new ExpressionException("Non-numeric argument: " + argument.render());
            }
        }
        return numbers;
    }
}
