package com.vidnyan.lre.domain.expression;

import java.util.List;

/**
 * Binary comparison operators, declared in the order the evaluator folds them.
 */
public enum ComparisonOperator {
    EQ("=="),
    NE("!="),
    GE(">="),
    LE("<="),
    GT(">"),
    LT("<");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static List<ComparisonOperator> foldOrder() {
        return List.of(values());
    }

    public boolean apply(Value left, Value right) {
        return switch (this) {
            case EQ -> areEqual(left, right);
            case NE -> !areEqual(left, right);
            case GE -> order(left, right) >= 0;
            case LE -> order(left, right) <= 0;
            case GT -> order(left, right) > 0;
            case LT -> order(left, right) < 0;
        };
    }

    // 1 == 1.0 holds: numbers compare by magnitude, not by scale.
    private static boolean areEqual(Value left, Value right) {
        if (left instanceof Value.NumberValue l && right instanceof Value.NumberValue r) {
            return l.value().compareTo(r.value()) == 0;
        }
        return left.equals(right);
    }

    private int order(Value left, Value right) {
        if (left instanceof Value.NumberValue l && right instanceof Value.NumberValue r) {
            return l.value().compareTo(r.value());
        }
        if (left instanceof Value.StringValue l && right instanceof Value.StringValue r) {
            return l.value().compareTo(r.value());
        }
        throw new ExpressionException("Cannot apply '" + symbol + "' to "
                + left.render() + " and " + right.render());
    }
}
