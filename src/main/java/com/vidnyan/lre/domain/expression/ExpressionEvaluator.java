package com.vidnyan.lre.domain.expression;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Sandboxed evaluator for rule conditions.
 * <p>
 * Works over a closed operator and function set; the expression text is data and is never
 * handed to a scripting engine. Evaluation order:
 * <ol>
 *   <li>innermost parenthesised group or function call first, folded back into the stream,</li>
 *   <li>unary {@code NOT},</li>
 *   <li>comparisons, in {@link ComparisonOperator#foldOrder()} order,</li>
 *   <li>{@code AND}, then {@code OR}, each left to right.</li>
 * </ol>
 * One evaluator is bound to one variable snapshot and holds no other state.
 */
@Slf4j
public class ExpressionEvaluator {

    private final CaseVariables variables;
    private final ExpressionTokenizer tokenizer;

    public ExpressionEvaluator(CaseVariables variables) {
        this(variables, new ExpressionTokenizer());
    }

    public ExpressionEvaluator(CaseVariables variables, ExpressionTokenizer tokenizer) {
        this.variables = variables != null ? variables : CaseVariables.empty();
        this.tokenizer = tokenizer;
    }

    /**
     * Evaluates a condition.
     *
     * @return the boolean result, the truthiness of a non-boolean result,
     *         or null when the result is null or the expression cannot be evaluated
     */
    public Boolean evaluate(String expression) {
        try {
            Value result = evaluateValue(expression);
            if (result instanceof Value.BoolValue bool) {
                return bool.value();
            }
            if (result instanceof Value.NullValue) {
                return null;
            }
            return result.isTruthy();
        } catch (RuntimeException e) {
            log.warn("Could not evaluate expression '{}': {}", expression, e.getMessage());
            return null;
        }
    }

    /**
     * Evaluates an expression to its typed value.
     *
     * @throws ExpressionException when the expression is malformed or ill-typed
     */
    public Value evaluateValue(String expression) {
        return reduce(tokenizer.tokenize(expression));
    }

    private Value reduce(List<Token> input) {
        if (input.isEmpty()) {
            throw new ExpressionException("Empty expression");
        }
        List<Token> tokens = new ArrayList<>(input);

        int open;
        while ((open = lastIndexOf(tokens, Token.Type.LEFT_PAREN)) >= 0) {
            int close = indexOf(tokens, Token.Type.RIGHT_PAREN, open + 1);
            if (close < 0) {
                throw new ExpressionException("Unbalanced '(' in expression");
            }
            List<Token> inner = new ArrayList<>(tokens.subList(open + 1, close));

            if (open > 0 && tokens.get(open - 1).is(Token.Type.IDENTIFIER)) {
                String name = tokens.get(open - 1).text();
                BuiltinFunction function = BuiltinFunction.lookup(name)
                        .orElseThrow(() -> new ExpressionException("Unknown function: " + name));
                List<Value> arguments = new ArrayList<>();
                for (List<Token> argument : splitArguments(inner)) {
                    arguments.add(reduce(argument));
                }
                replace(tokens, open - 1, close + 1, Token.literal(function.apply(arguments)));
            } else {
                replace(tokens, open, close + 1, Token.literal(reduce(inner)));
            }
        }

        for (Token token : tokens) {
            if (token.is(Token.Type.RIGHT_PAREN)) {
                throw new ExpressionException("Unbalanced ')' in expression");
            }
            if (token.is(Token.Type.COMMA)) {
                throw new ExpressionException("Unexpected ',' outside a function call");
            }
        }

        foldNot(tokens);
        for (ComparisonOperator operator : ComparisonOperator.foldOrder()) {
            foldComparison(tokens, operator);
        }
        foldConnective(tokens, Token.Type.AND);
        foldConnective(tokens, Token.Type.OR);

        if (tokens.size() != 1) {
            throw new ExpressionException("Malformed expression: " + describe(tokens));
        }
        return resolve(tokens.get(0));
    }

    // Rightmost first, so NOT NOT x folds inside-out.
    private void foldNot(List<Token> tokens) {
        int index;
        while ((index = lastIndexOf(tokens, Token.Type.NOT)) >= 0) {
            if (index + 1 >= tokens.size()) {
                throw new ExpressionException("NOT without operand");
            }
            Value operand = resolve(tokens.get(index + 1));
            replace(tokens, index, index + 2, Token.literal(Value.of(!operand.isTruthy())));
        }
    }

    private void foldComparison(List<Token> tokens, ComparisonOperator operator) {
        int index;
        while ((index = indexOfComparison(tokens, operator)) >= 0) {
            requireBinaryOperands(tokens, index, operator.symbol());
            Value left = resolve(tokens.get(index - 1));
            Value right = resolve(tokens.get(index + 1));
            replace(tokens, index - 1, index + 2, Token.literal(Value.of(operator.apply(left, right))));
        }
    }

    private void foldConnective(List<Token> tokens, Token.Type connective) {
        int index;
        while ((index = indexOf(tokens, connective, 0)) >= 0) {
            requireBinaryOperands(tokens, index, connective.name());
            boolean left = resolve(tokens.get(index - 1)).isTruthy();
            boolean right = resolve(tokens.get(index + 1)).isTruthy();
            boolean result = connective == Token.Type.AND ? left && right : left || right;
            replace(tokens, index - 1, index + 2, Token.literal(Value.of(result)));
        }
    }

    private Value resolve(Token token) {
        return switch (token.type()) {
            case LITERAL -> token.value();
            case IDENTIFIER -> variables.resolve(token.text());
            default -> throw new ExpressionException("Expected an operand but found '" + token.text() + "'");
        };
    }

    private static List<List<Token>> splitArguments(List<Token> inner) {
        List<List<Token>> arguments = new ArrayList<>();
        if (inner.isEmpty()) {
            return arguments;
        }
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (Token token : inner) {
            if (token.is(Token.Type.LEFT_PAREN)) {
                depth++;
            } else if (token.is(Token.Type.RIGHT_PAREN)) {
                depth--;
            } else if (token.is(Token.Type.COMMA) && depth == 0) {
                arguments.add(requireArgument(current));
                current = new ArrayList<>();
                continue;
            }
            current.add(token);
        }
        arguments.add(requireArgument(current));
        return arguments;
    }

    private static List<Token> requireArgument(List<Token> argument) {
        if (argument.isEmpty()) {
            throw new ExpressionException("Empty function argument");
        }
        return argument;
    }

    private static void requireBinaryOperands(List<Token> tokens, int index, String operator) {
        if (index == 0 || index == tokens.size() - 1) {
            throw new ExpressionException("Operator '" + operator + "' is missing an operand");
        }
    }

    private static void replace(List<Token> tokens, int from, int to, Token replacement) {
        tokens.subList(from, to).clear();
        tokens.add(from, replacement);
    }

    private static int indexOf(List<Token> tokens, Token.Type type, int from) {
        for (int i = from; i < tokens.size(); i++) {
            if (tokens.get(i).is(type)) {
                return i;
            }
        }
        return -1;
    }

    private static int lastIndexOf(List<Token> tokens, Token.Type type) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i).is(type)) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOfComparison(List<Token> tokens, ComparisonOperator operator) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(Token.Type.COMPARISON) && operator.symbol().equals(token.text())) {
                return i;
            }
        }
        return -1;
    }

    private static String describe(List<Token> tokens) {
        StringBuilder text = new StringBuilder();
        for (Token token : tokens) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(token.text());
        }
        return text.toString();
    }
}
