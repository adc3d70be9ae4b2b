package com.vidnyan.lre.domain.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits a rule expression into tokens, left to right.
 * Comparison operators and keywords are matched greedily before identifier accumulation;
 * whitespace, parentheses and commas end the current token.
 */
public class ExpressionTokenizer {

    private static final List<String> COMPARISONS = List.of("==", "!=", ">=", "<=", ">", "<");
    private static final List<String> KEYWORDS = List.of("AND", "OR", "NOT");

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d*\\.\\d+");

    public List<Token> tokenize(String expression) {
        if (expression == null) {
            throw new ExpressionException("Expression must not be null");
        }

        List<Token> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int length = expression.length();
        int i = 0;

        while (i < length) {
            char c = expression.charAt(i);

            if (Character.isWhitespace(c)) {
                flush(current, tokens);
                i++;
                continue;
            }

            if (c == '(' || c == ')' || c == ',') {
                flush(current, tokens);
                tokens.add(punctuation(c));
                i++;
                continue;
            }

            if (c == '"' || c == '\'') {
                flush(current, tokens);
                int end = expression.indexOf(c, i + 1);
                if (end < 0) {
                    throw new ExpressionException("Unterminated string literal at position " + i);
                }
                tokens.add(Token.literal(new Value.StringValue(expression.substring(i + 1, end))));
                i = end + 1;
                continue;
            }

            String comparison = matchComparison(expression, i);
            if (comparison != null) {
                flush(current, tokens);
                tokens.add(Token.of(Token.Type.COMPARISON, comparison));
                i += comparison.length();
                continue;
            }

            if (current.length() == 0) {
                String keyword = matchKeyword(expression, i);
                if (keyword != null) {
                    tokens.add(Token.of(Token.Type.valueOf(keyword), keyword));
                    i += keyword.length();
                    continue;
                }
            }

            current.append(c);
            i++;
        }

        flush(current, tokens);
        return tokens;
    }

    /**
     * Variable names referenced by an expression, in order of first appearance.
     * Function names (an identifier directly followed by an opening parenthesis) are excluded.
     */
    public Set<String> referencedVariables(String expression) {
        List<Token> tokens = tokenize(expression);
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.is(Token.Type.IDENTIFIER)) {
                continue;
            }
            boolean functionCall = i + 1 < tokens.size() && tokens.get(i + 1).is(Token.Type.LEFT_PAREN);
            if (!functionCall) {
                names.add(token.text());
            }
        }
        return names;
    }

    private static Token punctuation(char c) {
        return switch (c) {
            case '(' -> Token.of(Token.Type.LEFT_PAREN, "(");
            case ')' -> Token.of(Token.Type.RIGHT_PAREN, ")");
            default -> Token.of(Token.Type.COMMA, ",");
        };
    }

    private static String matchComparison(String expression, int position) {
        for (String operator : COMPARISONS) {
            if (expression.startsWith(operator, position)) {
                return operator;
            }
        }
        return null;
    }

    // Keywords only count as whole words: "ANDROID" and "NOTA" stay identifiers.
    private static String matchKeyword(String expression, int position) {
        for (String keyword : KEYWORDS) {
            if (!expression.startsWith(keyword, position)) {
                continue;
            }
            int next = position + keyword.length();
            if (next >= expression.length() || !isIdentifierPart(expression.charAt(next))) {
                return keyword;
            }
        }
        return null;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    private static void flush(StringBuilder current, List<Token> tokens) {
        if (current.length() == 0) {
            return;
        }
        tokens.add(classify(current.toString()));
        current.setLength(0);
    }

    private static Token classify(String text) {
        if ("true".equals(text) || "True".equals(text)) {
            return Token.literal(Value.TRUE);
        }
        if ("false".equals(text) || "False".equals(text)) {
            return Token.literal(Value.FALSE);
        }
        if ("null".equals(text)) {
            return Token.literal(Value.NULL);
        }
        if (INTEGER.matcher(text).matches() || DECIMAL.matcher(text).matches()) {
            return Token.literal(new Value.NumberValue(new BigDecimal(text)));
        }
        return Token.identifier(text);
    }
}
