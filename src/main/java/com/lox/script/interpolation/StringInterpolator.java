package com.lox.script.interpolation;

import java.util.Map;

import com.lox.script.parser.ScriptError;

/**
 * Variable substitution inside quoted string literals.
 *
 *   string      : '"' part* '"'
 *   part        : '${' IDENTIFIER '}' | '$$' | text
 *   IDENTIFIER  : [a-zA-Z_][a-zA-Z0-9_]*
 *
 * {@code ${x}} is replaced by x's entry in a flat name -> text map (empty when absent)
 * and {@code $$} is a literal '$'. Spaces inside the braces are ignored. This pass only
 * sees text; it never touches a live Environment.
 */
public final class StringInterpolator {

    private final String literal;
    private final Map<String, String> vars;
    private final StringBuilder out = new StringBuilder();
    private int current;
    private int end;

    private StringInterpolator(String literal, Map<String, String> vars) {
        this.literal = literal;
        this.vars = (vars == null) ? Map.of() : vars;
    }

    public static String interpolate(String literal, Map<String, String> vars) {
        if (literal == null) throw new IllegalArgumentException("literal must not be null");
        return new StringInterpolator(literal, vars).run();
    }

    private String run() {
        if (literal.length() < 2 || literal.charAt(0) != '"' || literal.charAt(literal.length() - 1) != '"') {
            throw error(0, "String must start and end with '\"'");
        }
        current = 1;
        end = literal.length() - 1;

        while (current < end) {
            char c = literal.charAt(current);
            if (c == '"') throw error(current, "Unexpected '\"' inside string");
            if (c == '$') {
                dollar();
            } else {
                out.append(c);
                current++;
            }
        }
        return out.toString();
    }

    private void dollar() {
        int start = current;
        current++; // '$'
        if (current < end && literal.charAt(current) == '$') {
            out.append('$');
            current++;
            return;
        }
        if (current < end && literal.charAt(current) == '{') {
            current++;
            skipSpaces();
            String name = identifier();
            skipSpaces();
            if (current >= end || literal.charAt(current) != '}') {
                throw error(start, "Unterminated '${' substitution");
            }
            current++;
            String value = vars.get(name);
            out.append(value == null ? "" : value);
            return;
        }
        throw error(start, "'$' must be followed by '$' or '{'");
    }

    private String identifier() {
        int start = current;
        if (current >= end || !isAlpha(literal.charAt(current))) {
            throw error(current, "Expected identifier after '${'");
        }
        while (current < end && isAlphaNumeric(literal.charAt(current))) current++;
        return literal.substring(start, current);
    }

    private void skipSpaces() {
        while (current < end && literal.charAt(current) == ' ') current++;
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || (c >= '0' && c <= '9');
    }

    private ScriptError error(int column, String message) {
        return ScriptError.syntaxError("[column " + column + "] " + message + ": " + literal);
    }
}
