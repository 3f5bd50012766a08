package com.lox.script.parser;

/**
 * Every failure raised while lexing, parsing, building or evaluating a script.
 * A ScriptError always aborts the current run; the language has no way to catch it.
 */
public class ScriptError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        NAME_ERROR,
        ATTRIBUTE_ERROR,
        TYPE_ERROR,
        ARITY_ERROR,
        DIVISION_BY_ZERO,
        BUILD_ERROR,
        SYNTAX_ERROR,
        RECURSION_DEPTH
    }

    private final Kind kind;

    public ScriptError(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScriptError(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    public static ScriptError nameError(String message) { return new ScriptError(Kind.NAME_ERROR, message); }
    public static ScriptError attributeError(String message) { return new ScriptError(Kind.ATTRIBUTE_ERROR, message); }
    public static ScriptError typeError(String message) { return new ScriptError(Kind.TYPE_ERROR, message); }
    public static ScriptError arityError(String message) { return new ScriptError(Kind.ARITY_ERROR, message); }
    public static ScriptError divisionByZero(String message) { return new ScriptError(Kind.DIVISION_BY_ZERO, message); }
    public static ScriptError buildError(String message) { return new ScriptError(Kind.BUILD_ERROR, message); }
    public static ScriptError syntaxError(String message) { return new ScriptError(Kind.SYNTAX_ERROR, message); }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
