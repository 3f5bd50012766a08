package com.lox.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent front-end. Produces the generic ParseTree consumed by the
 * TreeBuilder; it does not fold literals or resolve operators.
 *
 * program     : declaration*
 * declaration : class_decl | fun_decl | var_decl | statement
 * statement   : print_cmd | if_stmt | while_stmt | for_stmt | return_stmt | block | expr_stmt
 * expression  : assign | setattr | or_
 */
public class Parser {
    private static final int MAX_ARGUMENTS = 255;

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public ParseTree.Node parse() {
        List<ParseTree> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            declarations.add(declaration());
        }
        return ParseTree.node("program", declarations);
    }

    private ParseTree declaration() {
        if (match(TokenType.CLASS)) return classDeclaration();
        if (match(TokenType.FUN)) return function("function");
        if (match(TokenType.VAR)) return varDeclaration();
        return statement();
    }

    private ParseTree classDeclaration() {
        List<ParseTree> parts = new ArrayList<>();
        parts.add(name(consume(TokenType.IDENTIFIER, "Expect class name.")));

        if (match(TokenType.LESS)) {
            Token superName = consume(TokenType.IDENTIFIER, "Expect superclass name.");
            parts.add(ParseTree.node("superclass", name(superName)));
        }

        consume(TokenType.LEFT_BRACE, "Expect '{' before class body.");
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            parts.add(function("method"));
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after class body.");

        return ParseTree.node("class_decl", parts);
    }

    private ParseTree function(String kind) {
        List<ParseTree> parts = new ArrayList<>();
        parts.add(name(consume(TokenType.IDENTIFIER, "Expect " + kind + " name.")));
        consume(TokenType.LEFT_PAREN, "Expect '(' after " + kind + " name.");

        List<ParseTree> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_ARGUMENTS) {
                    throw error(peek(), "Can't have more than " + MAX_ARGUMENTS + " parameters.");
                }
                List<ParseTree> param = new ArrayList<>();
                param.add(name(consume(TokenType.IDENTIFIER, "Expect parameter name.")));
                if (match(TokenType.COLON)) param.add(typeHint());
                params.add(ParseTree.node("param_decl", param));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        parts.add(ParseTree.node("params_decl", params));

        if (match(TokenType.COLON)) parts.add(typeHint());

        consume(TokenType.LEFT_BRACE, "Expect '{' before " + kind + " body.");
        parts.add(block());
        return ParseTree.node("fun_decl", parts);
    }

    private ParseTree typeHint() {
        Token typeName = consume(TokenType.IDENTIFIER, "Expect type name.");
        if (match(TokenType.QUESTION)) {
            return ParseTree.node("type_hint", name(typeName), ParseTree.leaf("NULLABLE", "?"));
        }
        return ParseTree.node("type_hint", name(typeName));
    }

    private ParseTree varDeclaration() {
        List<ParseTree> parts = new ArrayList<>();
        parts.add(name(consume(TokenType.IDENTIFIER, "Expect variable name.")));
        if (match(TokenType.COLON)) parts.add(typeHint());
        if (match(TokenType.EQUAL)) parts.add(expression());
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return ParseTree.node("var_decl", parts);
    }

    private ParseTree statement() {
        if (match(TokenType.PRINT)) return printStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.LEFT_BRACE)) return block();
        return expressionStatement();
    }

    private ParseTree printStatement() {
        ParseTree value = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after value.");
        return ParseTree.node("print_cmd", value);
    }

    private ParseTree ifStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        ParseTree condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        ParseTree thenBranch = statement();
        if (match(TokenType.ELSE)) {
            return ParseTree.node("if_stmt", condition, thenBranch, statement());
        }
        return ParseTree.node("if_stmt", condition, thenBranch);
    }

    private ParseTree whileStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        ParseTree condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after condition.");
        return ParseTree.node("while_stmt", condition, statement());
    }

    private ParseTree forStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'.");

        ParseTree init;
        if (match(TokenType.SEMICOLON)) {
            init = ParseTree.node("for_init");
        } else if (match(TokenType.VAR)) {
            init = ParseTree.node("for_init", varDeclaration());
        } else {
            init = ParseTree.node("for_init", expressionStatement());
        }

        ParseTree cond = check(TokenType.SEMICOLON)
                ? ParseTree.node("for_cond")
                : ParseTree.node("for_cond", expression());
        consume(TokenType.SEMICOLON, "Expect ';' after loop condition.");

        ParseTree incr = check(TokenType.RIGHT_PAREN)
                ? ParseTree.node("for_incr")
                : ParseTree.node("for_incr", expression());
        consume(TokenType.RIGHT_PAREN, "Expect ')' after for clauses.");

        return ParseTree.node("for_stmt", init, cond, incr, statement());
    }

    private ParseTree returnStatement() {
        if (match(TokenType.SEMICOLON)) return ParseTree.node("return_stmt");
        ParseTree value = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return ParseTree.node("return_stmt", value);
    }

    /** Parses the rest of a block after its '{'. */
    private ParseTree block() {
        List<ParseTree> declarations = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            declarations.add(declaration());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return ParseTree.node("block", declarations);
    }

    private ParseTree expressionStatement() {
        ParseTree expr = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return ParseTree.node("expr_stmt", expr);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ParseTree expression() {
        return assignment();
    }

    private ParseTree assignment() {
        ParseTree target = or();

        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            ParseTree value = assignment();

            if (target.isLeaf() && "VAR".equals(((ParseTree.Leaf) target).token)) {
                return ParseTree.node("assign", target, value);
            }
            if (!target.isLeaf() && "getattr".equals(((ParseTree.Node) target).rule)) {
                ParseTree.Node get = (ParseTree.Node) target;
                return ParseTree.node("setattr", get.children.get(0), get.children.get(1), value);
            }
            throw error(equals, "Invalid assignment target.");
        }
        return target;
    }

    private ParseTree or() {
        ParseTree expr = and();
        while (match(TokenType.OR, TokenType.OR_OR)) {
            expr = ParseTree.node("or_", expr, and());
        }
        return expr;
    }

    private ParseTree and() {
        ParseTree expr = equality();
        while (match(TokenType.AND, TokenType.AND_AND)) {
            expr = ParseTree.node("and_", expr, equality());
        }
        return expr;
    }

    private ParseTree equality() {
        ParseTree expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            String rule = previous().type == TokenType.EQUAL_EQUAL ? "eq" : "ne";
            expr = ParseTree.node(rule, expr, comparison());
        }
        return expr;
    }

    private ParseTree comparison() {
        ParseTree expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            String rule;
            switch (previous().type) {
                case GREATER: rule = "gt"; break;
                case GREATER_EQUAL: rule = "ge"; break;
                case LESS: rule = "lt"; break;
                default: rule = "le"; break;
            }
            expr = ParseTree.node(rule, expr, term());
        }
        return expr;
    }

    private ParseTree term() {
        ParseTree expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            String rule = previous().type == TokenType.PLUS ? "add" : "sub";
            expr = ParseTree.node(rule, expr, factor());
        }
        return expr;
    }

    private ParseTree factor() {
        ParseTree expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            String rule = previous().type == TokenType.STAR ? "mul" : "div";
            expr = ParseTree.node(rule, expr, unary());
        }
        return expr;
    }

    private ParseTree unary() {
        if (match(TokenType.BANG)) return ParseTree.node("not_", unary());
        if (match(TokenType.MINUS)) return ParseTree.node("neg", unary());
        return call();
    }

    private ParseTree call() {
        ParseTree expr = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = ParseTree.node("call", expr, arguments());
            } else if (match(TokenType.DOT)) {
                Token attr = consume(TokenType.IDENTIFIER, "Expect property name after '.'.");
                expr = ParseTree.node("getattr", expr, name(attr));
            } else {
                break;
            }
        }
        return expr;
    }

    private ParseTree arguments() {
        List<ParseTree> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (args.size() >= MAX_ARGUMENTS) {
                    throw error(peek(), "Can't have more than " + MAX_ARGUMENTS + " arguments.");
                }
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return ParseTree.node("params", args);
    }

    private ParseTree primary() {
        if (match(TokenType.FALSE, TokenType.TRUE)) return ParseTree.leaf("BOOL", previous().lexeme);
        if (match(TokenType.NIL)) return ParseTree.leaf("NIL", previous().lexeme);
        if (match(TokenType.NUMBER)) return ParseTree.leaf("NUMBER", previous().lexeme);
        if (match(TokenType.STRING)) return ParseTree.leaf("STRING", previous().lexeme);
        if (match(TokenType.THIS)) return ParseTree.node("this");
        if (match(TokenType.SUPER)) {
            consume(TokenType.DOT, "Expect '.' after 'super'.");
            Token method = consume(TokenType.IDENTIFIER, "Expect superclass method name.");
            return ParseTree.node("super_", name(method));
        }
        if (match(TokenType.IDENTIFIER)) return name(previous());

        if (match(TokenType.LEFT_PAREN)) {
            ParseTree expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        throw error(peek(), "Expect expression.");
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static ParseTree name(Token token) {
        return ParseTree.leaf("VAR", token.lexeme);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ScriptError error(Token token, String message) {
        String where = token.type == TokenType.EOF ? "at end" : "at '" + token.lexeme + "'";
        return ScriptError.syntaxError("[line " + token.line + "] Error " + where + ": " + message);
    }
}
