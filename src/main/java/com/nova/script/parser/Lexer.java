package com.nova.script.parser;

import java.util.ArrayList;
import java.util.List;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case '+': case '-': case '*': case '%':
                addToken(TokenType.OPERATOR);
                break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    addToken(TokenType.OPERATOR);
                }
                break;
            case '!':
                // a lone '!' is not an operator of the language
                if (match('=')) addToken(TokenType.OPERATOR);
                else throw error(c, "Unknown character: " + c);
                break;
            case '=': case '<': case '>':
                match('=');
                addToken(TokenType.OPERATOR);
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                newLine();
                break;
            case '"':
                text();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error(c, "Unknown character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            addToken(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
            return;
        }
        String digits = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(digits));
        } catch (NumberFormatException e) {
            throw error(source.charAt(start), "Integer literal out of range: " + digits);
        }
    }

    private void text() {
        int quoteLine = startLine;
        int quoteColumn = startColumn;
        while (!isAtEnd() && peek() != '"') {
            if (advance() == '\n') newLine();
        }
        if (isAtEnd()) {
            throw new LexError(start, quoteLine, quoteColumn, '"', "Unterminated text literal");
        }
        advance();
        addToken(TokenType.TEXT, source.substring(start + 1, current - 1));
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn, start));
    }

    private LexError error(char c, String msg) {
        return new LexError(start, startLine, startColumn, c, msg);
    }
}
