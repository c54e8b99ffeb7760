package com.rpal.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.rpal.script.RpalRuntimeException;

/**
 * Scanner and screener in one pass: whitespace and comments never become tokens, and
 * identifiers that spell a reserved word come out as {@link TokenType#KEYWORD}.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    private static final String OPERATOR_CHARS = "+-*<>&.@/:=~|$!#%^_[]{}\"?";

    private static final Set<String> keywords;
    static {
        Set<String> set = new HashSet<>();
        Collections.addAll(set,
                "let", "in", "where", "rec", "fn", "aug", "or", "not", "gr", "ge", "ls",
                "le", "eq", "ne", "true", "false", "nil", "dummy", "within", "and");
        keywords = Collections.unmodifiableSet(set);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': case ')': case ';': case ',':
                addToken(TokenType.PUNCTUATION);
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                line++;
                break;
            case '\'':
                string();
                break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    operator();
                }
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else if (isOperatorChar(c)) operator();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(keywords.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek()) || isAlpha(peek())) advance();
        String text = source.substring(start, current);
        for (int i = 0; i < text.length(); i++) {
            if (!isDigit(text.charAt(i))) throw error("Invalid token: " + text);
        }
        try {
            Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + text);
        }
        addToken(TokenType.INTEGER);
    }

    private void string() {
        int startLine = line;
        while (!isAtEnd() && peek() != '\'') {
            if (peek() == '\n') line++;
            advance();
        }
        if (isAtEnd()) {
            line = startLine;
            throw error("Unterminated string");
        }
        advance();
        addToken(TokenType.STRING);
    }

    // maximal munch, stopping short of a comment
    private void operator() {
        while (!isAtEnd() && isOperatorChar(peek())) {
            if (peek() == '/' && peekNext() == '/') break;
            advance();
        }
        addToken(TokenType.OPERATOR);
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

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }
    private boolean isOperatorChar(char c) {
        return c != '\0' && OPERATOR_CHARS.indexOf(c) >= 0;
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), line));
    }

    private RpalRuntimeException error(String msg) {
        return RpalRuntimeException.syntax(line, msg);
    }
}
