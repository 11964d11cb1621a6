package org.carball.rlsguard.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for policy expressions.
 * <p>
 * Quoted regions ({@code '...'} or {@code "..."}) become one token with their delimiters.
 * Inside them a doubled delimiter stands for itself. A backslash escapes the next character
 * only in an escape string ({@code E'...'}), whose token keeps the {@code E} prefix; plain
 * strings follow Postgres standard-conforming strings. Outside quotes each of
 * {@code ( ) [ ] , = < > !} is a token of its own, whitespace separates tokens, and
 * everything else accumulates into words.
 */
public final class PolicyTokenizer {

    private static final char SINGLE_QUOTE = '\'';
    private static final char DOUBLE_QUOTE = '"';
    private static final char BACKSLASH = '\\';
    private static final char ESCAPE_PREFIX = 'E';

    private final String input;
    private final int length;
    private int pos;

    public PolicyTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, empty for blank input
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        int wordStart = -1;

        while (!isAtEnd()) {
            char c = peek();

            if (c == SINGLE_QUOTE && isEscapePrefix(wordStart)) {
                tokens.add(readQuoted(wordStart, true));
                wordStart = -1;
            } else if (c == SINGLE_QUOTE || c == DOUBLE_QUOTE) {
                wordStart = flushWord(tokens, wordStart);
                tokens.add(readQuoted(pos, false));
            } else if (Character.isWhitespace(c)) {
                wordStart = flushWord(tokens, wordStart);
                pos++;
            } else if (isPunctuation(c)) {
                wordStart = flushWord(tokens, wordStart);
                tokens.add(new Token(punctuationType(c), String.valueOf(c), pos));
                pos++;
            } else {
                if (wordStart < 0) {
                    wordStart = pos;
                }
                pos++;
            }
        }
        flushWord(tokens, wordStart);

        return tokens;
    }

    private int flushWord(List<Token> tokens, int wordStart) {
        if (wordStart >= 0 && wordStart < pos) {
            tokens.add(new Token(TokenType.WORD, input.substring(wordStart, pos), wordStart));
        }
        return -1;
    }

    private boolean isEscapePrefix(int wordStart) {
        return wordStart >= 0 && pos - wordStart == 1
                && Character.toUpperCase(input.charAt(wordStart)) == ESCAPE_PREFIX;
    }

    private Token readQuoted(int start, boolean backslashEscapes) {
        char quote = input.charAt(pos++);

        while (!isAtEnd()) {
            char c = input.charAt(pos);
            if (backslashEscapes && c == BACKSLASH && pos + 1 < length) {
                pos += 2;
            } else if (c == quote) {
                if (pos + 1 < length && input.charAt(pos + 1) == quote) {
                    pos += 2;
                } else {
                    pos++;
                    return new Token(TokenType.QUOTED, input.substring(start, pos), start);
                }
            } else {
                pos++;
            }
        }

        throw new PolicyParseException("Unterminated quoted literal", start);
    }

    private static boolean isPunctuation(char c) {
        return c == '(' || c == ')' || c == '[' || c == ']'
                || c == ',' || c == '=' || c == '<' || c == '>' || c == '!';
    }

    private static TokenType punctuationType(char c) {
        return switch (c) {
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case '[' -> TokenType.LEFT_BRACKET;
            case ']' -> TokenType.RIGHT_BRACKET;
            case ',' -> TokenType.COMMA;
            default -> TokenType.OPERATOR;
        };
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
