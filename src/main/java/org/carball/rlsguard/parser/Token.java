package org.carball.rlsguard.parser;

/**
 * Represents a token in a policy expression.
 *
 * @param type     Token type
 * @param text     Original text, quotes included for quoted tokens
 * @param position Offset of the first character in the tokenized string
 */
public record Token(TokenType type, String text, int position) {

    public boolean isKeyword(String keyword) {
        return type == TokenType.WORD && text.equalsIgnoreCase(keyword);
    }

    /**
     * Whether {@code next} starts right where this token ends.
     */
    public boolean isFollowedBy(Token next) {
        return next != null && next.position == position + text.length();
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
