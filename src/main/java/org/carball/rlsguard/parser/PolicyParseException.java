package org.carball.rlsguard.parser;

/**
 * Raised by the tokenizer and parser for malformed policy expressions.
 */
public class PolicyParseException extends IllegalArgumentException {

    private final int position;

    public PolicyParseException(String message, int position) {
        super("Invalid policy expression at position " + position + ": " + message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
