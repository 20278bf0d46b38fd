package org.sfiles.notation.decode;

import lombok.Value;

/**
 * One lexical token with its source offset.
 */
@Value
public class Token {
    TokenType type;
    /** Raw token text as it appears in the notation. */
    String text;
    /** Character offset in the input string, or position in a token list. */
    int offset;

    /**
     * Text between the delimiters of a unit, annotation or tag token.
     */
    public String content() {
        return text.substring(1, text.length() - 1);
    }

    /**
     * Marker number of a cycle or signal token.
     */
    public int number() {
        int i = 0;
        while (i < text.length() && !Character.isDigit(text.charAt(i))) {
            i++;
        }
        return Integer.parseInt(text.substring(i));
    }
}
