package org.sfiles.notation.decode;

import lombok.experimental.UtilityClass;
import org.sfiles.notation.core.EmptyInputException;
import org.sfiles.notation.core.GrammarException;
import org.sfiles.notation.graph.UnitIds;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer of the flowsheet notation.
 *
 * <p>Marker numbers after a {@code <}, {@code _} or {@code %} prefix take all
 * following digits; a bare digit is always a single-digit outgoing cycle, so
 * {@code 12} reads as cycles 1 and 2.</p>
 */
@UtilityClass
public final class NotationLexer {
    private static final int MAX_MARKER_DIGITS = 9;

    /**
     * Tokenizes a notation string.
     *
     * @param notation notation text.
     * @return tokens in input order.
     * @throws EmptyInputException for null or blank input.
     * @throws GrammarException when a substring matches no token.
     */
    public static List<Token> tokenize(String notation) {
        if (notation == null || notation.isBlank()) {
            throw new EmptyInputException("notation is empty");
        }
        List<Token> tokens = new ArrayList<>();
        int position = 0;
        while (position < notation.length()) {
            Token token = scan(notation, position, position);
            tokens.add(token);
            position += token.getText().length();
        }
        return classifyAnnotations(tokens);
    }

    /**
     * Validates an already split token list. Each entry must be exactly one token.
     *
     * @param tokens token texts.
     * @return typed tokens; offsets are list positions.
     * @throws EmptyInputException for a null or empty list.
     * @throws GrammarException when an entry is not exactly one token.
     */
    public static List<Token> tokenize(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new EmptyInputException("token list is empty");
        }
        List<Token> out = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            String text = tokens.get(i);
            if (text == null || text.isEmpty()) {
                throw unknown("empty token", i);
            }
            Token token = scan(text, 0, i);
            if (token.getText().length() != text.length()) {
                throw unknown("'" + text + "' is not a single token", i);
            }
            out.add(token);
        }
        return classifyAnnotations(out);
    }

    private static Token scan(String s, int start, int offset) {
        char c = s.charAt(start);
        switch (c) {
            case '(':
                return delimited(s, start, offset, ')', TokenType.UNIT);
            case '{':
                return delimited(s, start, offset, '}', TokenType.TAG);
            case '[':
                return token(TokenType.BRANCH_OPEN, "[", offset);
            case ']':
                return token(TokenType.BRANCH_CLOSE, "]", offset);
            case '|':
                return token(TokenType.INCOMING_BRANCH_CLOSE, "|", offset);
            case '&':
                if (s.startsWith("&|", start)) {
                    return token(TokenType.MIXING_POINT_CLOSE, "&|", offset);
                }
                return token(TokenType.MIXING_POINT, "&", offset);
            case 'n':
                if (s.startsWith("n|", start)) {
                    return token(TokenType.SEGMENT_BREAK, "n|", offset);
                }
                throw unknown("unexpected 'n'", offset);
            case '<':
                if (s.startsWith("<&|", start)) {
                    return token(TokenType.INCOMING_BRANCH_OPEN, "<&|", offset);
                }
                return marker(s, start, offset);
            case '_':
            case '%':
                return marker(s, start, offset);
            default:
                if (c >= '0' && c <= '9') {
                    return token(TokenType.CYCLE_OUT, String.valueOf(c), offset);
                }
                throw unknown("unexpected character '" + c + "'", offset);
        }
    }

    private static Token delimited(String s, int start, int offset, char close, TokenType type) {
        int end = s.indexOf(close, start + 1);
        if (end < 0) {
            throw unknown("unterminated '" + s.charAt(start) + "'", offset);
        }
        String text = s.substring(start, end + 1);
        String content = text.substring(1, text.length() - 1);
        if (type == TokenType.UNIT) {
            try {
                UnitIds.requireId(content);
            } catch (IllegalArgumentException e) {
                throw unknown("invalid unit token '" + text + "': " + e.getMessage(), offset);
            }
        } else if (content.isBlank() || content.indexOf('{') >= 0) {
            throw unknown("invalid tag token '" + text + "'", offset);
        }
        return token(type, text, offset);
    }

    /**
     * {@code <}? {@code _}? {@code %}? digits, at least one prefix character.
     */
    private static Token marker(String s, int start, int offset) {
        int i = start;
        boolean incoming = false;
        boolean signal = false;
        if (s.charAt(i) == '<') {
            incoming = true;
            i++;
        }
        if (i < s.length() && s.charAt(i) == '_') {
            signal = true;
            i++;
        }
        if (i < s.length() && s.charAt(i) == '%') {
            i++;
        }
        int digitsStart = i;
        while (i < s.length() && s.charAt(i) >= '0' && s.charAt(i) <= '9') {
            i++;
        }
        int digits = i - digitsStart;
        if (digits == 0) {
            throw unknown("marker without number", offset);
        }
        if (digits > MAX_MARKER_DIGITS) {
            throw unknown("marker number too long", offset);
        }
        TokenType type;
        if (signal) {
            type = incoming ? TokenType.SIGNAL_IN : TokenType.SIGNAL_OUT;
        } else {
            type = incoming ? TokenType.CYCLE_IN : TokenType.CYCLE_OUT;
        }
        return token(type, s.substring(start, i), offset);
    }

    /**
     * A {@code {digits}} or {@code {UPPERCASE}} tag right after a unit is an
     * annotation of that unit; anywhere else it is rejected.
     */
    private static List<Token> classifyAnnotations(List<Token> tokens) {
        List<Token> out = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getType() == TokenType.TAG && UnitIds.isAnnotationText(token.content())) {
                boolean afterUnit = i > 0 && tokens.get(i - 1).getType() == TokenType.UNIT;
                if (!afterUnit) {
                    throw new GrammarException(
                            GrammarException.REASON_MISPLACED_ANNOTATION,
                            "annotation '" + token.getText() + "' must directly follow a unit",
                            token.getOffset()
                    );
                }
                token = token(TokenType.ANNOTATION, token.getText(), token.getOffset());
            }
            out.add(token);
        }
        return out;
    }

    private static Token token(TokenType type, String text, int offset) {
        return new Token(type, text, offset);
    }

    private static GrammarException unknown(String message, int offset) {
        return new GrammarException(GrammarException.REASON_UNKNOWN_TOKEN, message, offset);
    }
}
