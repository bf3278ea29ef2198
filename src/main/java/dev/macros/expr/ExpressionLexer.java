package dev.macros.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits expression source into tokens. Accepts both C-style ({@code && || !}) and
 * word ({@code and or not}) logical operators, and {@code True/False/None} as literals.
 */
final class ExpressionLexer {

    private static final Map<String, Token.Type> KEYWORDS = Map.of(
        "true", Token.Type.TRUE, "True", Token.Type.TRUE,
        "false", Token.Type.FALSE, "False", Token.Type.FALSE,
        "null", Token.Type.NULL, "None", Token.Type.NULL,
        "and", Token.Type.AND, "or", Token.Type.OR, "not", Token.Type.NOT
    );

    private final String source;
    private int pos;

    private ExpressionLexer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) {
        return new ExpressionLexer(source).run();
    }

    private List<Token> run() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);

        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '"' || c == '\'') {
            return string(start, c);
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            String word = source.substring(start, pos);
            return new Token(KEYWORDS.getOrDefault(word, Token.Type.IDENT), word, start);
        }

        pos++;
        switch (c) {
            case '(': return new Token(Token.Type.LPAREN, "(", start);
            case ')': return new Token(Token.Type.RPAREN, ")", start);
            case '[': return new Token(Token.Type.LBRACKET, "[", start);
            case ']': return new Token(Token.Type.RBRACKET, "]", start);
            case '.': return new Token(Token.Type.DOT, ".", start);
            case '+': return new Token(Token.Type.PLUS, "+", start);
            case '-': return new Token(Token.Type.MINUS, "-", start);
            case '*': return new Token(Token.Type.STAR, "*", start);
            case '/': return new Token(Token.Type.SLASH, "/", start);
            case '%': return new Token(Token.Type.PERCENT, "%", start);
            case '=':
                expect('=', start);
                return new Token(Token.Type.EQ, "==", start);
            case '!':
                return match('=')
                    ? new Token(Token.Type.NE, "!=", start)
                    : new Token(Token.Type.NOT, "!", start);
            case '<':
                return match('=')
                    ? new Token(Token.Type.LE, "<=", start)
                    : new Token(Token.Type.LT, "<", start);
            case '>':
                return match('=')
                    ? new Token(Token.Type.GE, ">=", start)
                    : new Token(Token.Type.GT, ">", start);
            case '&':
                expect('&', start);
                return new Token(Token.Type.AND, "&&", start);
            case '|':
                expect('|', start);
                return new Token(Token.Type.OR, "||", start);
            default:
                throw new ExpressionException("Unexpected character '%c' at %d".formatted(c, start));
        }
    }

    private Token number(int start) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos), start);
    }

    private Token string(int start, char quote) {
        pos++;
        var sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            if (c == '\\' && pos < source.length()) {
                c = source.charAt(pos++);
            }
            sb.append(c);
        }
        throw new ExpressionException("Unterminated string starting at " + start);
    }

    private boolean match(char expected) {
        if (pos < source.length() && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char expected, int start) {
        if (!match(expected)) {
            throw new ExpressionException("Expected '%c' at %d".formatted(expected, start + 1));
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
