package dev.macros.expr;

/**
 * A lexical token with its source offset.
 */
record Token(Type type, String text, int position) {

    enum Type {
        NUMBER, STRING, IDENT,
        TRUE, FALSE, NULL,
        AND, OR, NOT,
        EQ, NE, LT, LE, GT, GE,
        PLUS, MINUS, STAR, SLASH, PERCENT,
        LPAREN, RPAREN, LBRACKET, RBRACKET, DOT,
        EOF
    }
}
