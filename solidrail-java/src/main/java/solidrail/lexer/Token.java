package solidrail.lexer;

/**
 * @param spaceBefore whitespace (or start of input) directly precedes the token
 */
public record Token(
        TokenType type,
        String lexeme,
        int line,
        int column,
        boolean spaceBefore
) {}
