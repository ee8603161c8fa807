package solidrail.lexer;

public enum TokenType {

    // names and literals
    IDENTIFIER,
    CONSTANT,
    IVAR,
    LABEL,
    SYMBOL,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    ISTRING_LITERAL,

    // keywords
    CLASS,
    MODULE,
    DEF,
    END,
    IF,
    ELSIF,
    ELSE,
    UNLESS,
    WHILE,
    UNTIL,
    FOR,
    IN,
    DO,
    THEN,
    RETURN,
    BREAK,
    NEXT,
    TRUE,
    FALSE,
    NIL,
    SELF,
    AND,
    OR,
    NOT,

    // operators
    PLUS, MINUS, STAR, POW, SLASH, PERCENT,
    ASSIGN, OP_ASSIGN,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    SHL, SHR,
    ANDAND, OROR, BANG,
    ARROW,
    QUESTION,

    // symbols
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    LBRACE, RBRACE,
    COLON, SCOPE, COMMA, PIPE,
    DOT, DOT2, DOT3,

    NEWLINE,
    EOF
}
