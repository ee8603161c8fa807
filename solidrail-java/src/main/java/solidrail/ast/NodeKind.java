package solidrail.ast;

public enum NodeKind {

    // structure
    PROGRAM,
    IMPORT,
    CLASS,
    BODY,
    INCLUDE,
    VISIBILITY,
    METHOD_DEF,
    PARAMS,
    BLOCK_PARAMS,
    PARAM,
    DOC_TAG,

    // statements
    ASSIGN,
    OP_ASSIGN,
    IF,
    WHILE,
    FOR,
    ITERATION,
    RETURN,
    BREAK,
    NEXT,

    // expressions
    CALL,
    METHOD_CALL,
    INDEX,
    TERNARY,
    BINARY,
    UNARY,
    RANGE,
    ARRAY,
    HASH,
    PAIR,
    SELF,

    // literals
    INTEGER,
    FLOAT,
    STRING,
    INTERPOLATED_STRING,
    SYMBOL,
    BOOLEAN,
    NIL,
    IDENTIFIER,
    IVAR,
    CONSTANT;

    public boolean isLeaf() {
        return switch (this) {
            case IMPORT, VISIBILITY, PARAM, DOC_TAG, BREAK, NEXT, SELF,
                    INTEGER, FLOAT, STRING, INTERPOLATED_STRING, SYMBOL, BOOLEAN, NIL,
                    IDENTIFIER, IVAR, CONSTANT -> true;
            default -> false;
        };
    }

    public boolean isLiteral() {
        return switch (this) {
            case INTEGER, FLOAT, STRING, INTERPOLATED_STRING, SYMBOL, BOOLEAN, NIL -> true;
            default -> false;
        };
    }
}
