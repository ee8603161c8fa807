package solidrail.parser;

import solidrail.SolidRailException;

/**
 * Malformed source text. Raised by both the lexer and the parser; the message starts
 * with {@code [line:column]} when the offending position is known.
 */
public class ParseException extends SolidRailException {
    private final int line;
    private final int column;

    public ParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public ParseException(int line, int column, String message) {
        super("[" + line + ":" + column + "] " + message);
        this.line = line;
        this.column = column;
    }

    public int line() { return line; }

    public int column() { return column; }

    public boolean hasPosition() { return line > 0; }
}
