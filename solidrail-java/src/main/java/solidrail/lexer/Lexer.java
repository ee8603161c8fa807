package solidrail.lexer;

import solidrail.parser.ParseException;

import java.util.*;

public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final SortedMap<Integer, String> comments = new TreeMap<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    // newlines inside ( ) and [ ] do not end a statement
    private int nesting = 0;
    private boolean spaceBefore = true;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("class", TokenType.CLASS),
            Map.entry("module", TokenType.MODULE),
            Map.entry("def", TokenType.DEF),
            Map.entry("end", TokenType.END),
            Map.entry("if", TokenType.IF),
            Map.entry("elsif", TokenType.ELSIF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("unless", TokenType.UNLESS),
            Map.entry("while", TokenType.WHILE),
            Map.entry("until", TokenType.UNTIL),
            Map.entry("for", TokenType.FOR),
            Map.entry("in", TokenType.IN),
            Map.entry("do", TokenType.DO),
            Map.entry("then", TokenType.THEN),
            Map.entry("return", TokenType.RETURN),
            Map.entry("break", TokenType.BREAK),
            Map.entry("next", TokenType.NEXT),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("nil", TokenType.NIL),
            Map.entry("self", TokenType.SELF),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '\n' -> {
                    line++;
                    col = 1;
                    newline(startLine, startCol, "\\n");
                }
                case ';' -> newline(startLine, startCol, ";");
                case '#' -> comment(startLine);

                case '+' -> {
                    if (match('=')) add(TokenType.OP_ASSIGN, "+=", startLine, startCol);
                    else add(TokenType.PLUS, "+", startLine, startCol);
                }
                case '-' -> {
                    if (match('=')) add(TokenType.OP_ASSIGN, "-=", startLine, startCol);
                    else if (peek() == '>') error("Lambda literals are not supported");
                    else add(TokenType.MINUS, "-", startLine, startCol);
                }
                case '*' -> {
                    if (match('*')) {
                        if (match('=')) error("Operator '**=' is not supported");
                        add(TokenType.POW, "**", startLine, startCol);
                    } else if (match('=')) {
                        add(TokenType.OP_ASSIGN, "*=", startLine, startCol);
                    } else {
                        add(TokenType.STAR, "*", startLine, startCol);
                    }
                }
                case '/' -> {
                    if (match('=')) add(TokenType.OP_ASSIGN, "/=", startLine, startCol);
                    else add(TokenType.SLASH, "/", startLine, startCol);
                }
                case '%' -> {
                    if (match('=')) add(TokenType.OP_ASSIGN, "%=", startLine, startCol);
                    else add(TokenType.PERCENT, "%", startLine, startCol);
                }

                case '=' -> {
                    if (match('=')) {
                        if (peek() == '=') error("Operator '===' is not supported");
                        add(TokenType.EQ, "==", startLine, startCol);
                    } else if (match('>')) {
                        add(TokenType.ARROW, "=>", startLine, startCol);
                    } else if (peek() == '~') {
                        error("Regular expression matching is not supported");
                    } else {
                        add(TokenType.ASSIGN, "=", startLine, startCol);
                    }
                }
                case '!' -> {
                    boolean neq = match('=');
                    add(neq ? TokenType.NEQ : TokenType.BANG, neq ? "!=" : "!", startLine, startCol);
                }

                case '<' -> {
                    if (match('<')) {
                        if (match('=')) error("Operator '<<=' is not supported");
                        add(TokenType.SHL, "<<", startLine, startCol);
                    } else if (match('=')) {
                        if (peek() == '>') error("Operator '<=>' is not supported");
                        add(TokenType.LE, "<=", startLine, startCol);
                    } else {
                        add(TokenType.LT, "<", startLine, startCol);
                    }
                }
                case '>' -> {
                    if (match('>')) add(TokenType.SHR, ">>", startLine, startCol);
                    else if (match('=')) add(TokenType.GE, ">=", startLine, startCol);
                    else add(TokenType.GT, ">", startLine, startCol);
                }

                case '&' -> {
                    if (match('&')) {
                        if (match('=')) add(TokenType.OP_ASSIGN, "&&=", startLine, startCol);
                        else add(TokenType.ANDAND, "&&", startLine, startCol);
                    } else {
                        error("Unexpected '&'");
                    }
                }
                case '|' -> {
                    if (match('|')) {
                        if (match('=')) add(TokenType.OP_ASSIGN, "||=", startLine, startCol);
                        else add(TokenType.OROR, "||", startLine, startCol);
                    } else {
                        add(TokenType.PIPE, "|", startLine, startCol);
                    }
                }

                case '(' -> {
                    nesting++;
                    add(TokenType.LPAREN, "(", startLine, startCol);
                }
                case ')' -> {
                    if (nesting > 0) nesting--;
                    add(TokenType.RPAREN, ")", startLine, startCol);
                }
                case '[' -> {
                    nesting++;
                    add(TokenType.LBRACKET, "[", startLine, startCol);
                }
                case ']' -> {
                    if (nesting > 0) nesting--;
                    add(TokenType.RBRACKET, "]", startLine, startCol);
                }
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);
                case '?' -> add(TokenType.QUESTION, "?", startLine, startCol);

                case ':' -> {
                    if (match(':')) {
                        add(TokenType.SCOPE, "::", startLine, startCol);
                    } else if (isAlpha(peek())) {
                        symbol(startLine, startCol);
                    } else if (peek() == '"' || peek() == '\'') {
                        char quote = advance();
                        String text = quote == '"' ? doubleQuoted(startLine, startCol).text : singleQuoted();
                        add(TokenType.SYMBOL, text, startLine, startCol);
                    } else {
                        add(TokenType.COLON, ":", startLine, startCol);
                    }
                }

                case '.' -> {
                    if (match('.')) {
                        boolean exclusive = match('.');
                        add(exclusive ? TokenType.DOT3 : TokenType.DOT2, exclusive ? "..." : "..", startLine, startCol);
                    } else {
                        add(TokenType.DOT, ".", startLine, startCol);
                    }
                }

                case '@' -> {
                    if (peek() == '@') error("Class variables are not supported");
                    if (!isAlpha(peek())) error("Expected instance variable name after '@'");
                    StringBuilder sb = new StringBuilder();
                    while (!isAtEnd() && isAlphaNumeric(peek())) sb.append(advance());
                    add(TokenType.IVAR, sb.toString(), startLine, startCol);
                }

                case '"' -> {
                    Quoted q = doubleQuoted(startLine, startCol);
                    add(q.interpolated ? TokenType.ISTRING_LITERAL : TokenType.STRING_LITERAL,
                            q.text, startLine, startCol);
                }
                case '\'' -> add(TokenType.STRING_LITERAL, singleQuoted(), startLine, startCol);

                case '\\' -> {
                    // explicit line continuation
                    if (peek() == '\r') advance();
                    if (!match('\n')) error("Unexpected '\\'");
                    line++;
                    col = 1;
                }

                case '`' -> error("Command execution literals are not supported");
                case '$' -> error("Global variables are not supported");

                default -> {
                    if (isDigit(c)) numberLiteral(c, startLine, startCol);
                    else if (isAlpha(c)) identifier(c, startLine, startCol);
                    else error("Unexpected character: " + c);
                }
            }
            spaceBefore = c == '\n' || c == ';' || c == '\\';
        }

        newline(line, col, "\\n");
        tokens.add(new Token(TokenType.EOF, "", line, col, true));
        return tokens;
    }

    /** Comment text by line number, without the leading {@code #}. */
    public SortedMap<Integer, String> comments() {
        return Collections.unmodifiableSortedMap(comments);
    }

    // ================= helpers =================

    private void newline(int line, int col, String lexeme) {
        if (nesting > 0 && !lexeme.equals(";")) return;
        if (tokens.isEmpty()) return;
        if (tokens.get(tokens.size() - 1).type() == TokenType.NEWLINE) return;
        tokens.add(new Token(TokenType.NEWLINE, lexeme, line, col, true));
    }

    // only whole-line comments are kept; trailing comments after code are dropped
    private void comment(int line) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '\n') sb.append(advance());
        boolean wholeLine = tokens.isEmpty() || tokens.get(tokens.size() - 1).line() < line
                || tokens.get(tokens.size() - 1).type() == TokenType.NEWLINE;
        if (wholeLine) comments.put(line, sb.toString().trim());
    }

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            sb.append(advance());
            while (!isAtEnd() && (isHexDigit(peek()) || peek() == '_')) {
                char d = advance();
                if (d != '_') sb.append(d);
            }
            if (sb.length() == 2) error("Malformed hexadecimal literal");
            add(TokenType.INT_LITERAL, sb.toString(), line, col);
            return;
        }

        boolean isFloat = false;
        digits(sb);

        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            sb.append(advance());
            digits(sb);
        }

        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || peekNext() == '-' || peekNext() == '+')) {
            sb.append(advance());
            if (peek() == '-' || peek() == '+') sb.append(advance());
            if (!isDigit(peek())) error("Malformed exponent in numeric literal");
            digits(sb);
        }

        add(isFloat ? TokenType.FLOAT_LITERAL : scientificOrInt(sb.toString()), sb.toString(), line, col);
    }

    // 1e18 is an exact integer; 1e-3 is not
    private static TokenType scientificOrInt(String text) {
        int e = Math.max(text.indexOf('e'), text.indexOf('E'));
        if (e < 0) return TokenType.INT_LITERAL;
        return text.charAt(e + 1) == '-' ? TokenType.FLOAT_LITERAL : TokenType.INT_LITERAL;
    }

    private void digits(StringBuilder sb) {
        while (!isAtEnd() && (isDigit(peek()) || (peek() == '_' && isDigit(peekNext())))) {
            char d = advance();
            if (d != '_') sb.append(d);
        }
    }

    private void identifier(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        boolean constant = Character.isUpperCase(first);
        // predicate / bang method names: paused?, reset!
        if (!constant && (peek() == '?' || peek() == '!') && peekNext() != '=') {
            sb.append(advance());
        }

        String text = sb.toString();

        // `name:` followed by whitespace is a hash label or keyword argument
        if (peek() == ':' && peekNext() != ':' && isWhitespace(peekNext())) {
            advance();
            add(TokenType.LABEL, text, line, col);
            return;
        }

        if (constant) {
            add(TokenType.CONSTANT, text, line, col);
            return;
        }

        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        // receiver.end, receiver.class, ... are plain method names
        if (type != TokenType.IDENTIFIER && !tokens.isEmpty()
                && tokens.get(tokens.size() - 1).type() == TokenType.DOT) {
            type = TokenType.IDENTIFIER;
        }
        add(type, text, line, col);
    }

    private void symbol(int line, int col) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && isAlphaNumeric(peek())) sb.append(advance());
        if (peek() == '?' || peek() == '!' || peek() == '=') {
            if (peekNext() != '=' && peekNext() != '>') sb.append(advance());
        }
        add(TokenType.SYMBOL, sb.toString(), line, col);
    }

    private record Quoted(String text, boolean interpolated) {}

    private Quoted doubleQuoted(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        boolean interpolated = false;

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') {
                line++;
                col = 1;
            }
            if (c == '#' && peek() == '{') interpolated = true;
            if (c == '\\') {
                if (isAtEnd()) break;
                char e = advance();
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '0' -> sb.append('\0');
                    default -> sb.append(e);
                }
                continue;
            }
            sb.append(c);
        }

        if (isAtEnd()) throw new ParseException(startLine, startCol, "Unterminated string");

        advance(); // closing "
        return new Quoted(sb.toString(), interpolated);
    }

    private String singleQuoted() {
        int startLine = line;
        int startCol = col - 1;
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != '\'') {
            char c = advance();
            if (c == '\n') {
                line++;
                col = 1;
            }
            if (c == '\\' && (peek() == '\'' || peek() == '\\')) {
                sb.append(advance());
                continue;
            }
            sb.append(c);
        }

        if (isAtEnd()) throw new ParseException(startLine, startCol, "Unterminated string");

        advance(); // closing '
        return sb.toString();
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r' -> {
                    advance();
                    spaceBefore = true;
                }
                case '\n' -> {
                    if (nesting == 0) return;
                    advance();
                    line++;
                    col = 1;
                    spaceBefore = true;
                }
                default -> { return; }
            }
        }
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\0';
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col, spaceBefore));
    }

    private void error(String message) {
        throw new ParseException(line, col, message);
    }
}
