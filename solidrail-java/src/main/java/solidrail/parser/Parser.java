package solidrail.parser;

import solidrail.ast.Node;
import solidrail.ast.NodeKind;
import solidrail.ast.Position;
import solidrail.lexer.Lexer;
import solidrail.lexer.Token;
import solidrail.lexer.TokenType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Recursive-descent parser for the supported Ruby subset.
 */
public final class Parser {
    private static final Set<TokenType> COMMAND_ARG_START = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.CONSTANT, TokenType.IVAR,
            TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL,
            TokenType.STRING_LITERAL, TokenType.ISTRING_LITERAL,
            TokenType.SYMBOL, TokenType.LABEL,
            TokenType.TRUE, TokenType.FALSE, TokenType.NIL, TokenType.SELF,
            TokenType.LPAREN, TokenType.LBRACKET
    );

    private static final Set<String> VISIBILITY_WORDS = Set.of("public", "private", "protected");

    private final List<Token> tokens;
    private final SortedMap<Integer, String> comments;
    private int pos = 0;

    // `do` belongs to the loop header in `while c do`, not to a call inside c
    private boolean noDoBlock = false;

    public Parser(List<Token> tokens) {
        this(tokens, Collections.emptySortedMap());
    }

    public Parser(List<Token> tokens, SortedMap<Integer, String> comments) {
        this.tokens = tokens;
        this.comments = new TreeMap<>(comments);
    }

    public static Node parse(String source) {
        if (source == null) throw new ParseException("Failed to parse Ruby code: no source text");
        Lexer lexer = new Lexer(source);
        List<Token> toks = lexer.tokenize();
        return new Parser(toks, lexer.comments()).parseProgram();
    }

    // ---------- entry ----------
    public Node parseProgram() {
        List<Node> stmts = parseStatements(EnumSet.noneOf(TokenType.class));
        consume(TokenType.EOF, "Expected end of input");
        return Node.of(NodeKind.PROGRAM, new Position(1, 1), stmts);
    }

    private List<Node> parseStatements(Set<TokenType> terminators) {
        List<Node> stmts = new ArrayList<>();
        while (true) {
            skipNewlines();
            if (check(TokenType.EOF) || terminators.contains(peek().type())) break;
            stmts.add(parseStatement());
            if (!check(TokenType.NEWLINE) && !check(TokenType.EOF) && !terminators.contains(peek().type())) {
                throw error(peek(), "Expected end of statement");
            }
        }
        return stmts;
    }

    private Node body(Position at, List<Node> stmts) {
        return Node.of(NodeKind.BODY, at, stmts);
    }

    // ---------- statements ----------
    private Node parseStatement() {
        Node stmt = parseStatementCore();

        while (check(TokenType.IF) || check(TokenType.UNLESS)
                || check(TokenType.WHILE) || check(TokenType.UNTIL)) {
            Token mod = advance();
            Position p = position(mod);
            Node cond = parseExpression();
            Node wrapped = body(stmt.position(), List.of(stmt));
            stmt = switch (mod.type()) {
                case IF -> Node.of(NodeKind.IF, p, cond, wrapped);
                case UNLESS -> Node.of(NodeKind.IF, p, negate(cond), wrapped);
                case WHILE -> Node.of(NodeKind.WHILE, p, cond, wrapped);
                default -> Node.of(NodeKind.WHILE, p, negate(cond), wrapped);
            };
        }
        return stmt;
    }

    private Node parseStatementCore() {
        Token t = peek();
        switch (t.type()) {
            case CLASS -> {
                advance();
                return parseClass(t);
            }
            case MODULE -> throw error(t, "Modules are not supported; declare a class instead");
            case DEF -> {
                advance();
                return parseDef(t, List.of());
            }
            case IF, UNLESS -> {
                advance();
                Node cond = parseExpression();
                if (t.type() == TokenType.UNLESS) cond = negate(cond);
                return parseIfRest(position(t), cond);
            }
            case WHILE, UNTIL -> {
                advance();
                Node cond = parseLoopHeader();
                if (t.type() == TokenType.UNTIL) cond = negate(cond);
                match(TokenType.DO);
                Node b = body(position(t), parseStatements(EnumSet.of(TokenType.END)));
                consume(TokenType.END, "Expected 'end' to close loop");
                return Node.of(NodeKind.WHILE, position(t), cond, b);
            }
            case FOR -> {
                advance();
                return parseFor(t);
            }
            case RETURN -> {
                advance();
                if (atStatementEnd()) return Node.of(NodeKind.RETURN, position(t));
                return Node.of(NodeKind.RETURN, position(t), parseExpression());
            }
            case BREAK -> {
                advance();
                return Node.leaf(NodeKind.BREAK, null, position(t));
            }
            case NEXT -> {
                advance();
                return Node.leaf(NodeKind.NEXT, null, position(t));
            }
            case IDENTIFIER -> {
                if (VISIBILITY_WORDS.contains(t.lexeme()) && checkNext(TokenType.DEF)) {
                    advance();
                    Token def = advance();
                    return parseDef(def, List.of(Node.leaf(NodeKind.DOC_TAG, "@" + t.lexeme(), position(t))));
                }
            }
            default -> { }
        }
        return classify(parseExpression());
    }

    // require/include/visibility are ordinary calls syntactically
    private Node classify(Node expr) {
        if (expr.is(NodeKind.IDENTIFIER) && VISIBILITY_WORDS.contains(expr.text())) {
            return Node.leaf(NodeKind.VISIBILITY, expr.text(), expr.position());
        }
        if (expr.is(NodeKind.CALL)) {
            String name = expr.text();
            if ((name.equals("require") || name.equals("require_relative"))
                    && expr.childCount() == 1 && expr.child(0).is(NodeKind.STRING)) {
                String path = expr.child(0).text();
                if (name.equals("require_relative") && !path.startsWith(".")) path = "./" + path;
                return Node.leaf(NodeKind.IMPORT, path, expr.position());
            }
            if (name.equals("include") && expr.childCount() > 0) {
                for (Node c : expr.children()) {
                    if (!c.is(NodeKind.CONSTANT)) {
                        throw new ParseException(line(c), column(c), "'include' expects module names");
                    }
                }
                return Node.of(NodeKind.INCLUDE, expr.position(), expr.children());
            }
        }
        return expr;
    }

    private Node parseClass(Token classTok) {
        if (check(TokenType.SHL)) throw error(peek(), "Singleton classes (class << self) are not supported");
        Node name = parseConstantPath("Expected class name");
        List<Node> children = new ArrayList<>();
        children.add(name);
        if (match(TokenType.LT)) {
            children.add(parseConstantPath("Expected parent class name after '<'"));
        }
        Node b = body(position(classTok), parseStatements(EnumSet.of(TokenType.END)));
        consume(TokenType.END, "Expected 'end' to close class " + name.text());
        children.add(b);
        return Node.of(NodeKind.CLASS, position(classTok), children);
    }

    private Node parseConstantPath(String msg) {
        Token first = consume(TokenType.CONSTANT, msg);
        StringBuilder sb = new StringBuilder(first.lexeme());
        while (match(TokenType.SCOPE)) {
            sb.append("::").append(consume(TokenType.CONSTANT, "Expected constant after '::'").lexeme());
        }
        return Node.leaf(NodeKind.CONSTANT, sb.toString(), position(first));
    }

    private Node parseDef(Token defTok, List<Node> extraTags) {
        if (check(TokenType.SELF) && checkNext(TokenType.DOT)) {
            throw error(peek(), "Singleton method definitions (def self.x) are not supported");
        }
        Token name = peek();
        if (name.type() != TokenType.IDENTIFIER) throw error(name, "Expected method name");
        advance();
        if (check(TokenType.ASSIGN) && !peek().spaceBefore()) {
            throw error(peek(), "Setter methods are not supported");
        }

        List<Node> params = new ArrayList<>();
        Position paramsAt = position(peek());
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN)) {
                do { params.add(parseParam()); } while (match(TokenType.COMMA));
            }
            consume(TokenType.RPAREN, "Expected ')' after parameters");
        } else if (!atStatementEnd()) {
            do { params.add(parseParam()); } while (match(TokenType.COMMA));
        }

        Node b = body(position(defTok), parseStatements(EnumSet.of(TokenType.END)));
        consume(TokenType.END, "Expected 'end' to close method " + name.lexeme());

        List<Node> children = new ArrayList<>();
        children.add(Node.leaf(NodeKind.IDENTIFIER, name.lexeme(), position(name)));
        children.add(Node.of(NodeKind.PARAMS, paramsAt, params));
        children.add(b);
        children.addAll(docTags(defTok.line()));
        children.addAll(extraTags);
        return Node.of(NodeKind.METHOD_DEF, position(defTok), children);
    }

    private Node parseParam() {
        Token t = peek();
        switch (t.type()) {
            case IDENTIFIER -> {
                advance();
                if (check(TokenType.ASSIGN)) throw error(peek(), "Default parameter values are not supported");
                return Node.leaf(NodeKind.PARAM, t.lexeme(), position(t));
            }
            case LABEL -> throw error(t, "Keyword arguments are not supported");
            case STAR, POW -> throw error(t, "Splat parameters are not supported");
            default -> throw error(t, "Expected parameter name");
        }
    }

    // contiguous comment lines directly above `def` that start with '@'
    private List<Node> docTags(int defLine) {
        List<Node> tags = new ArrayList<>();
        int l = defLine - 1;
        while (comments.containsKey(l)) l--;
        for (int i = l + 1; i < defLine; i++) {
            String text = comments.get(i);
            if (text.startsWith("@")) tags.add(Node.leaf(NodeKind.DOC_TAG, text, new Position(i, 1)));
        }
        return tags;
    }

    private Node parseIfRest(Position at, Node cond) {
        match(TokenType.THEN);
        Node thenB = body(at, parseStatements(EnumSet.of(TokenType.ELSIF, TokenType.ELSE, TokenType.END)));

        if (check(TokenType.ELSIF)) {
            Token elsif = advance();
            Node c = parseExpression();
            return Node.of(NodeKind.IF, at, cond, thenB, parseIfRest(position(elsif), c));
        }
        if (check(TokenType.ELSE)) {
            Token els = advance();
            Node elseB = body(position(els), parseStatements(EnumSet.of(TokenType.END)));
            consume(TokenType.END, "Expected 'end' to close if");
            return Node.of(NodeKind.IF, at, cond, thenB, elseB);
        }
        consume(TokenType.END, "Expected 'end' to close if");
        return Node.of(NodeKind.IF, at, cond, thenB);
    }

    private Node parseFor(Token forTok) {
        Token var = consume(TokenType.IDENTIFIER, "Expected loop variable after 'for'");
        if (check(TokenType.COMMA)) throw error(peek(), "Multiple loop variables are not supported");
        consume(TokenType.IN, "Expected 'in' after loop variable");
        Node iterable = parseLoopHeader();
        match(TokenType.DO);
        Node b = body(position(forTok), parseStatements(EnumSet.of(TokenType.END)));
        consume(TokenType.END, "Expected 'end' to close for");
        return Node.of(NodeKind.FOR, position(forTok),
                Node.leaf(NodeKind.PARAM, var.lexeme(), position(var)), iterable, b);
    }

    private Node parseLoopHeader() {
        boolean saved = noDoBlock;
        noDoBlock = true;
        try {
            return parseExpression();
        } finally {
            noDoBlock = saved;
        }
    }

    // ---------- expressions (precedence climbing) ----------
    private Node parseExpression() { return parseLowOr(); }

    private Node parseLowOr() {
        Node e = parseLowAnd();
        while (check(TokenType.OR)) {
            Token op = advance();
            skipNewlines();
            e = binary(op, "||", e, parseLowAnd());
        }
        return e;
    }

    private Node parseLowAnd() {
        Node e = parseLowNot();
        while (check(TokenType.AND)) {
            Token op = advance();
            skipNewlines();
            e = binary(op, "&&", e, parseLowNot());
        }
        return e;
    }

    private Node parseLowNot() {
        if (check(TokenType.NOT)) {
            Token op = advance();
            return Node.named(NodeKind.UNARY, "!", position(op), List.of(parseLowNot()));
        }
        return parseAssign();
    }

    private Node parseAssign() {
        Node left = parseTernary();
        if (check(TokenType.ASSIGN) || check(TokenType.OP_ASSIGN)) {
            Token op = advance();
            if (!isAssignable(left)) throw error(op, "Invalid assignment target");
            skipNewlines();
            Node right = parseAssign(); // right-assoc
            if (op.type() == TokenType.ASSIGN) {
                return Node.of(NodeKind.ASSIGN, left.position(), left, right);
            }
            String operator = op.lexeme().substring(0, op.lexeme().length() - 1);
            return Node.named(NodeKind.OP_ASSIGN, operator, left.position(), List.of(left, right));
        }
        return left;
    }

    private static boolean isAssignable(Node n) {
        return switch (n.kind()) {
            case IDENTIFIER, IVAR, INDEX, CONSTANT -> true;
            default -> false;
        };
    }

    private Node parseTernary() {
        Node cond = parseRange();
        if (check(TokenType.QUESTION)) {
            advance();
            skipNewlines();
            Node a = parseTernary();
            skipNewlines();
            consume(TokenType.COLON, "Expected ':' in conditional expression");
            skipNewlines();
            Node b = parseTernary();
            return Node.of(NodeKind.TERNARY, cond.position(), cond, a, b);
        }
        return cond;
    }

    private Node parseRange() {
        Node e = parseOrOr();
        if (check(TokenType.DOT2) || check(TokenType.DOT3)) {
            Token op = advance();
            Node to = parseOrOr();
            return Node.named(NodeKind.RANGE, op.lexeme(), e.position(), List.of(e, to));
        }
        return e;
    }

    private Node parseOrOr() {
        Node e = parseAndAnd();
        while (check(TokenType.OROR)) {
            Token op = advance();
            skipNewlines();
            e = binary(op, "||", e, parseAndAnd());
        }
        return e;
    }

    private Node parseAndAnd() {
        Node e = parseEquality();
        while (check(TokenType.ANDAND)) {
            Token op = advance();
            skipNewlines();
            e = binary(op, "&&", e, parseEquality());
        }
        return e;
    }

    private Node parseEquality() {
        Node e = parseCompare();
        while (check(TokenType.EQ) || check(TokenType.NEQ)) {
            Token op = advance();
            skipNewlines();
            e = binary(op, op.lexeme(), e, parseCompare());
        }
        return e;
    }

    private Node parseCompare() {
        Node e = parseShift();
        while (check(TokenType.LT) || check(TokenType.LE) || check(TokenType.GT) || check(TokenType.GE)) {
            Token op = advance();
            skipNewlines();
            e = binary(op, op.lexeme(), e, parseShift());
        }
        return e;
    }

    private Node parseShift() {
        Node e = parseAdd();
        while (check(TokenType.SHL) || check(TokenType.SHR)) {
            Token op = advance();
            skipNewlines();
            e = binary(op, op.lexeme(), e, parseAdd());
        }
        return e;
    }

    private Node parseAdd() {
        Node e = parseMul();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token op = advance();
            skipNewlines();
            e = binary(op, op.lexeme(), e, parseMul());
        }
        return e;
    }

    private Node parseMul() {
        Node e = parseUnary();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.PERCENT)) {
            Token op = advance();
            skipNewlines();
            e = binary(op, op.lexeme(), e, parseUnary());
        }
        return e;
    }

    private Node parseUnary() {
        if (check(TokenType.BANG)) {
            Token op = advance();
            return Node.named(NodeKind.UNARY, "!", position(op), List.of(parseUnary()));
        }
        if (check(TokenType.MINUS)) {
            Token op = advance();
            return Node.named(NodeKind.UNARY, "-", position(op), List.of(parseUnary()));
        }
        return parsePower();
    }

    private Node parsePower() {
        Node base = parsePostfix();
        if (check(TokenType.POW)) {
            Token op = advance();
            skipNewlines();
            return binary(op, "**", base, parseUnary()); // right-assoc
        }
        return base;
    }

    private Node parsePostfix() {
        Node e = parsePrimary();
        while (true) {
            if (check(TokenType.DOT)) {
                advance();
                skipNewlines();
                Token name = peek();
                if (name.type() != TokenType.IDENTIFIER && name.type() != TokenType.CONSTANT) {
                    throw error(name, "Expected method name after '.'");
                }
                advance();
                List<Node> args = new ArrayList<>();
                args.add(e);
                if (check(TokenType.LPAREN) && !peek().spaceBefore()) {
                    args.addAll(parseParenArgs());
                } else if (startsCommandArg()) {
                    args.addAll(parseCommandArgs());
                }
                e = Node.named(NodeKind.METHOD_CALL, name.lexeme(), position(name), args);
                e = maybeBlock(e);
                continue;
            }
            if (check(TokenType.LBRACKET) && !peek().spaceBefore()) {
                Token open = advance();
                Node idx = parseArg();
                if (check(TokenType.COMMA)) throw error(peek(), "Multi-dimensional indexing is not supported");
                consume(TokenType.RBRACKET, "Expected ']'");
                e = Node.of(NodeKind.INDEX, position(open), e, idx);
                continue;
            }
            if (e.is(NodeKind.CALL)) {
                Node withBlock = maybeBlock(e);
                if (withBlock != e) {
                    e = withBlock;
                    continue;
                }
            }
            break;
        }
        return e;
    }

    private Node maybeBlock(Node call) {
        boolean doBlock = check(TokenType.DO) && !noDoBlock;
        boolean braceBlock = check(TokenType.LBRACE);
        if (!doBlock && !braceBlock) return call;

        Token open = advance();
        Node receiver;
        if (call.is(NodeKind.METHOD_CALL)) {
            if (call.childCount() > 1) throw error(open, "Blocks on calls with arguments are not supported");
            receiver = call.child(0);
        } else {
            if (call.childCount() > 0) throw error(open, "Blocks on calls with arguments are not supported");
            receiver = Node.leaf(NodeKind.SELF, null, call.position());
        }

        List<Node> params = new ArrayList<>();
        Position paramsAt = position(peek());
        if (match(TokenType.PIPE)) {
            if (!check(TokenType.PIPE)) {
                do {
                    Token p = consume(TokenType.IDENTIFIER, "Expected block parameter name");
                    params.add(Node.leaf(NodeKind.PARAM, p.lexeme(), position(p)));
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.PIPE, "Expected '|' after block parameters");
        } else {
            match(TokenType.OROR);
        }

        boolean saved = noDoBlock;
        noDoBlock = false;
        List<Node> stmts;
        try {
            TokenType close = doBlock ? TokenType.END : TokenType.RBRACE;
            stmts = parseStatements(EnumSet.of(close));
            consume(close, doBlock ? "Expected 'end' to close block" : "Expected '}' to close block");
        } finally {
            noDoBlock = saved;
        }

        return Node.named(NodeKind.ITERATION, call.text(), call.position(), List.of(
                receiver,
                Node.of(NodeKind.BLOCK_PARAMS, paramsAt, params),
                body(position(open), stmts)));
    }

    private Node parsePrimary() {
        Token t = peek();
        switch (t.type()) {
            case INT_LITERAL -> {
                advance();
                return Node.leaf(NodeKind.INTEGER, integerValue(t), position(t));
            }
            case FLOAT_LITERAL -> {
                advance();
                return Node.leaf(NodeKind.FLOAT, t.lexeme(), position(t));
            }
            case STRING_LITERAL -> {
                advance();
                return Node.leaf(NodeKind.STRING, t.lexeme(), position(t));
            }
            case ISTRING_LITERAL -> {
                advance();
                return Node.leaf(NodeKind.INTERPOLATED_STRING, t.lexeme(), position(t));
            }
            case SYMBOL -> {
                advance();
                return Node.leaf(NodeKind.SYMBOL, t.lexeme(), position(t));
            }
            case TRUE, FALSE -> {
                advance();
                return Node.leaf(NodeKind.BOOLEAN, t.type() == TokenType.TRUE, position(t));
            }
            case NIL -> {
                advance();
                return Node.leaf(NodeKind.NIL, null, position(t));
            }
            case SELF -> {
                advance();
                return Node.leaf(NodeKind.SELF, null, position(t));
            }
            case IVAR -> {
                advance();
                return Node.leaf(NodeKind.IVAR, t.lexeme(), position(t));
            }
            case CONSTANT -> {
                Node path = parseConstantPath("Expected constant");
                if (check(TokenType.LPAREN) && !peek().spaceBefore()) {
                    return Node.named(NodeKind.CALL, path.text(), path.position(), parseParenArgs());
                }
                return path;
            }
            case IDENTIFIER -> {
                advance();
                if (check(TokenType.LPAREN) && !peek().spaceBefore()) {
                    return Node.named(NodeKind.CALL, t.lexeme(), position(t), parseParenArgs());
                }
                if (startsCommandArg()) {
                    return Node.named(NodeKind.CALL, t.lexeme(), position(t), parseCommandArgs());
                }
                return Node.leaf(NodeKind.IDENTIFIER, t.lexeme(), position(t));
            }
            case LPAREN -> {
                advance();
                boolean saved = noDoBlock;
                noDoBlock = false;
                try {
                    Node e = parseExpression();
                    consume(TokenType.RPAREN, "Expected ')'");
                    return e;
                } finally {
                    noDoBlock = saved;
                }
            }
            case LBRACKET -> {
                return parseArrayLiteral();
            }
            case LBRACE -> {
                return parseHashLiteral();
            }
            default -> throw error(t, "Expected expression");
        }
    }

    private Node parseArrayLiteral() {
        Token open = consume(TokenType.LBRACKET, "Expected '['");
        List<Node> elems = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            elems.add(parseArg());
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RBRACKET, "Expected ']'");
        return Node.of(NodeKind.ARRAY, position(open), elems);
    }

    private Node parseHashLiteral() {
        Token open = consume(TokenType.LBRACE, "Expected '{'");
        List<Node> pairs = new ArrayList<>();
        skipNewlines();
        while (!check(TokenType.RBRACE)) {
            pairs.add(parsePair());
            skipNewlines();
            if (!match(TokenType.COMMA)) break;
            skipNewlines();
        }
        skipNewlines();
        consume(TokenType.RBRACE, "Expected '}' to close hash");
        return Node.of(NodeKind.HASH, position(open), pairs);
    }

    private Node parsePair() {
        if (check(TokenType.LABEL)) {
            Token label = advance();
            skipNewlines();
            Node key = Node.leaf(NodeKind.SYMBOL, label.lexeme(), position(label));
            return Node.of(NodeKind.PAIR, position(label), key, parseArg());
        }
        Node key = parseArg();
        consume(TokenType.ARROW, "Expected '=>' in hash literal");
        skipNewlines();
        return Node.of(NodeKind.PAIR, key.position(), key, parseArg());
    }

    private List<Node> parseParenArgs() {
        consume(TokenType.LPAREN, "Expected '('");
        List<Node> args = check(TokenType.RPAREN) ? new ArrayList<>() : parseArgList();
        consume(TokenType.RPAREN, "Expected ')' after arguments");
        return args;
    }

    private List<Node> parseCommandArgs() {
        return parseArgList();
    }

    // trailing `key: value` arguments are gathered into one hash argument
    private List<Node> parseArgList() {
        List<Node> args = new ArrayList<>();
        List<Node> pairs = new ArrayList<>();
        Position pairsAt = null;
        do {
            skipNewlines();
            if (check(TokenType.LABEL)) {
                if (pairsAt == null) pairsAt = position(peek());
                pairs.add(parsePair());
            } else {
                if (!pairs.isEmpty()) throw error(peek(), "Positional argument after keyword arguments");
                args.add(parseArg());
            }
        } while (match(TokenType.COMMA));
        if (!pairs.isEmpty()) args.add(Node.of(NodeKind.HASH, pairsAt, pairs));
        return args;
    }

    private Node parseArg() {
        return parseAssign();
    }

    private boolean startsCommandArg() {
        Token t = peek();
        if (!t.spaceBefore() || !COMMAND_ARG_START.contains(t.type())) return false;
        // `foo [1]` and `foo (x)` are arguments; `foo[1]` and `foo(x)` were handled by the caller
        return true;
    }

    // ---------- helpers ----------
    private static Node negate(Node cond) {
        return Node.named(NodeKind.UNARY, "!", cond.position(), List.of(cond));
    }

    private static Node binary(Token op, String operator, Node left, Node right) {
        return Node.named(NodeKind.BINARY, operator, position(op), List.of(left, right));
    }

    private Object integerValue(Token t) {
        String text = t.lexeme();
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) return new BigInteger(text.substring(2), 16);
            if (text.indexOf('e') >= 0 || text.indexOf('E') >= 0) return new BigDecimal(text).toBigIntegerExact();
            return new BigInteger(text);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw error(t, "Malformed integer literal");
        }
    }

    private boolean atStatementEnd() {
        return switch (peek().type()) {
            case NEWLINE, EOF, END, IF, UNLESS, WHILE, UNTIL, RBRACE -> true;
            default -> false;
        };
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE)) advance();
    }

    private boolean match(TokenType t) {
        if (check(t)) { advance(); return true; }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private static Position position(Token t) {
        return new Position(t.line(), t.column());
    }

    private static int line(Node n) { return n.position() == null ? 0 : n.position().line(); }
    private static int column(Node n) { return n.position() == null ? 0 : n.position().column(); }

    private ParseException error(Token at, String msg) {
        String got = at.type() == TokenType.EOF ? "end of input"
                : at.type() + " '" + at.lexeme() + "'";
        return new ParseException(at.line(), at.column(), msg + " (got " + got + ")");
    }
}
