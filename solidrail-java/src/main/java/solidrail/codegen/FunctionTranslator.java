package solidrail.codegen;

import solidrail.ast.Node;
import solidrail.ast.NodeKind;
import solidrail.ir.EnumSpec;
import solidrail.ir.EventSpec;
import solidrail.ir.FunctionSpec;
import solidrail.ir.Parameter;
import solidrail.ir.Statement;
import solidrail.ir.Statement.Assign;
import solidrail.ir.Statement.AssertCheck;
import solidrail.ir.Statement.Branch;
import solidrail.ir.Statement.Break;
import solidrail.ir.Statement.Conditional;
import solidrail.ir.Statement.Continue;
import solidrail.ir.Statement.EventEmit;
import solidrail.ir.Statement.ExpressionStatement;
import solidrail.ir.Statement.ForLoop;
import solidrail.ir.Statement.LocalDeclaration;
import solidrail.ir.Statement.RequireCheck;
import solidrail.ir.Statement.Return;
import solidrail.ir.Statement.Revert;
import solidrail.ir.Statement.WhileLoop;
import solidrail.ir.StateVariable;
import solidrail.types.ArrayType;
import solidrail.types.ElementaryType;
import solidrail.types.MappingType;
import solidrail.types.Mutability;
import solidrail.types.StaticType;
import solidrail.types.TypeMapper;
import solidrail.types.Visibility;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Translates one method definition into a {@link FunctionSpec}.
 *
 * <p>Statements and expressions are dispatched on {@link NodeKind} with exhaustive switches.
 * Locals live in a {@link LocalScope}; index loops bind the sequence length once, before the
 * loop, and reads of that length inside the loop use the cached local.
 */
final class FunctionTranslator {
    private static final Set<String> GLOBAL_NAMESPACES = Set.of("msg", "block", "tx", "abi");
    private static final Set<String> BUILTIN_FUNCTIONS = Set.of(
            "payable", "address", "keccak256", "sha256", "ripemd160", "ecrecover", "blockhash",
            "gasleft", "addmod", "mulmod", "selfdestruct");
    private static final Set<String> STATEMENT_ONLY = Set.of("require", "assert", "emit", "raise", "fail", "revert");
    private static final Set<String> OUTPUT_CALLS = Set.of("puts", "print", "p", "pp");
    private static final Set<String> LENGTH_METHODS = Set.of("length", "size", "count");
    private static final Set<String> SIDE_EFFECT_METHODS = Set.of("push", "append", "pop", "transfer", "send", "call");
    private static final String[] INDEX_NAMES = {"i", "j", "k"};

    // binding strength, higher binds tighter
    private static final int PREC_TERNARY = 1;
    private static final int PREC_UNARY = 9;
    private static final int PREC_POSTFIX = 11;
    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("||", 2), Map.entry("&&", 3),
            Map.entry("==", 4), Map.entry("!=", 4),
            Map.entry("<", 5), Map.entry("<=", 5), Map.entry(">", 5), Map.entry(">=", 5),
            Map.entry("<<", 6), Map.entry(">>", 6),
            Map.entry("+", 7), Map.entry("-", 7),
            Map.entry("*", 8), Map.entry("/", 8), Map.entry("%", 8),
            Map.entry("**", 10));

    private final ContractBuilder contract;
    private final ExpressionTypes types;
    private final Node method;
    private final String rubyName;
    private final boolean constructor;
    private final DocTags tags;
    private final LocalScope scope;

    // rendered sequence expression -> cached length local, while inside its loop
    private final Map<String, String> cachedLengths = new HashMap<>();
    private final List<StaticType> returnTypes = new ArrayList<>();
    private final Set<String> assignedLocals = new HashSet<>();
    private int loopDepth = 0;

    FunctionTranslator(ContractBuilder contract, ExpressionTypes types, Node method) {
        this.contract = contract;
        this.types = types;
        this.method = method;
        this.rubyName = method.child(0).text();
        this.constructor = rubyName.equals("initialize");
        this.tags = DocTags.of(method);
        this.scope = new LocalScope(contract.memberNames());
        for (Node a : method.findNodes(NodeKind.ASSIGN)) {
            if (a.child(0).is(NodeKind.IDENTIFIER)) assignedLocals.add(a.child(0).text());
        }
    }

    FunctionSpec translate() {
        scope.push();
        List<Parameter> params = new ArrayList<>();
        for (Map.Entry<String, StaticType> p : contract.parameterTypes(method).entrySet()) {
            LocalScope.Local local = scope.declare(p.getKey(), p.getValue());
            params.add(new Parameter(local.name(), local.type()));
        }
        List<Statement> body = new ArrayList<>();
        List<Node> stmts = method.child(2).children();
        for (int i = 0; i < stmts.size(); i++) {
            Node s = stmts.get(i);
            body.addAll(hoistLocals(stmts, i));
            if (i == stmts.size() - 1 && !constructor && yieldsValue(s)) {
                body.add(returnValue(s));
            } else {
                body.addAll(statement(s));
            }
        }
        scope.pop();

        Mutability mutability = TypeMapper.mapMutability(tags.markers());
        if (constructor) {
            if (tags.returnType() != null) {
                contract.warn(method.where() + "Ignoring @return on initialize; constructors return nothing");
            }
            if (mutability == Mutability.VIEW || mutability == Mutability.PURE) {
                contract.warn(method.where() + "Ignoring @" + mutability.keyword() + " on initialize");
                mutability = Mutability.NONE;
            }
            return new FunctionSpec("constructor", FunctionSpec.Kind.CONSTRUCTOR, params,
                    Visibility.PUBLIC, mutability, null, body);
        }
        return new FunctionSpec(contract.functionName(rubyName), FunctionSpec.Kind.FUNCTION, params,
                contract.visibilityOf(rubyName, tags), mutability, returnType(), body);
    }

    private StaticType returnType() {
        String declared = tags.returnType();
        if (declared != null) {
            if (declared.equals("void") || declared.equals("NilClass") || declared.equals("nil")) return null;
            Optional<StaticType> t = TypeMapper.mapDeclared(declared);
            if (t.isEmpty()) throw error(method, "Unsupported return type [" + declared + "] for " + rubyName);
            return t.get();
        }
        for (StaticType t : returnTypes) {
            if (t != null) return t;
        }
        return returnTypes.isEmpty() ? null : ElementaryType.UINT256;
    }

    // ---------- statements ----------

    private List<Statement> block(Node body) {
        scope.push();
        try {
            return statements(body);
        } finally {
            scope.pop();
        }
    }

    private List<Statement> statements(Node body) {
        List<Statement> out = new ArrayList<>();
        List<Node> stmts = body.children();
        for (int i = 0; i < stmts.size(); i++) {
            out.addAll(hoistLocals(stmts, i));
            out.addAll(statement(stmts.get(i)));
        }
        return out;
    }

    /**
     * Ruby locals belong to the method, not to the branch or loop that first assigns them.
     * A local first assigned inside {@code stmts[index]} and read by a later statement is
     * declared ahead of it, so the assignments inside become plain stores.
     */
    private List<Statement> hoistLocals(List<Node> stmts, int index) {
        Node n = stmts.get(index);
        if (!n.is(NodeKind.IF) && !n.is(NodeKind.WHILE) && !n.is(NodeKind.FOR)) return List.of();

        Map<String, List<Node>> assigned = new LinkedHashMap<>();
        collectAssignments(n, assigned);
        List<Statement> out = new ArrayList<>();
        for (Map.Entry<String, List<Node>> e : assigned.entrySet()) {
            String name = e.getKey();
            if (scope.resolve(name) != null || !usedAfter(stmts, index, name)) continue;
            StaticType type = null;
            for (Node value : e.getValue()) {
                type = types.find(value, scope::typeOf);
                if (type != null) break;
            }
            if (type == null) {
                Node first = e.getValue().get(0);
                if (first.is(NodeKind.NIL)) throw error(first, "Cannot infer a type for '" + name + "' from nil");
                type = ElementaryType.UINT256;
            }
            if (type instanceof MappingType) {
                throw error(e.getValue().get(0), "Local variable '" + name + "' cannot hold a mapping");
            }
            LocalScope.Local local = scope.declare(name, type);
            out.add(new LocalDeclaration(type, local.name(), null));
        }
        return out;
    }

    // values assigned to plain locals, by name in first-seen order; iteration blocks keep their own locals
    private static void collectAssignments(Node n, Map<String, List<Node>> out) {
        if (n.is(NodeKind.ITERATION) || n.is(NodeKind.METHOD_DEF) || n.is(NodeKind.CLASS)) return;
        if (n.is(NodeKind.ASSIGN) && n.child(0).is(NodeKind.IDENTIFIER)) {
            out.computeIfAbsent(n.child(0).text(), k -> new ArrayList<>()).add(n.child(1));
        }
        for (Node c : n.children()) collectAssignments(c, out);
    }

    private static boolean usedAfter(List<Node> stmts, int index, String name) {
        for (int i = index + 1; i < stmts.size(); i++) {
            for (Node id : stmts.get(i).findNodes(NodeKind.IDENTIFIER)) {
                if (id.text().equals(name)) return true;
            }
        }
        return false;
    }

    private List<Statement> statement(Node n) {
        return switch (n.kind()) {
            case ASSIGN -> assign(n);
            case OP_ASSIGN -> List.of(opAssign(n));
            case IF -> List.of(conditional(n));
            case WHILE -> List.of(new WhileLoop(expr(n.child(0)), block(n.child(1))));
            case FOR -> forLoop(n);
            case ITERATION -> iteration(n);
            case RETURN -> List.of(returnStatement(n));
            case BREAK -> List.of(new Break());
            case NEXT -> List.of(new Continue());
            case CALL -> callStatement(n);
            case NIL -> List.of();
            case METHOD_CALL, INDEX, TERNARY, BINARY, UNARY, IDENTIFIER, IVAR, CONSTANT, SELF,
                    INTEGER, FLOAT, STRING, INTERPOLATED_STRING, SYMBOL, BOOLEAN, ARRAY, HASH, RANGE ->
                    List.of(new ExpressionStatement(expr(n)));
            case CLASS -> throw error(n, "Nested class definitions are not supported");
            case METHOD_DEF -> throw error(n, "Nested method definitions are not supported");
            case IMPORT, INCLUDE, VISIBILITY ->
                    throw error(n, "'" + n.kind().name().toLowerCase() + "' is only allowed at class level");
            case PROGRAM, BODY, PARAMS, BLOCK_PARAMS, PARAM, DOC_TAG, PAIR ->
                    throw new IllegalStateException("Unexpected " + n.kind() + " in statement position");
        };
    }

    private List<Statement> assign(Node n) {
        if (contract.isInlined(n)) return List.of();
        Node target = n.child(0);
        Node value = n.child(1);
        switch (target.kind()) {
            case IVAR -> { return fieldAssign(target, value); }
            case IDENTIFIER -> { return List.of(localAssign(target, value)); }
            case INDEX -> { return List.of(new Assign(expr(target), "", expr(value))); }
            case CONSTANT -> throw error(n, "Constants can only be assigned at class level");
            default -> throw error(n, "Invalid assignment target " + target.kind());
        }
    }

    private List<Statement> fieldAssign(Node target, Node value) {
        String field = fieldName(target);
        if (value.is(NodeKind.HASH)) {
            if (value.childCount() == 0) {
                throw error(value, "Mapping " + field + " cannot be reset; assign individual keys instead");
            }
            List<Statement> out = new ArrayList<>();
            for (Node pair : value.children()) {
                out.add(new Assign(field + "[" + expr(pair.child(0)) + "]", "", expr(pair.child(1))));
            }
            return out;
        }
        if (value.is(NodeKind.ARRAY)) {
            List<Statement> out = new ArrayList<>();
            if (!constructor) out.add(new ExpressionStatement("delete " + field));
            for (Node element : value.children()) {
                out.add(new ExpressionStatement(field + ".push(" + expr(element) + ")"));
            }
            return out;
        }
        return List.of(new Assign(field, "", expr(value)));
    }

    private Statement localAssign(Node target, Node value) {
        LocalScope.Local existing = scope.resolve(target.text());
        if (existing != null) return new Assign(existing.name(), "", expr(value));
        if (value.is(NodeKind.NIL)) {
            throw error(value, "Cannot infer a type for '" + target.text() + "' from nil");
        }
        String rendered = expr(value);
        StaticType type = types.typeOf(value, scope::typeOf);
        if (type instanceof MappingType) {
            throw error(value, "Local variable '" + target.text() + "' cannot hold a mapping");
        }
        LocalScope.Local local = scope.declare(target.text(), type);
        return new LocalDeclaration(type, local.name(), rendered);
    }

    private Statement opAssign(Node n) {
        String op = n.text();
        if (!Set.of("+", "-", "*", "/", "%").contains(op)) {
            throw error(n, "Operator '" + op + "=' is not supported");
        }
        Node target = n.child(0);
        if (target.is(NodeKind.IDENTIFIER) && scope.resolve(target.text()) == null) {
            throw error(target, "Undefined local variable '" + target.text() + "'");
        }
        if (target.is(NodeKind.CONSTANT)) throw error(n, "Constants cannot be reassigned");
        return new Assign(expr(target), op, expr(n.child(1)));
    }

    private Statement conditional(Node n) {
        List<Branch> branches = new ArrayList<>();
        List<Statement> elseBody = null;
        Node cur = n;
        while (true) {
            branches.add(new Branch(expr(cur.child(0)), block(cur.child(1))));
            if (cur.childCount() < 3) break;
            Node rest = cur.child(2);
            if (rest.is(NodeKind.IF)) {
                cur = rest;
                continue;
            }
            elseBody = block(rest);
            break;
        }
        return new Conditional(branches, elseBody);
    }

    private Statement returnStatement(Node n) {
        if (n.childCount() == 0) return new Return(null);
        if (constructor) throw error(n, "initialize cannot return a value");
        return returnValue(n.child(0));
    }

    private Statement returnValue(Node value) {
        returnTypes.add(types.find(value, scope::typeOf));
        return new Return(expr(value));
    }

    // a trailing expression is the method's value
    private boolean yieldsValue(Node n) {
        return switch (n.kind()) {
            case INTEGER, STRING, SYMBOL, BOOLEAN, IVAR, INDEX, UNARY, TERNARY, CONSTANT -> true;
            case BINARY -> !(n.text().equals("<<") && types.find(n.child(0), scope::typeOf) instanceof ArrayType);
            case IDENTIFIER -> scope.resolve(n.text()) != null
                    || contract.hasMethod(n.text()) && contract.returnTypeOf(n.text()) != null;
            case METHOD_CALL -> !SIDE_EFFECT_METHODS.contains(n.text()) && types.find(n, scope::typeOf) != null;
            case CALL -> !STATEMENT_ONLY.contains(n.text()) && contract.hasMethod(n.text())
                    && contract.returnTypeOf(n.text()) != null;
            default -> false;
        };
    }

    private List<Statement> callStatement(Node n) {
        String fn = n.text();
        List<Node> args = n.children();
        switch (fn) {
            case "require" -> {
                if (args.isEmpty() || args.size() > 2) {
                    throw error(n, "require expects a condition and an optional message");
                }
                String message = args.size() == 2 ? expr(args.get(1)) : null;
                return List.of(new RequireCheck(expr(args.get(0)), message));
            }
            case "assert" -> {
                if (args.size() != 1) throw error(n, "assert expects exactly one condition");
                return List.of(new AssertCheck(expr(args.get(0))));
            }
            case "raise", "fail", "revert" -> {
                return List.of(revert(n));
            }
            case "emit" -> {
                return List.of(emit(n));
            }
            case "attr_reader", "attr_writer", "attr_accessor" ->
                    throw error(n, fn + " is only allowed at class level");
            default -> { }
        }
        if (OUTPUT_CALLS.contains(fn)) {
            contract.warn(n.where() + "Ignoring '" + fn + "'; contracts have no standard output");
            return List.of();
        }
        return List.of(new ExpressionStatement(expr(n)));
    }

    private Statement revert(Node n) {
        List<Node> args = n.children();
        if (args.isEmpty()) return new Revert(null);
        Node last = args.get(args.size() - 1);
        if (last.is(NodeKind.STRING)) return new Revert(Names.quote(last.text()));
        if (last.is(NodeKind.CONSTANT)) return new Revert(Names.quote(ContractBuilder.lastSegment(last.text())));
        if (last.is(NodeKind.METHOD_CALL) && last.text().equals("new") && last.childCount() == 2
                && last.child(1).is(NodeKind.STRING)) {
            return new Revert(Names.quote(last.child(1).text()));
        }
        return new Revert(expr(last));
    }

    private Statement emit(Node n) {
        if (n.childCount() == 0) throw error(n, "emit expects an event");
        Node first = n.child(0);
        String event;
        List<Node> args = new ArrayList<>();
        switch (first.kind()) {
            case CALL -> {
                if (n.childCount() > 1) throw error(n, "emit takes a single event call");
                event = ContractBuilder.lastSegment(first.text());
                args.addAll(first.children());
            }
            case SYMBOL, STRING -> {
                event = Names.toPascalCase(first.text());
                args.addAll(n.children().subList(1, n.childCount()));
            }
            case CONSTANT -> {
                event = ContractBuilder.lastSegment(first.text());
                args.addAll(n.children().subList(1, n.childCount()));
            }
            default -> throw error(first, "emit expects an event name");
        }

        List<String> rendered = new ArrayList<>();
        List<Parameter> params = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (Node arg : args) {
            if (arg.is(NodeKind.HASH)) {
                for (Node pair : arg.children()) {
                    rendered.add(expr(pair.child(1)));
                    params.add(new Parameter(uniqueParam(pair.child(0).text(), used, params.size()),
                            types.typeOf(pair.child(1), scope::typeOf)));
                }
                continue;
            }
            rendered.add(expr(arg));
            params.add(new Parameter(uniqueParam(eventParamName(arg), used, params.size()),
                    types.typeOf(arg, scope::typeOf)));
        }
        contract.registerEvent(n, new EventSpec(event, params));
        return new EventEmit(event, rendered);
    }

    private String eventParamName(Node arg) {
        switch (arg.kind()) {
            case IDENTIFIER -> {
                LocalScope.Local l = scope.resolve(arg.text());
                return l == null ? arg.text() : l.sourceName();
            }
            case IVAR -> { return arg.text(); }
            case METHOD_CALL -> {
                if (arg.childCount() == 1) return arg.text();
            }
            default -> { }
        }
        return null;
    }

    private static String uniqueParam(String candidate, Set<String> used, int index) {
        String name = candidate == null ? "arg" + index : candidate.replaceFirst("^_+", "").replaceAll("[?!]$", "");
        if (name.isEmpty()) name = "arg" + index;
        name = Names.safeIdentifier(Names.toCamelCase(name));
        if (!used.add(name)) {
            name = name + index;
            used.add(name);
        }
        return name;
    }

    // ---------- loops ----------

    private List<Statement> forLoop(Node n) {
        String var = n.child(0).text();
        Node iterable = n.child(1);
        if (iterable.is(NodeKind.RANGE)) return List.of(rangeLoop(iterable, var, n.child(2)));
        return sequenceLoop(iterable, var, null, n.child(2));
    }

    private List<Statement> iteration(Node n) {
        Node receiver = n.child(0);
        List<String> params = new ArrayList<>();
        for (Node p : n.child(1).children()) params.add(p.text());
        Node body = n.child(2);
        String first = params.isEmpty() ? null : params.get(0);
        String second = params.size() > 1 ? params.get(1) : null;

        switch (n.text()) {
            case "each" -> {
                if (receiver.is(NodeKind.RANGE)) return List.of(rangeLoop(receiver, first, body));
                return sequenceLoop(receiver, first, null, body);
            }
            case "each_with_index" -> { return sequenceLoop(receiver, first, second, body); }
            case "each_index" -> { return sequenceLoop(receiver, null, first, body); }
            case "times" -> {
                if (receiver.is(NodeKind.SELF)) throw error(n, "times needs a count");
                return List.of(countedLoop("0", "<", expr(receiver), first, body));
            }
            default -> throw error(n, "Iterator '" + n.text()
                    + "' is not supported; use each, each_with_index, each_index or times");
        }
    }

    private List<Statement> sequenceLoop(Node sequence, String elementName, String indexName, Node body) {
        String seq = operand(sequence, PREC_POSTFIX);
        StaticType seqType = types.find(sequence, scope::typeOf);
        if (seqType instanceof MappingType) {
            throw error(sequence, "Cannot iterate over mapping " + seq + "; keep a separate array of keys");
        }
        if (seqType != null && !(seqType instanceof ArrayType)) {
            throw error(sequence, "Cannot iterate over " + seq + " of type " + seqType.typeName());
        }
        StaticType elementType = seqType instanceof ArrayType a ? a.element() : elementTypeByName(sequence);

        List<Statement> out = new ArrayList<>();
        LocalScope.Local length = scope.declareSynthetic(lengthName(sequence), ElementaryType.UINT256);
        out.add(new LocalDeclaration(ElementaryType.UINT256, length.name(), seq + ".length"));

        String previous = cachedLengths.put(seq, length.name());
        scope.push();
        try {
            LocalScope.Local index = indexName != null
                    ? scope.declare(indexName, ElementaryType.UINT256)
                    : scope.declareSynthetic(nextIndexName(), ElementaryType.UINT256);
            List<Statement> loopBody = new ArrayList<>();
            loopDepth++;
            scope.push();
            try {
                if (elementName != null) {
                    LocalScope.Local element = scope.declare(elementName, elementType);
                    loopBody.add(new LocalDeclaration(elementType, element.name(), seq + "[" + index.name() + "]"));
                }
                loopBody.addAll(statements(body));
            } finally {
                scope.pop();
                loopDepth--;
            }
            out.add(new ForLoop(new LocalDeclaration(ElementaryType.UINT256, index.name(), "0"),
                    index.name() + " < " + length.name(), index.name() + "++", loopBody));
        } finally {
            scope.pop();
            if (previous == null) cachedLengths.remove(seq);
            else cachedLengths.put(seq, previous);
        }
        return out;
    }

    private Statement rangeLoop(Node range, String var, Node body) {
        String op = range.text().equals("..") ? "<=" : "<";
        return countedLoop(expr(range.child(0)), op, expr(range.child(1)), var, body);
    }

    private Statement countedLoop(String from, String op, String to, String var, Node body) {
        scope.push();
        try {
            LocalScope.Local index = var != null
                    ? scope.declare(var, ElementaryType.UINT256)
                    : scope.declareSynthetic(nextIndexName(), ElementaryType.UINT256);
            loopDepth++;
            List<Statement> loopBody;
            try {
                loopBody = block(body);
            } finally {
                loopDepth--;
            }
            return new ForLoop(new LocalDeclaration(ElementaryType.UINT256, index.name(), from),
                    index.name() + " " + op + " " + to, index.name() + "++", loopBody);
        } finally {
            scope.pop();
        }
    }

    private String nextIndexName() {
        return loopDepth < INDEX_NAMES.length ? INDEX_NAMES[loopDepth] : "i" + loopDepth;
    }

    private static String lengthName(Node sequence) {
        if (sequence.is(NodeKind.IDENTIFIER) || sequence.is(NodeKind.IVAR)) {
            String base = Names.toCamelCase(sequence.text().replaceFirst("^_+", ""));
            if (!base.isEmpty()) return base + "Length";
        }
        return "len";
    }

    private static StaticType elementTypeByName(Node sequence) {
        if (sequence.is(NodeKind.IDENTIFIER) || sequence.is(NodeKind.IVAR)) {
            return TypeMapper.inferElementFromName(sequence.text());
        }
        return ElementaryType.UINT256;
    }

    // ---------- expressions ----------

    String expr(Node n) {
        return switch (n.kind()) {
            case INTEGER -> n.value().toString();
            case FLOAT -> throw error(n, ContractBuilder.unmappableReason(n));
            case STRING -> Names.quote(n.text());
            case INTERPOLATED_STRING ->
                    throw error(n, "String interpolation is not supported; use string.concat instead");
            case SYMBOL -> contract.literal(n);
            case BOOLEAN -> n.value().toString();
            case NIL -> throw error(n, ContractBuilder.unmappableReason(n));
            case IDENTIFIER -> identifier(n);
            case IVAR -> fieldName(n);
            case CONSTANT -> constant(n);
            case SELF -> "address(this)";
            case CALL -> call(n);
            case METHOD_CALL -> methodCall(n);
            case INDEX -> operand(n.child(0), PREC_POSTFIX) + "[" + expr(n.child(1)) + "]";
            case TERNARY -> operand(n.child(0), PREC_TERNARY + 1) + " ? " + operand(n.child(1), PREC_TERNARY + 1)
                    + " : " + expr(n.child(2));
            case BINARY -> binary(n);
            case UNARY -> unary(n);
            case RANGE -> throw error(n, "Ranges are only supported as loop bounds");
            case ARRAY -> throw error(n, "Array literals are only supported as state variable initializers");
            case HASH -> throw error(n, "Hash literals are only supported as state variable initializers");
            case ITERATION -> throw error(n, "Blocks are only supported as loop statements");
            case ASSIGN, OP_ASSIGN -> throw error(n, "Assignments inside expressions are not supported");
            case IF, WHILE, FOR, RETURN, BREAK, NEXT ->
                    throw error(n, "'" + n.kind().name().toLowerCase() + "' cannot be used as a value");
            case PROGRAM, IMPORT, CLASS, BODY, INCLUDE, VISIBILITY, METHOD_DEF, PARAMS, BLOCK_PARAMS,
                    PARAM, DOC_TAG, PAIR ->
                    throw new IllegalStateException("Unexpected " + n.kind() + " in expression position");
        };
    }

    // rendered operand, parenthesized when it binds looser than `context`
    private String operand(Node n, int context) {
        String s = expr(n);
        return precedence(n) < context ? "(" + s + ")" : s;
    }

    private int precedence(Node n) {
        switch (n.kind()) {
            case TERNARY -> { return PREC_TERNARY; }
            case UNARY -> {
                return "-".equals(n.text()) && n.child(0).is(NodeKind.INTEGER) ? PREC_POSTFIX : PREC_UNARY;
            }
            case BINARY -> {
                if (isZeroDefault(n)) return precedence(n.child(0));
                if (isPush(n)) return PREC_POSTFIX;
                return BINARY_PRECEDENCE.getOrDefault(n.text(), PREC_TERNARY);
            }
            case METHOD_CALL -> {
                return switch (n.text()) {
                    case "empty?", "zero?", "nonzero?" -> BINARY_PRECEDENCE.get("==");
                    case "positive?", "negative?" -> BINARY_PRECEDENCE.get("<");
                    default -> PREC_POSTFIX;
                };
            }
            default -> { return PREC_POSTFIX; }
        }
    }

    private String identifier(Node n) {
        String name = n.text();
        LocalScope.Local local = scope.resolve(name);
        if (local != null) return local.name();
        if (contract.hasMethod(name)) return functionCall(n, name, List.of());
        if (GLOBAL_NAMESPACES.contains(name)) return name;
        if (assignedLocals.contains(name)) {
            throw error(n, "Local variable '" + name + "' is read where no assignment to it is visible");
        }
        if (contract.hasParents()) return Names.toFunctionName(name) + "()";
        throw error(n, "Undefined local variable or method '" + name + "'");
    }

    private String fieldName(Node ivar) {
        StateVariable v = contract.field(ivar.text());
        if (v == null) throw new IllegalStateException("Undeclared field @" + ivar.text());
        return v.name();
    }

    private String constant(Node n) {
        StateVariable c = contract.constant(n.text());
        if (c != null) return c.name();
        EnumSpec e = contract.enumOfConstant(n.text());
        if (e != null) return e.name();
        return n.text().replace("::", ".");
    }

    private String call(Node n) {
        String fn = n.text();
        if (STATEMENT_ONLY.contains(fn)) throw error(n, "'" + fn + "' can only be used as a statement");
        if (OUTPUT_CALLS.contains(fn)) throw error(n, "'" + fn + "' has no Solidity equivalent");
        for (Node arg : n.children()) {
            if (arg.is(NodeKind.HASH)) throw error(arg, "Keyword arguments are not supported");
        }
        if (BUILTIN_FUNCTIONS.contains(fn) || ElementaryType.isElementary(fn)) {
            return fn + "(" + arguments(n.children()) + ")";
        }
        if (Character.isUpperCase(fn.charAt(0))) {
            return fn.replace("::", ".") + "(" + arguments(n.children()) + ")";
        }
        if (contract.hasMethod(fn)) return functionCall(n, fn, n.children());
        if (fn.equals("initialize")) throw error(n, "initialize cannot be called directly");
        return Names.toFunctionName(fn) + "(" + arguments(n.children()) + ")";
    }

    private String functionCall(Node at, String fn, List<Node> args) {
        int arity = contract.arity(fn);
        if (arity != args.size()) {
            throw error(at, "Wrong number of arguments for " + fn + " (given " + args.size() + ", expected " + arity + ")");
        }
        return contract.functionName(fn) + "(" + arguments(args) + ")";
    }

    private String methodCall(Node n) {
        Node receiver = n.child(0);
        String fn = n.text();
        List<Node> args = n.children().subList(1, n.childCount());

        if (fn.equals("balance") && args.isEmpty()) return operand(receiver, PREC_POSTFIX) + ".balance";
        if (receiver.is(NodeKind.SELF)) {
            if (!contract.hasMethod(fn)) throw error(n, "Undefined method '" + fn + "' on self");
            return functionCall(n, fn, args);
        }
        if (receiver.is(NodeKind.IDENTIFIER) && GLOBAL_NAMESPACES.contains(receiver.text())
                && scope.resolve(receiver.text()) == null) {
            if (args.isEmpty()) return receiver.text() + "." + fn;
            return receiver.text() + "." + fn + "(" + arguments(args) + ")";
        }
        for (Node arg : args) {
            if (arg.is(NodeKind.HASH)) throw error(arg, "Keyword arguments are not supported");
        }

        String recv = operand(receiver, PREC_POSTFIX);
        if (LENGTH_METHODS.contains(fn)) {
            if (!args.isEmpty()) throw error(n, fn + " with arguments is not supported");
            String cached = cachedLengths.get(recv);
            return cached != null ? cached : recv + ".length";
        }
        switch (fn) {
            case "push", "append" -> {
                if (args.size() != 1) throw error(n, fn + " expects exactly one value");
                return recv + ".push(" + expr(args.get(0)) + ")";
            }
            case "pop" -> { return recv + ".pop()"; }
            case "transfer", "send" -> {
                if (args.size() != 1) throw error(n, fn + " expects exactly one amount");
                String target = recv.startsWith("payable(") ? recv : "payable(" + recv + ")";
                return target + ".transfer(" + expr(args.get(0)) + ")";
            }
            case "empty?" -> { return lengthOf(recv) + " == 0"; }
            case "zero?" -> { return recv + " == 0"; }
            case "nonzero?" -> { return recv + " != 0"; }
            case "positive?" -> { return recv + " > 0"; }
            case "negative?" -> { return recv + " < 0"; }
            case "nil?" -> throw error(n, "nil? has no Solidity equivalent; compare with a zero value");
            case "include?" -> throw error(n, "include? has no Solidity equivalent; keep a mapping(... => bool) index");
            case "freeze", "dup", "to_i" -> { return recv; }
            case "new" -> {
                if (receiver.is(NodeKind.CONSTANT)) return "new " + recv + "(" + arguments(args) + ")";
            }
            default -> { }
        }
        return recv + "." + Names.toFunctionName(fn) + "(" + arguments(args) + ")";
    }

    private String lengthOf(String recv) {
        String cached = cachedLengths.get(recv);
        return cached != null ? cached : recv + ".length";
    }

    private String binary(Node n) {
        String op = n.text();
        if (isZeroDefault(n)) return expr(n.child(0));
        if (isPush(n)) return operand(n.child(0), PREC_POSTFIX) + ".push(" + expr(n.child(1)) + ")";

        int p = BINARY_PRECEDENCE.getOrDefault(op, PREC_TERNARY);
        if (op.equals("**")) {
            return operand(n.child(0), PREC_POSTFIX) + " ** " + operand(n.child(1), PREC_POSTFIX);
        }
        return operand(n.child(0), p) + " " + op + " " + operand(n.child(1), p + 1);
    }

    private String unary(Node n) {
        Node operand = n.child(0);
        if (n.text().equals("-") && operand.is(NodeKind.INTEGER)) return "-" + operand.value();
        return n.text() + operand(operand, PREC_POSTFIX);
    }

    private boolean isPush(Node n) {
        return n.is(NodeKind.BINARY) && n.text().equals("<<")
                && types.find(n.child(0), scope::typeOf) instanceof ArrayType;
    }

    /** {@code a || 0}: Ruby's nil default; mapping reads already yield zero. */
    static boolean isZeroDefault(Node n) {
        return n.is(NodeKind.BINARY) && n.text().equals("||")
                && n.child(1).is(NodeKind.INTEGER) && BigInteger.ZERO.equals(n.child(1).value());
    }

    private String arguments(List<Node> args) {
        List<String> out = new ArrayList<>(args.size());
        for (Node a : args) out.add(expr(a));
        return String.join(", ", out);
    }

    private static CompilationException error(Node at, String message) {
        return new CompilationException(at.where() + message);
    }
}
