package solidrail.codegen;

import solidrail.ast.Node;
import solidrail.ast.NodeKind;
import solidrail.ir.ContractSpec;
import solidrail.ir.EnumSpec;
import solidrail.ir.EventSpec;
import solidrail.ir.FunctionSpec;
import solidrail.ir.StateVariable;
import solidrail.types.ArrayType;
import solidrail.types.ElementaryType;
import solidrail.types.MappingType;
import solidrail.types.StaticType;
import solidrail.types.TypeMapper;
import solidrail.types.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the {@link ContractSpec} of one Ruby class.
 *
 * <p>Class-level statements are read first (parents, sections, constants, method
 * definitions), then every instance field is declared, then each method is translated.
 * Translation failures are collected per method and reported together.
 */
final class ContractBuilder {
    private static final Set<String> ATTRIBUTE_MACROS = Set.of("attr_reader", "attr_writer", "attr_accessor");
    private static final Set<String> NUMERIC_OPERATORS = Set.of(
            "+", "-", "*", "/", "%", "**", "<", "<=", ">", ">=");
    private static final Set<String> VISIBILITY_WORDS = Set.of("public", "private", "protected");
    private static final Set<String> SEQUENCE_METHODS = Set.of(
            "length", "size", "count", "push", "pop", "first", "last", "empty?", "each",
            "each_with_index", "each_index");

    private final Node classNode;
    private final List<String> warnings;
    private final List<String> errors = new ArrayList<>();
    private final ExpressionTypes types = new ExpressionTypes(this);

    private final List<String> parents = new ArrayList<>();
    private final List<EnumSpec> enums = new ArrayList<>();
    private final Map<String, EnumSpec> enumBySymbol = new HashMap<>();
    private final Map<String, EnumSpec> enumByConstant = new HashMap<>();
    private final Map<String, StateVariable> constants = new LinkedHashMap<>();
    private final Map<String, StateVariable> fields = new LinkedHashMap<>();
    private final Map<String, Node> methods = new LinkedHashMap<>();
    private final Map<String, String> declaredVisibility = new HashMap<>();
    private final Set<Node> inlined = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<String, Integer> indexDepth = new HashMap<>();

    private final Map<String, FunctionSpec> translated = new HashMap<>();
    private final Set<String> translating = new HashSet<>();

    private final Map<Node, Integer> emitOrder = new IdentityHashMap<>();
    private final Map<String, Integer> eventRank = new HashMap<>();
    private final Map<String, EventSpec> events = new HashMap<>();

    private String name;

    ContractBuilder(Node classNode, List<String> warnings) {
        if (!classNode.is(NodeKind.CLASS)) throw new IllegalArgumentException("Expected CLASS node, got " + classNode.kind());
        this.classNode = classNode;
        this.warnings = warnings;
    }

    ContractSpec build() {
        name = resolveName();
        if (classNode.childCount() == 3) addParent(lastSegment(classNode.child(1).text()));

        Node body = classNode.child(classNode.childCount() - 1);
        readClassBody(body);
        scanIndexDepths(body);
        scanEmitSites(body);
        declareFields();

        List<FunctionSpec> functions = new ArrayList<>();
        for (Map.Entry<String, Node> m : methods.entrySet()) {
            try {
                if (isShadowedGetter(m.getKey(), m.getValue())) continue;
                FunctionSpec f = function(m.getKey());
                if (f.isConstructor()) functions.add(0, f);
                else functions.add(f);
            } catch (CompilationException ex) {
                errors.addAll(ex.messages());
            }
        }
        if (!errors.isEmpty()) throw new CompilationException(errors);

        List<StateVariable> stateVariables = new ArrayList<>(constants.values());
        stateVariables.addAll(fields.values());

        List<EventSpec> orderedEvents = new ArrayList<>(events.values());
        orderedEvents.sort((a, b) -> Integer.compare(eventRank.get(a.name()), eventRank.get(b.name())));

        return new ContractSpec(name, parents, enums, stateVariables, orderedEvents, functions);
    }

    // ---------- class level ----------

    private String resolveName() {
        Node n = classNode.childCount() == 0 ? null : classNode.child(0);
        if (n == null || !n.is(NodeKind.CONSTANT) || n.text() == null || lastSegment(n.text()).isBlank()) {
            throw new CompilationException(classNode.where() + "Class declaration has no resolvable name");
        }
        return lastSegment(n.text());
    }

    private void readClassBody(Node body) {
        String section = null;
        for (Node s : body.children()) {
            switch (s.kind()) {
                case INCLUDE -> {
                    for (Node c : s.children()) addParent(lastSegment(c.text()));
                }
                case VISIBILITY -> section = s.text();
                case METHOD_DEF -> {
                    String method = s.child(0).text();
                    if (methods.containsKey(method)) {
                        warnings.add(s.where() + "Method '" + method + "' is redefined; the last definition wins");
                    }
                    methods.put(method, s);
                    if (section != null) declaredVisibility.put(method, section);
                }
                case ASSIGN -> {
                    if (s.child(0).is(NodeKind.CONSTANT)) classConstant(s);
                    else warnings.add(s.where() + "Ignoring class-level assignment outside a method");
                }
                case CALL -> classLevelCall(s);
                case IMPORT -> { }
                case CLASS -> warnings.add(s.where() + "Ignoring nested class " + s.child(0).text());
                default -> warnings.add(s.where() + "Ignoring class-level " + s.kind().name().toLowerCase() + " statement");
            }
        }
    }

    private void classLevelCall(Node call) {
        String fn = call.text();
        if (ATTRIBUTE_MACROS.contains(fn)) {
            warnings.add(call.where() + "Ignoring " + fn + "; state variables are declared public");
            return;
        }
        if (VISIBILITY_WORDS.contains(fn)) {
            for (Node arg : call.children()) {
                if (arg.is(NodeKind.SYMBOL) || arg.is(NodeKind.STRING)) declaredVisibility.put(arg.text(), fn);
            }
            return;
        }
        warnings.add(call.where() + "Ignoring class-level call to '" + fn + "'");
    }

    private void classConstant(Node assign) {
        String constName = lastSegment(assign.child(0).text());
        Node value = assign.child(1);

        if (value.is(NodeKind.ARRAY) && value.childCount() > 0 && allSymbols(value)) {
            List<String> members = new ArrayList<>();
            for (Node sym : value.children()) members.add(Names.toPascalCase(sym.text()));
            EnumSpec e = new EnumSpec(Names.toPascalCase(constName), members);
            enums.add(e);
            enumByConstant.put(constName, e);
            for (Node sym : value.children()) enumBySymbol.putIfAbsent(sym.text(), e);
            return;
        }
        if (TypeMapper.isUnmappable(value)) {
            throw new CompilationException(value.where() + "Constant " + constName + " has no Solidity equivalent: "
                    + unmappableReason(value));
        }
        StaticType type = types.typeOf(value, n -> null);
        if (type.isReferenceType() && !type.equals(ElementaryType.STRING)) {
            throw new CompilationException(value.where() + "Constant " + constName + " must be a number, string or boolean");
        }
        constants.put(constName, new StateVariable(constName, type, Visibility.PUBLIC, true, constantExpression(value)));
    }

    private String constantExpression(Node n) {
        switch (n.kind()) {
            case INTEGER, STRING, BOOLEAN, SYMBOL -> { return literal(n); }
            case UNARY -> {
                if ("-".equals(n.text())) return "-" + constantOperand(n.child(0));
            }
            case BINARY -> {
                if (Set.of("+", "-", "*", "/", "%", "**").contains(n.text())) {
                    return constantOperand(n.child(0)) + " " + n.text() + " " + constantOperand(n.child(1));
                }
            }
            case CONSTANT -> {
                StateVariable c = constants.get(lastSegment(n.text()));
                if (c != null) return c.name();
            }
            default -> { }
        }
        throw new CompilationException(n.where() + "Class constants must be literals or arithmetic on literals");
    }

    private String constantOperand(Node n) {
        String s = constantExpression(n);
        return n.is(NodeKind.BINARY) ? "(" + s + ")" : s;
    }

    // ---------- fields ----------

    private void scanIndexDepths(Node body) {
        for (Node idx : body.findNodes(NodeKind.INDEX)) {
            int depth = 1;
            Node base = idx.child(0);
            while (base.is(NodeKind.INDEX)) {
                depth++;
                base = base.child(0);
            }
            if (base.is(NodeKind.IVAR)) indexDepth.merge(base.text(), depth, Math::max);
        }
    }

    private void scanEmitSites(Node body) {
        int rank = 0;
        for (Node call : body.findNodes(NodeKind.CALL)) {
            if (call.text().equals("emit")) emitOrder.put(call, rank++);
        }
    }

    private void declareFields() {
        Node init = methods.get("initialize");
        if (init != null) {
            Map<String, StaticType> params = parameterTypes(init);
            List<Node> topLevel = init.child(2).children();
            for (Node assign : init.child(2).findNodes(NodeKind.ASSIGN)) {
                if (!assign.child(0).is(NodeKind.IVAR)) continue;
                String field = assign.child(0).text();
                if (fields.containsKey(field)) continue;
                boolean top = topLevel.stream().anyMatch(s -> s == assign);
                declareField(field, assign, top, params);
            }
        }
        for (Map.Entry<String, Node> m : methods.entrySet()) {
            if (m.getKey().equals("initialize")) continue;
            Map<String, StaticType> params = parameterTypes(m.getValue());
            for (Node assign : m.getValue().child(2).findNodes(NodeKind.ASSIGN)) {
                if (!assign.child(0).is(NodeKind.IVAR)) continue;
                String field = assign.child(0).text();
                if (!fields.containsKey(field)) declareField(field, assign, false, params);
            }
        }
        for (Node ivar : classNode.findNodes(NodeKind.IVAR)) {
            String field = ivar.text();
            if (!fields.containsKey(field)) declareUnassigned(field);
        }
    }

    private void declareField(String field, Node assign, boolean inlineable, Map<String, StaticType> params) {
        Node value = assign.child(1);
        if (TypeMapper.isUnmappable(value)) {
            throw new CompilationException(value.where() + "Cannot declare @" + field + ": " + unmappableReason(value));
        }
        StaticType type;
        String initializer = null;
        switch (value.kind()) {
            case HASH -> {
                type = value.childCount() == 0 ? mappingFor(field) : TypeMapper.mapType(value).orElseThrow();
                if (value.childCount() == 0 && inlineable) inlined.add(assign);
            }
            case ARRAY -> {
                type = value.childCount() == 0 ? arrayFor(field) : TypeMapper.mapType(value).orElseThrow();
                if (value.childCount() == 0 && inlineable) inlined.add(assign);
            }
            case INTEGER, STRING, BOOLEAN, SYMBOL -> {
                type = types.typeOf(value, params::get);
                if (inlineable) {
                    initializer = literal(value);
                    inlined.add(assign);
                }
            }
            case UNARY -> {
                type = types.typeOf(value, params::get);
                if (inlineable && value.child(0).is(NodeKind.INTEGER) && "-".equals(value.text())) {
                    initializer = "-" + literal(value.child(0));
                    inlined.add(assign);
                }
            }
            default -> type = types.typeOf(value, params::get);
        }
        if (indexDepth.containsKey(field) && !(type instanceof MappingType) && !(type instanceof ArrayType)) {
            type = mappingFor(field);
        }
        fields.put(field, new StateVariable(Names.safeIdentifier(field), type, fieldVisibility(field), false, initializer));
    }

    private void declareUnassigned(String field) {
        StaticType type = indexDepth.containsKey(field) ? mappingFor(field) : TypeMapper.inferFromName(field);
        fields.put(field, new StateVariable(Names.safeIdentifier(field), type, fieldVisibility(field), false, null));
    }

    private static Visibility fieldVisibility(String field) {
        return field.startsWith("_") ? Visibility.PRIVATE : Visibility.PUBLIC;
    }

    // mapping(K1 => mapping(K2 => V)) from the deepest indexing site of the field
    private StaticType mappingFor(String field) {
        int depth = Math.max(1, indexDepth.getOrDefault(field, 1));
        List<Node> keys = null;
        for (Node idx : classNode.findNodes(NodeKind.INDEX)) {
            List<Node> chain = indexChain(idx, field);
            if (chain != null && chain.size() == depth) {
                keys = chain;
                break;
            }
        }
        StaticType type = mappingValueType(field, depth);
        for (int level = depth - 1; level >= 0; level--) {
            StaticType key = keys == null ? ElementaryType.ADDRESS : guessKey(keys.get(level));
            type = new MappingType(key, type);
        }
        return type;
    }

    private StaticType mappingValueType(String field, int depth) {
        for (Node assign : classNode.findNodes(NodeKind.ASSIGN)) {
            List<Node> chain = indexChain(assign.child(0), field);
            if (chain != null && chain.size() == depth) return guessValue(assign.child(1));
        }
        return ElementaryType.UINT256;
    }

    private StaticType arrayFor(String field) {
        for (Node call : classNode.findNodes(NodeKind.METHOD_CALL)) {
            if ((call.text().equals("push") || call.text().equals("append")) && call.childCount() == 2
                    && isField(call.child(0), field)) {
                return new ArrayType(guessValue(call.child(1)));
            }
        }
        for (Node bin : classNode.findNodes(NodeKind.BINARY)) {
            if (bin.text().equals("<<") && isField(bin.child(0), field)) {
                return new ArrayType(guessValue(bin.child(1)));
            }
        }
        return new ArrayType(TypeMapper.inferElementFromName(field));
    }

    // keys of an index chain on @field, outermost first; null when idx is not one
    private static List<Node> indexChain(Node idx, String field) {
        List<Node> keys = new ArrayList<>();
        Node cur = idx;
        while (cur.is(NodeKind.INDEX)) {
            keys.add(0, cur.child(1));
            cur = cur.child(0);
        }
        return !keys.isEmpty() && isField(cur, field) ? keys : null;
    }

    private static boolean isField(Node n, String field) {
        return n.is(NodeKind.IVAR) && n.text().equals(field);
    }

    private StaticType guessKey(Node key) {
        StaticType t = key.is(NodeKind.IDENTIFIER) ? TypeMapper.inferFromName(key.text()) : types.find(key, n -> null);
        return t instanceof ElementaryType ? t : ElementaryType.ADDRESS;
    }

    private StaticType guessValue(Node value) {
        if (value.is(NodeKind.IDENTIFIER) && !hasMethod(value.text())) return TypeMapper.inferFromName(value.text());
        return types.typeOf(value, n -> null);
    }

    // ---------- methods ----------

    /**
     * Declared parameter types in order: {@code @param} tag, then sequence usage, then name.
     * A name-based guess that the body contradicts with arithmetic or ordering falls back to
     * {@code uint256}.
     */
    Map<String, StaticType> parameterTypes(Node methodDef) {
        DocTags tags = DocTags.of(methodDef);
        Map<String, StaticType> out = new LinkedHashMap<>();
        for (Node p : methodDef.child(1).children()) {
            String param = p.text();
            String declared = tags.paramType(param);
            if (declared != null) {
                Optional<StaticType> t = TypeMapper.mapDeclared(declared);
                if (t.isEmpty()) {
                    throw new CompilationException(p.where() + "Unsupported type [" + declared + "] for parameter " + param);
                }
                out.put(param, t.get());
                continue;
            }
            StaticType byName = TypeMapper.inferFromName(param);
            if (!byName.equals(ElementaryType.STRING) && usedAsSequence(methodDef.child(2), param)) {
                out.put(param, new ArrayType(TypeMapper.inferElementFromName(param)));
            } else if (!byName.equals(ElementaryType.UINT256) && usedAsNumber(methodDef.child(2), param)) {
                out.put(param, ElementaryType.UINT256);
            } else {
                out.put(param, byName);
            }
        }
        return out;
    }

    private static boolean usedAsNumber(Node body, String param) {
        for (Node b : body.findNodes(NodeKind.BINARY)) {
            String op = b.text();
            if (NUMERIC_OPERATORS.contains(op) && (isNamed(b.child(0), param) || isNamed(b.child(1), param))) {
                return true;
            }
            if ((op.equals("==") || op.equals("!=")) && (isNamed(b.child(0), param) && b.child(1).is(NodeKind.INTEGER)
                    || isNamed(b.child(1), param) && b.child(0).is(NodeKind.INTEGER))) {
                return true;
            }
        }
        for (Node a : body.findNodes(NodeKind.OP_ASSIGN)) {
            if (isNamed(a.child(0), param) || isNamed(a.child(1), param)) return true;
        }
        return false;
    }

    private static boolean isNamed(Node n, String name) {
        return n.is(NodeKind.IDENTIFIER) && n.text().equals(name);
    }

    private static boolean usedAsSequence(Node body, String param) {
        for (Node it : body.findNodes(NodeKind.ITERATION)) {
            if (isLocal(it.child(0), param) && it.text().startsWith("each")) return true;
        }
        for (Node f : body.findNodes(NodeKind.FOR)) {
            if (isLocal(f.child(1), param)) return true;
        }
        for (Node call : body.findNodes(NodeKind.METHOD_CALL)) {
            if (isLocal(call.child(0), param) && SEQUENCE_METHODS.contains(call.text())) return true;
        }
        for (Node idx : body.findNodes(NodeKind.INDEX)) {
            if (isLocal(idx.child(0), param)) return true;
        }
        return false;
    }

    private static boolean isLocal(Node n, String name) {
        return n.is(NodeKind.IDENTIFIER) && n.text().equals(name);
    }

    Visibility visibilityOf(String method, DocTags tags) {
        String explicit = tags.visibility();
        if (explicit == null) explicit = declaredVisibility.get(method);
        if (explicit != null) return TypeMapper.mapVisibility(explicit);
        return method.startsWith("_") ? Visibility.PRIVATE : Visibility.PUBLIC;
    }

    private FunctionSpec function(String method) {
        FunctionSpec done = translated.get(method);
        if (done != null) return done;
        translating.add(method);
        try {
            FunctionSpec f = new FunctionTranslator(this, types, methods.get(method)).translate();
            translated.put(method, f);
            return f;
        } finally {
            translating.remove(method);
        }
    }

    // `def owner; @owner; end` duplicates the getter of the public state variable
    private boolean isShadowedGetter(String method, Node def) {
        StateVariable v = fieldNamed(Names.toFunctionName(method));
        if (v == null) return false;
        if (v.visibility() == Visibility.PUBLIC && returnsOnlyField(def, v.name())) {
            warnings.add(def.where() + "Dropping method '" + method + "'; public state variable " + v.name()
                    + " already provides a getter");
            return true;
        }
        throw new CompilationException(def.where() + "Method '" + method + "' collides with state variable " + v.name());
    }

    private static boolean returnsOnlyField(Node def, String fieldName) {
        List<Node> stmts = def.child(2).children();
        if (def.child(1).childCount() != 0 || stmts.size() != 1) return false;
        Node value = stmts.get(0);
        if (value.is(NodeKind.RETURN) && value.childCount() == 1) value = value.child(0);
        return value.is(NodeKind.IVAR) && Names.safeIdentifier(value.text()).equals(fieldName);
    }

    private StateVariable fieldNamed(String solidityName) {
        for (StateVariable v : fields.values()) {
            if (v.name().equals(solidityName)) return v;
        }
        return null;
    }

    // ---------- lookups for translators ----------

    String contractName() {
        return name;
    }

    boolean hasParents() {
        return !parents.isEmpty();
    }

    boolean hasMethod(String method) {
        return methods.containsKey(method) && !method.equals("initialize");
    }

    int arity(String method) {
        return methods.get(method).child(1).childCount();
    }

    String functionName(String method) {
        return Names.toFunctionName(method);
    }

    /** Return type of a sibling method, or null when it returns nothing or is still being translated. */
    StaticType returnTypeOf(String method) {
        if (!hasMethod(method) || translating.contains(method)) return null;
        try {
            return function(method).returnType();
        } catch (CompilationException ex) {
            // reported when the method itself is translated
            return null;
        }
    }

    StateVariable field(String field) {
        return fields.get(field);
    }

    StateVariable constant(String constName) {
        return constants.get(lastSegment(constName));
    }

    EnumSpec enumOfSymbol(String symbol) {
        return enumBySymbol.get(symbol);
    }

    EnumSpec enumOfConstant(String constName) {
        return enumByConstant.get(lastSegment(constName));
    }

    Set<String> memberNames() {
        Set<String> out = new HashSet<>();
        for (StateVariable v : constants.values()) out.add(v.name());
        for (StateVariable v : fields.values()) out.add(v.name());
        return out;
    }

    boolean isInlined(Node assign) {
        return inlined.contains(assign);
    }

    void registerEvent(Node emitSite, EventSpec event) {
        int rank = emitOrder.getOrDefault(emitSite, Integer.MAX_VALUE);
        Integer current = eventRank.get(event.name());
        if (current == null || rank < current) {
            eventRank.put(event.name(), rank);
            events.put(event.name(), event);
        }
    }

    void warn(String message) {
        warnings.add(message);
    }

    /** Literal rendering shared by field initializers and constants. */
    String literal(Node n) {
        return switch (n.kind()) {
            case INTEGER -> n.value().toString();
            case STRING -> Names.quote(n.text());
            case BOOLEAN -> n.value().toString();
            case SYMBOL -> {
                EnumSpec e = enumOfSymbol(n.text());
                yield e == null ? Names.quote(n.text()) : e.name() + "." + Names.toPascalCase(n.text());
            }
            default -> throw new IllegalArgumentException("Not a literal: " + n.kind());
        };
    }

    static String unmappableReason(Node value) {
        if (value.is(NodeKind.NIL)) return "nil has no Solidity equivalent; use a zero value or a separate flag";
        return "floating point literal " + value.text()
                + " is not supported; scale it to a fixed-point integer (for example 1.5 as 15 * 10 ** 17)";
    }

    private void addParent(String parent) {
        if (!parents.contains(parent)) parents.add(parent);
    }

    private static boolean allSymbols(Node array) {
        for (Node c : array.children()) {
            if (!c.is(NodeKind.SYMBOL)) return false;
        }
        return true;
    }

    static String lastSegment(String path) {
        int i = path.lastIndexOf("::");
        return i < 0 ? path : path.substring(i + 2);
    }
}
