package solidrail.codegen;

import solidrail.ast.Node;
import solidrail.ast.NodeKind;
import solidrail.ir.EnumSpec;
import solidrail.ir.StateVariable;
import solidrail.types.ArrayType;
import solidrail.types.ElementaryType;
import solidrail.types.EnumType;
import solidrail.types.MappingType;
import solidrail.types.StaticType;
import solidrail.types.TypeMapper;

import java.util.Set;
import java.util.function.Function;

/**
 * Local type inference for expressions: literals, known locals and fields, well-known
 * globals and the declared or inferred return types of the contract's own functions.
 */
final class ExpressionTypes {
    private static final Set<String> ADDRESS_MEMBERS = Set.of("sender", "origin", "coinbase");
    private static final Set<String> UINT_MEMBERS = Set.of(
            "value", "timestamp", "number", "gasprice", "chainid", "basefee", "gaslimit",
            "difficulty", "prevrandao", "balance", "length", "size", "count");
    private static final Set<String> BOOL_METHODS = Set.of(
            "empty?", "zero?", "nonzero?", "positive?", "negative?", "include?");
    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", "<=", ">", ">=", "&&");

    private final ContractBuilder contract;

    ExpressionTypes(ContractBuilder contract) {
        this.contract = contract;
    }

    /** Inferred type, {@code uint256} when nothing better is known. */
    StaticType typeOf(Node n, Function<String, StaticType> locals) {
        StaticType t = find(n, locals);
        return t == null ? ElementaryType.UINT256 : t;
    }

    /** Inferred type, or null when unknown. */
    StaticType find(Node n, Function<String, StaticType> locals) {
        switch (n.kind()) {
            case INTEGER -> { return ElementaryType.UINT256; }
            case STRING, INTERPOLATED_STRING -> { return ElementaryType.STRING; }
            case BOOLEAN -> { return ElementaryType.BOOL; }
            case SYMBOL -> {
                EnumSpec e = contract.enumOfSymbol(n.text());
                return e == null ? ElementaryType.STRING : new EnumType(e.name());
            }
            case ARRAY, HASH -> {
                return TypeMapper.mapType(n).orElse(null);
            }
            case IDENTIFIER -> {
                StaticType local = locals.apply(n.text());
                if (local != null) return local;
                if (contract.hasMethod(n.text())) return contract.returnTypeOf(n.text());
                return null;
            }
            case IVAR -> {
                StateVariable v = contract.field(n.text());
                return v == null ? null : v.type();
            }
            case CONSTANT -> {
                StateVariable c = contract.constant(n.text());
                return c == null ? null : c.type();
            }
            case INDEX -> {
                StaticType base = find(n.child(0), locals);
                if (base instanceof MappingType m) return m.value();
                if (base instanceof ArrayType a) return a.element();
                return null;
            }
            case METHOD_CALL -> { return methodCallType(n, locals); }
            case CALL -> { return callType(n); }
            case BINARY -> { return binaryType(n, locals); }
            case UNARY -> {
                return "!".equals(n.text()) ? ElementaryType.BOOL : ElementaryType.INT256;
            }
            case TERNARY -> {
                StaticType a = find(n.child(1), locals);
                return a != null ? a : find(n.child(2), locals);
            }
            case SELF -> { return ElementaryType.ADDRESS; }
            default -> { return null; }
        }
    }

    private StaticType methodCallType(Node n, Function<String, StaticType> locals) {
        String name = n.text();
        boolean noArgs = n.childCount() == 1;
        if (noArgs && ADDRESS_MEMBERS.contains(name)) return ElementaryType.ADDRESS;
        if (noArgs && UINT_MEMBERS.contains(name)) return ElementaryType.UINT256;
        if (BOOL_METHODS.contains(name)) return ElementaryType.BOOL;
        if (n.child(0).is(NodeKind.SELF) && contract.hasMethod(name)) return contract.returnTypeOf(name);
        if (name.equals("pop") && noArgs) {
            StaticType base = find(n.child(0), locals);
            if (base instanceof ArrayType a) return a.element();
        }
        return null;
    }

    private StaticType callType(Node n) {
        String name = n.text();
        switch (name) {
            case "payable", "address", "ecrecover" -> { return ElementaryType.ADDRESS; }
            case "keccak256", "sha256", "blockhash" -> { return ElementaryType.BYTES32; }
            case "gasleft", "addmod", "mulmod" -> { return ElementaryType.UINT256; }
            default -> { }
        }
        if (ElementaryType.isElementary(name)) return ElementaryType.of(name);
        if (contract.hasMethod(name)) return contract.returnTypeOf(name);
        return null;
    }

    private StaticType binaryType(Node n, Function<String, StaticType> locals) {
        String op = n.text();
        if (op.equals("||")) {
            if (FunctionTranslator.isZeroDefault(n)) return find(n.child(0), locals);
            return ElementaryType.BOOL;
        }
        if (COMPARISONS.contains(op)) return ElementaryType.BOOL;
        StaticType left = find(n.child(0), locals);
        if (op.equals("<<") && left instanceof ArrayType) return null;
        if (left != null && left.isNumeric()) return left;
        StaticType right = find(n.child(1), locals);
        if (right != null && right.isNumeric()) return right;
        return ElementaryType.UINT256;
    }
}
