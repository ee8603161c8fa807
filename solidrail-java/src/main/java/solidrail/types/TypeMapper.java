package solidrail.types;

import solidrail.ast.Node;
import solidrail.ast.NodeKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Side-effect-free mapping from Ruby values, type names and markers to their Solidity
 * counterparts.
 */
public final class TypeMapper {
    private TypeMapper() {}

    private static final StaticType DEFAULT_MAPPING =
            new MappingType(ElementaryType.ADDRESS, ElementaryType.UINT256);

    private static final Set<String> ADDRESS_NAMES = Set.of(
            "to", "from", "owner", "spender", "sender", "recipient", "account", "beneficiary",
            "operator", "receiver", "payee", "user", "admin", "delegate", "delegatee", "wallet",
            "minter", "holder", "voter", "buyer", "seller", "addr", "address", "caller", "target",
            "new_owner", "treasury");

    private static final Set<String> STRING_NAMES = Set.of(
            "name", "symbol", "uri", "url", "message", "description", "title", "label", "memo",
            "reason", "text", "note", "comment", "proposal_name");

    private static final Set<String> BOOL_NAMES = Set.of(
            "enabled", "active", "paused", "approved", "allowed", "flag", "locked", "finalized",
            "support", "visible");

    /**
     * Static type of a literal value. Empty when the value has no Solidity counterpart
     * ({@code nil}, floats) or is not a literal at all.
     */
    public static Optional<StaticType> mapType(Node value) {
        return switch (value.kind()) {
            case INTEGER -> Optional.of(ElementaryType.UINT256);
            case STRING, INTERPOLATED_STRING, SYMBOL -> Optional.of(ElementaryType.STRING);
            case BOOLEAN -> Optional.of(ElementaryType.BOOL);
            case ARRAY -> {
                if (value.childCount() == 0) yield Optional.of(new ArrayType(ElementaryType.UINT256));
                yield Optional.of(new ArrayType(mapType(value.child(0)).orElse(ElementaryType.UINT256)));
            }
            case HASH -> {
                if (value.childCount() == 0) yield Optional.of(DEFAULT_MAPPING);
                Node pair = value.child(0);
                StaticType key = mapType(pair.child(0))
                        .filter(t -> t instanceof ElementaryType)
                        .orElse(ElementaryType.ADDRESS);
                StaticType val = mapType(pair.child(1)).orElse(ElementaryType.UINT256);
                yield Optional.of(new MappingType(key, val));
            }
            case UNARY -> {
                if ("-".equals(value.text()) && value.child(0).is(NodeKind.INTEGER)) {
                    yield Optional.of(ElementaryType.INT256);
                }
                yield Optional.empty();
            }
            default -> Optional.empty();
        };
    }

    /** Values that can never be represented: the target has no null and no floating point. */
    public static boolean isUnmappable(Node value) {
        return value.is(NodeKind.NIL) || value.is(NodeKind.FLOAT);
    }

    /**
     * Static type for a declared Ruby type name, as written in doc tags
     * ({@code Integer}, {@code Array<String>}, {@code Hash{Address => Integer}}).
     * Solidity elementary names pass through unchanged.
     */
    public static Optional<StaticType> mapDeclared(String declared) {
        if (declared == null) return Optional.empty();
        String t = declared.trim();
        if (t.isEmpty()) return Optional.empty();

        // union types: first alternative that maps
        List<String> alternatives = splitTopLevel(t, ',');
        if (alternatives.size() > 1) {
            for (String alt : alternatives) {
                Optional<StaticType> m = mapDeclared(alt);
                if (m.isPresent()) return m;
            }
            return Optional.empty();
        }

        switch (t) {
            case "Integer", "Numeric", "Fixnum", "Bignum" -> { return Optional.of(ElementaryType.UINT256); }
            case "String", "Symbol" -> { return Optional.of(ElementaryType.STRING); }
            case "Boolean", "Bool", "TrueClass", "FalseClass" -> { return Optional.of(ElementaryType.BOOL); }
            case "Address" -> { return Optional.of(ElementaryType.ADDRESS); }
            case "Array" -> { return Optional.of(new ArrayType(ElementaryType.UINT256)); }
            case "Hash" -> { return Optional.of(DEFAULT_MAPPING); }
            case "NilClass", "nil", "Float", "BigDecimal" -> { return Optional.empty(); }
            default -> { }
        }

        if (ElementaryType.isElementary(t)) return Optional.of(ElementaryType.of(t));

        if (t.startsWith("Array<") && t.endsWith(">")) {
            String inner = t.substring("Array<".length(), t.length() - 1);
            return mapDeclared(inner).map(ArrayType::new);
        }
        if (t.endsWith("[]")) {
            return mapDeclared(t.substring(0, t.length() - 2)).map(ArrayType::new);
        }
        if ((t.startsWith("Hash{") && t.endsWith("}")) || (t.startsWith("Hash<") && t.endsWith(">"))) {
            String inner = t.substring("Hash{".length(), t.length() - 1);
            List<String> kv = inner.contains("=>") ? splitTopLevel(inner, '=') : splitTopLevel(inner, ',');
            if (kv.size() != 2) return Optional.empty();
            String valuePart = kv.get(1).startsWith(">") ? kv.get(1).substring(1) : kv.get(1);
            Optional<StaticType> key = mapDeclared(kv.get(0)).filter(k -> k instanceof ElementaryType);
            Optional<StaticType> val = mapDeclared(valuePart);
            if (key.isEmpty() || val.isEmpty()) return Optional.empty();
            return Optional.of(new MappingType(key.get(), val.get()));
        }
        return Optional.empty();
    }

    /**
     * Default type for an untyped identifier, chosen by naming convention:
     * account-like names are addresses, text-like names strings, predicate names booleans,
     * everything else an unsigned integer.
     */
    public static StaticType inferFromName(String identifier) {
        String n = identifier.startsWith("_") ? identifier.substring(1) : identifier;
        if (ADDRESS_NAMES.contains(n) || n.endsWith("_address") || n.endsWith("_addr")
                || n.endsWith("_account") || n.endsWith("_owner") || n.endsWith("_wallet")
                || n.endsWith("_recipient") || n.endsWith("_spender")) {
            return ElementaryType.ADDRESS;
        }
        if (STRING_NAMES.contains(n) || n.endsWith("_name") || n.endsWith("_uri")
                || n.endsWith("_symbol") || n.endsWith("_message") || n.endsWith("_url")) {
            return ElementaryType.STRING;
        }
        if (BOOL_NAMES.contains(n) || n.startsWith("is_") || n.startsWith("has_")
                || n.startsWith("can_") || n.startsWith("should_") || n.endsWith("?")) {
            return ElementaryType.BOOL;
        }
        return ElementaryType.UINT256;
    }

    /** Element type for a sequence named in the plural ({@code recipients}, {@code amounts}). */
    public static StaticType inferElementFromName(String plural) {
        String n = plural;
        if (n.endsWith("ies") && n.length() > 3) n = n.substring(0, n.length() - 3) + "y";
        else if (n.endsWith("sses")) n = n.substring(0, n.length() - 2);
        else if (n.endsWith("s") && !n.endsWith("ss") && n.length() > 1) n = n.substring(0, n.length() - 1);
        return inferFromName(n);
    }

    public static Visibility mapVisibility(String sourceVisibility) {
        if (sourceVisibility == null) return Visibility.PUBLIC;
        return switch (sourceVisibility) {
            case "private" -> Visibility.PRIVATE;
            case "protected" -> Visibility.INTERNAL;
            default -> Visibility.PUBLIC;
        };
    }

    /** First of pure, view and payable present among {@code markers}; otherwise state-mutating. */
    public static Mutability mapMutability(Collection<String> markers) {
        if (markers.contains("pure")) return Mutability.PURE;
        if (markers.contains("view")) return Mutability.VIEW;
        if (markers.contains("payable")) return Mutability.PAYABLE;
        return Mutability.NONE;
    }

    // split on sep outside <...>, {...} and (...)
    private static List<String> splitTopLevel(String s, char sep) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<' || c == '{' || c == '(') depth++;
            else if (c == '}' || c == ')') depth--;
            else if (c == '>' && (i == 0 || s.charAt(i - 1) != '=')) depth--;
            else if (c == sep && depth == 0) {
                parts.add(s.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(s.substring(start).trim());
        return parts;
    }
}
