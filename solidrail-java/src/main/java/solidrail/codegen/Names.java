package solidrail.codegen;

import java.util.Set;

/**
 * Identifier conversions between Ruby and Solidity naming conventions.
 */
public final class Names {
    private Names() {}

    // words reserved by the target language that are plausible Ruby identifiers
    private static final Set<String> RESERVED = Set.of(
            "address", "bool", "string", "bytes", "byte", "uint", "int", "mapping", "contract",
            "interface", "library", "event", "emit", "function", "modifier", "struct", "enum",
            "returns", "public", "private", "internal", "external", "memory", "storage",
            "calldata", "payable", "constant", "immutable", "override", "virtual", "indexed",
            "anonymous", "this", "super", "delete", "new", "var", "after", "case", "default",
            "final", "in", "let", "match", "null", "of", "relocatable", "static", "switch",
            "typeof", "alias", "apply", "auto", "copyof", "define", "implements", "macro",
            "mutable", "partial", "promise", "reference", "sealed", "sizeof", "supports",
            "typedef", "unchecked", "assembly", "try", "catch", "error", "revert", "fallback",
            "receive", "constructor", "pragma", "import", "using", "is", "wei", "gwei", "ether",
            "seconds", "minutes", "hours", "days", "weeks", "years");

    /**
     * Function name for a Ruby method name: snake_case becomes camelCase, a predicate
     * {@code paused?} becomes {@code isPaused}, a trailing {@code !} is dropped and a leading
     * underscore is kept.
     */
    public static String toFunctionName(String rubyName) {
        String n = rubyName;
        boolean predicate = n.endsWith("?");
        if (predicate || n.endsWith("!")) n = n.substring(0, n.length() - 1);

        String prefix = "";
        while (n.startsWith("_")) {
            prefix += "_";
            n = n.substring(1);
        }
        if (predicate && !n.startsWith("is_") && !n.startsWith("has_") && !n.startsWith("can_")) {
            n = "is_" + n;
        }
        return safeIdentifier(prefix + toCamelCase(n));
    }

    /** {@code token_ids} to {@code tokenIds}; already camelCased input is unchanged. */
    public static String toCamelCase(String snake) {
        StringBuilder sb = new StringBuilder(snake.length());
        boolean upper = false;
        for (int i = 0; i < snake.length(); i++) {
            char c = snake.charAt(i);
            if (c == '_') {
                upper = sb.length() > 0;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }

    /** {@code STATUS} and {@code order_state} to {@code Status} and {@code OrderState}. */
    public static String toPascalCase(String name) {
        String base = name;
        boolean allCaps = base.equals(base.toUpperCase());
        if (allCaps) base = base.toLowerCase();
        StringBuilder sb = new StringBuilder(base.length());
        boolean upper = true;
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            if (c == '_') {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }

    /** Appends an underscore to names the target language reserves. */
    public static String safeIdentifier(String name) {
        return RESERVED.contains(name) ? name + "_" : name;
    }

    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    /** Double-quoted literal with the target's escapes. */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
