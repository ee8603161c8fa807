package solidrail.types;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record ElementaryType(String name) implements StaticType {
    private static final Pattern INT_TYPE = Pattern.compile("u?int(\\d*)");
    private static final Pattern FIXED_BYTES = Pattern.compile("bytes(\\d+)");

    public static final ElementaryType UINT256 = new ElementaryType("uint256");
    public static final ElementaryType INT256 = new ElementaryType("int256");
    public static final ElementaryType BOOL = new ElementaryType("bool");
    public static final ElementaryType ADDRESS = new ElementaryType("address");
    public static final ElementaryType STRING = new ElementaryType("string");
    public static final ElementaryType BYTES = new ElementaryType("bytes");
    public static final ElementaryType BYTES32 = new ElementaryType("bytes32");

    /** Normalized instance; {@code uint} and {@code int} become their 256-bit spelling. */
    public static ElementaryType of(String name) {
        if (!isElementary(name)) throw new IllegalArgumentException("Not an elementary type: " + name);
        return new ElementaryType(new ElementaryType(name).typeName());
    }

    /** Whether {@code name} spells a Solidity elementary type. */
    public static boolean isElementary(String name) {
        if (name == null) return false;
        switch (name) {
            case "bool", "address", "string", "bytes" -> { return true; }
            default -> { }
        }
        Matcher m = INT_TYPE.matcher(name);
        if (m.matches()) return m.group(1).isEmpty() || validWidth(Integer.parseInt(m.group(1)));
        Matcher b = FIXED_BYTES.matcher(name);
        if (b.matches()) {
            int n = Integer.parseInt(b.group(1));
            return n >= 1 && n <= 32;
        }
        return false;
    }

    private static boolean validWidth(int bits) {
        return bits >= 8 && bits <= 256 && bits % 8 == 0;
    }

    @Override
    public String typeName() {
        return switch (name) {
            case "uint" -> "uint256";
            case "int" -> "int256";
            default -> name;
        };
    }

    @Override
    public int storageBytes() {
        String n = typeName();
        switch (n) {
            case "bool" -> { return 1; }
            case "address" -> { return 20; }
            case "string", "bytes" -> { return 32; }
            default -> { }
        }
        Matcher m = INT_TYPE.matcher(n);
        if (m.matches()) return Integer.parseInt(m.group(1)) / 8;
        Matcher b = FIXED_BYTES.matcher(n);
        if (b.matches()) return Integer.parseInt(b.group(1));
        return 32;
    }

    @Override
    public boolean isReferenceType() {
        return name.equals("string") || name.equals("bytes");
    }

    @Override
    public boolean isNumeric() {
        return INT_TYPE.matcher(name).matches();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
