package solidrail.optimizer;

import solidrail.types.ElementaryType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural scanning of Solidity text: brace depth per line, contract and function regions,
 * state-variable declarations. Braces inside string literals and line comments are ignored.
 */
final class GeneratedSource {
    private static final Pattern CONTRACT_HEADER =
            Pattern.compile("^\\s*(?:abstract\\s+)?(?:contract|library)\\s+(\\w+)\\b.*\\{\\s*$");
    private static final Pattern FUNCTION_HEADER =
            Pattern.compile("^\\s*(?:function\\s+(\\w+)|(constructor|receive|fallback)\\s*)\\(.*\\{\\s*$");
    private static final Pattern ENUM_HEADER = Pattern.compile("^\\s*enum\\s+(\\w+)\\b");
    private static final Pattern SIMPLE_TYPE =
            Pattern.compile("^([A-Za-z_][\\w.]*(?:\\s+payable)?(?:\\[\\d*])*)\\s+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");
    private static final Set<String> MODIFIERS = Set.of(
            "public", "private", "internal", "constant", "immutable", "override", "transient");
    private static final Set<String> NON_DECLARATIONS = Set.of(
            "function", "event", "enum", "constructor", "modifier", "struct", "using", "error",
            "import", "pragma", "emit", "return", "require", "assert", "revert", "delete",
            "receive", "fallback", "contract", "library", "interface");

    private GeneratedSource() {}

    /** A region from its header line to its closing-brace line, both inclusive. */
    record Region(String name, int start, int end) {}

    record Declaration(String type, String name, boolean constant, String initializer) {}

    static List<String> lines(String code) {
        return new ArrayList<>(Arrays.asList(code.split("\n", -1)));
    }

    static String join(List<String> lines) {
        return String.join("\n", lines);
    }

    /** Net brace change of one line. */
    static int braceDelta(String line) {
        int delta = 0;
        boolean inString = false;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inString) {
                if (c == '\\') i++;
                else if (c == quote) inString = false;
                continue;
            }
            if (c == '"' || c == '\'') {
                inString = true;
                quote = c;
            } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            } else if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
        }
        return delta;
    }

    /** Brace depth in effect at the start of each line. */
    static int[] depths(List<String> lines) {
        int[] out = new int[lines.size()];
        int depth = 0;
        for (int i = 0; i < lines.size(); i++) {
            out[i] = depth;
            depth += braceDelta(lines.get(i));
        }
        return out;
    }

    static List<Region> contracts(List<String> lines) {
        return regions(lines, 0, lines.size(), CONTRACT_HEADER, -1);
    }

    /** Functions, constructors and special functions declared directly in {@code contract}. */
    static List<Region> functions(List<String> lines, Region contract) {
        int[] depths = depths(lines);
        return regions(lines, contract.start() + 1, contract.end(), FUNCTION_HEADER, depths[contract.start()] + 1);
    }

    private static List<Region> regions(List<String> lines, int from, int to, Pattern header, int requiredDepth) {
        int[] depths = depths(lines);
        List<Region> out = new ArrayList<>();
        for (int i = from; i < to; i++) {
            if (requiredDepth >= 0 && depths[i] != requiredDepth) continue;
            Matcher m = header.matcher(lines.get(i));
            if (!m.matches()) continue;
            int end = closingLine(lines, i);
            if (end < 0) break;
            String name = m.group(1);
            if (name == null && m.groupCount() > 1) name = m.group(2);
            out.add(new Region(name, i, end));
            i = end;
        }
        return out;
    }

    /** Line that closes the block opened on {@code start}, or -1 when unbalanced. */
    static int closingLine(List<String> lines, int start) {
        int depth = 0;
        for (int i = start; i < lines.size(); i++) {
            depth += braceDelta(lines.get(i));
            if (depth <= 0) return i;
        }
        return -1;
    }

    /** Whether line {@code i} sits directly inside the contract body. */
    static boolean isMember(int[] depths, Region contract, int i) {
        return i > contract.start() && i < contract.end() && depths[i] == depths[contract.start()] + 1;
    }

    static Set<String> enumNames(List<String> lines, Region contract) {
        Set<String> out = new LinkedHashSet<>();
        for (int i = contract.start() + 1; i < contract.end(); i++) {
            Matcher m = ENUM_HEADER.matcher(lines.get(i));
            if (m.find()) out.add(m.group(1));
        }
        return out;
    }

    /** State-variable declarations of {@code contract}, by line. */
    static List<Declaration> stateVariables(List<String> lines, Region contract) {
        int[] depths = depths(lines);
        List<Declaration> out = new ArrayList<>();
        for (int i = contract.start() + 1; i < contract.end(); i++) {
            if (!isMember(depths, contract, i)) continue;
            Declaration d = parseStateVariable(lines.get(i));
            if (d != null) out.add(d);
        }
        return out;
    }

    /** Parses {@code <type> [modifiers] <name> [= <init>];}, or returns null. */
    static Declaration parseStateVariable(String line) {
        String t = line.trim();
        if (!t.endsWith(";")) return null;
        Matcher first = IDENTIFIER.matcher(t);
        if (!first.lookingAt() || NON_DECLARATIONS.contains(first.group())) return null;

        String type;
        int pos;
        if (t.startsWith("mapping")) {
            int open = t.indexOf('(');
            int close = matchingParen(t, open);
            if (open < 0 || close < 0) return null;
            type = t.substring(0, close + 1);
            pos = close + 1;
        } else {
            Matcher m = SIMPLE_TYPE.matcher(t);
            if (!m.lookingAt()) return null;
            type = m.group(1);
            pos = m.end(1);
        }

        String rest = t.substring(pos, t.length() - 1).trim();
        String initializer = null;
        int eq = assignmentIndex(rest);
        if (eq >= 0) {
            initializer = rest.substring(eq + 1).trim();
            rest = rest.substring(0, eq).trim();
        }
        String[] words = rest.split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) return null;
        boolean constant = false;
        for (int i = 0; i < words.length - 1; i++) {
            if (!MODIFIERS.contains(words[i])) return null;
            if (words[i].equals("constant")) constant = true;
        }
        String name = words[words.length - 1];
        if (!IDENTIFIER.matcher(name).matches() || MODIFIERS.contains(name)) return null;
        return new Declaration(type, name, constant, initializer);
    }

    /** Storage bytes of a declared type; enums take one byte, unknown types a full slot. */
    static int storageWidth(String type, Set<String> enumNames) {
        String t = type.trim();
        if (t.startsWith("mapping") || t.endsWith("]")) return 32;
        if (t.equals("address payable")) return 20;
        if (enumNames.contains(t)) return 1;
        if (ElementaryType.isElementary(t)) return ElementaryType.of(t).storageBytes();
        return 32;
    }

    static boolean mentions(String text, String identifier) {
        return Pattern.compile("(?<![\\w$])" + Pattern.quote(identifier) + "(?![\\w$])").matcher(text).find();
    }

    private static int matchingParen(String s, int open) {
        if (open < 0) return -1;
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            if (s.charAt(i) == '(') depth++;
            else if (s.charAt(i) == ')' && --depth == 0) return i;
        }
        return -1;
    }

    // index of a lone '=' (not ==, <=, >=, !=, =>)
    private static int assignmentIndex(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) != '=') continue;
            char prev = i > 0 ? s.charAt(i - 1) : ' ';
            char next = i + 1 < s.length() ? s.charAt(i + 1) : ' ';
            if (next == '=' || next == '>' || prev == '=' || prev == '<' || prev == '>' || prev == '!') continue;
            return i;
        }
        return -1;
    }
}
