package solidrail.validator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based checks on Ruby input before translation and on Solidity output after it.
 * Never throws; callers decide what a finding means.
 */
public final class Validator {
    private Validator() {}

    private static final Pattern CLASS_DECLARATION = Pattern.compile("(?m)^\\s*class\\s+[A-Z]");
    private static final Pattern INITIALIZER = Pattern.compile("(?m)^\\s*(?:private\\s+|public\\s+)?def\\s+initialize\\b");
    private static final Pattern DYNAMIC_CODE = Pattern.compile("\\b(eval|instance_eval|class_eval|module_eval)\\b");
    private static final Pattern PROCESS_CALL =
            Pattern.compile("\\b(system|exec|spawn|fork)\\b|(`[^`\\n]*`?)|(%x)\\W|\\b(IO\\.popen|Open3)\\b");

    private static final Pattern PRAGMA = Pattern.compile("(?m)^\\s*pragma\\s+solidity\\b");
    private static final Pattern CONTRACT = Pattern.compile("(?m)^\\s*(?:abstract\\s+)?contract\\s+\\w+");
    private static final Pattern TIMESTAMP = Pattern.compile("\\bblock\\.timestamp\\b");
    private static final Pattern TX_ORIGIN = Pattern.compile("\\btx\\.origin\\b");

    public static List<Finding> validateSource(String source) {
        List<Finding> out = new ArrayList<>();
        String code = stripCommentsAndStrings(source);
        if (!CLASS_DECLARATION.matcher(code).find()) {
            out.add(Finding.error("No class declaration found; a contract needs a class"));
        }
        if (!INITIALIZER.matcher(code).find()) {
            out.add(Finding.error("No initialize method found; a contract needs a constructor"));
        }
        Matcher dyn = DYNAMIC_CODE.matcher(code);
        while (dyn.find()) {
            out.add(Finding.error("Dynamic code execution is not allowed: " + dyn.group(1)
                    + " at line " + lineOf(code, dyn.start())));
        }
        Matcher proc = PROCESS_CALL.matcher(code);
        while (proc.find()) {
            String what = proc.group(1) != null ? proc.group(1)
                    : proc.group(2) != null ? "backticks"
                    : proc.group(3) != null ? "%x" : proc.group(4);
            out.add(Finding.error("System command execution is not allowed: " + what
                    + " at line " + lineOf(code, proc.start())));
        }
        return out;
    }

    public static List<Finding> validateGenerated(String code) {
        List<Finding> out = new ArrayList<>();
        if (!PRAGMA.matcher(code).find()) out.add(Finding.error("Missing pragma solidity directive"));
        if (!CONTRACT.matcher(code).find()) out.add(Finding.error("No contract declaration found"));
        if (TIMESTAMP.matcher(code).find()) {
            out.add(Finding.warning("block.timestamp can be influenced by block producers; do not use it for randomness"));
        }
        if (TX_ORIGIN.matcher(code).find()) {
            out.add(Finding.warning("tx.origin used; authorize with msg.sender instead"));
        }
        return out;
    }

    public static boolean hasErrors(List<Finding> findings) {
        for (Finding f : findings) {
            if (f.isError()) return true;
        }
        return false;
    }

    // blanks out comments and string bodies, keeping line structure and offsets;
    // #{...} inside double quotes is code and stays visible
    static String stripCommentsAndStrings(String source) {
        StringBuilder sb = new StringBuilder(source.length());
        Deque<Integer> interpolations = new ArrayDeque<>();
        int braces = 0;
        char quote = 0;
        boolean comment = false;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                comment = false;
                sb.append(c);
                continue;
            }
            if (comment) {
                sb.append(' ');
            } else if (quote != 0) {
                if (c == '\\' && i + 1 < source.length() && source.charAt(i + 1) != '\n') {
                    sb.append("  ");
                    i++;
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                    sb.append(c);
                } else if (quote == '"' && c == '#' && i + 1 < source.length() && source.charAt(i + 1) == '{') {
                    interpolations.push(braces);
                    quote = 0;
                    sb.append("  ");
                    i++;
                } else {
                    sb.append(' ');
                }
            } else if (c == '#') {
                comment = true;
                sb.append(' ');
            } else if (c == '"' || c == '\'') {
                quote = c;
                sb.append(c);
            } else if (c == '{') {
                braces++;
                sb.append(c);
            } else if (c == '}' && !interpolations.isEmpty() && interpolations.peek() == braces) {
                interpolations.pop();
                quote = '"';
                sb.append(' ');
            } else {
                if (c == '}') braces--;
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }
}
