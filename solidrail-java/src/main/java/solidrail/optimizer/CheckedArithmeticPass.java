package solidrail.optimizer;

import solidrail.config.CompilerConfig;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guards state-variable arithmetic with explicit overflow and underflow checks when the
 * target compiler does not check arithmetic itself (before 0.8).
 */
public final class CheckedArithmeticPass implements OptimizationPass {
    private static final Pattern PRAGMA = Pattern.compile("pragma\\s+solidity\\s+([^;]+);");
    private static final Pattern VERSION = Pattern.compile("(\\d+)\\.(\\d+)");
    private static final Pattern COMPOUND =
            Pattern.compile("^(\\s*)(([A-Za-z_]\\w*)(?:\\[[^;]*])*)\\s*([-+*])=\\s*(.+);\\s*$");
    private static final Pattern CALL = Pattern.compile("([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern CONVERSION = Pattern.compile("u?int\\d*|bytes\\d*|address|payable|bool");
    private static final Pattern STEP =
            Pattern.compile("^(\\s*)(([A-Za-z_]\\w*)(?:\\[[^;]*])*)\\s*(\\+\\+|--);\\s*$");

    @Override
    public String name() {
        return "checked-arithmetic";
    }

    @Override
    public boolean isEnabled(CompilerConfig config) {
        return config.securityChecksEnabled();
    }

    @Override
    public String apply(String code, List<String> warnings) {
        if (checkedByDefault(code)) return code;

        List<String> lines = GeneratedSource.lines(code);
        Set<String> notes = new LinkedHashSet<>();
        // walk backwards so insertions never shift a region still to be visited
        List<GeneratedSource.Region> contracts = GeneratedSource.contracts(lines);
        for (int c = contracts.size() - 1; c >= 0; c--) {
            GeneratedSource.Region contract = contracts.get(c);
            Set<String> stateNames = new HashSet<>();
            for (GeneratedSource.Declaration d : GeneratedSource.stateVariables(lines, contract)) {
                if (!d.constant()) stateNames.add(d.name());
            }
            List<GeneratedSource.Region> functions = GeneratedSource.functions(lines, contract);
            for (int f = functions.size() - 1; f >= 0; f--) {
                GeneratedSource.Region fn = functions.get(f);
                for (int i = fn.end() - 1; i > fn.start(); i--) {
                    Matcher m = COMPOUND.matcher(lines.get(i));
                    if (m.matches() && stateNames.contains(m.group(3))
                            && (callsFunction(m.group(2)) || callsFunction(m.group(5)))) {
                        // a guard would evaluate the call a second time
                        notes.add("Function " + fn.name() + " updates " + m.group(3)
                                + " with a call result; bind it to a local to get an overflow guard");
                        continue;
                    }
                    String guard = guardFor(lines.get(i), stateNames);
                    if (guard == null) continue;
                    if (lines.get(i - 1).equals(guard)) continue;
                    lines.add(i, guard);
                }
            }
        }
        warnings.addAll(notes);
        return GeneratedSource.join(lines);
    }

    private static boolean callsFunction(String expression) {
        Matcher m = CALL.matcher(expression);
        while (m.find()) {
            if (!CONVERSION.matcher(m.group(1)).matches()) return true;
        }
        return false;
    }

    /** Whether the pragma targets a compiler that reverts on overflow. */
    static boolean checkedByDefault(String code) {
        Matcher p = PRAGMA.matcher(code);
        if (!p.find()) return true;
        Matcher v = VERSION.matcher(p.group(1));
        if (!v.find()) return true;
        int major = Integer.parseInt(v.group(1));
        int minor = Integer.parseInt(v.group(2));
        return major > 0 || minor >= 8;
    }

    private static String guardFor(String line, Set<String> stateNames) {
        Matcher m = COMPOUND.matcher(line);
        if (m.matches() && stateNames.contains(m.group(3))) {
            String indent = m.group(1);
            String target = m.group(2);
            String value = m.group(5).trim();
            return switch (m.group(4)) {
                case "+" -> indent + "require(" + target + " + " + value + " >= " + target
                        + ", \"addition overflow\");";
                case "-" -> indent + "require(" + target + " >= " + value + ", \"subtraction underflow\");";
                default -> indent + "require(" + value + " == 0 || (" + target + " * " + value + ") / " + value
                        + " == " + target + ", \"multiplication overflow\");";
            };
        }
        Matcher s = STEP.matcher(line);
        if (s.matches() && stateNames.contains(s.group(3))) {
            String indent = s.group(1);
            String target = s.group(2);
            if (s.group(4).equals("++")) {
                return indent + "require(" + target + " + 1 > " + target + ", \"increment overflow\");";
            }
            return indent + "require(" + target + " > 0, \"decrement underflow\");";
        }
        return null;
    }
}
