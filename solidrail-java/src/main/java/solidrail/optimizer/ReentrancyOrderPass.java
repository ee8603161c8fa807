package solidrail.optimizer;

import solidrail.config.CompilerConfig;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Enforces checks-effects-interactions for balance tables: a write to a
 * {@code mapping(address => uintN)} state variable that follows an external call in the same
 * block is moved in front of the call when that is safe, otherwise reported.
 */
public final class ReentrancyOrderPass implements OptimizationPass {
    private static final Pattern BALANCE_MAPPING =
            Pattern.compile("^mapping\\(\\s*address(?:\\s+payable)?\\s*=>\\s*u?int\\d*\\s*\\)$");
    private static final Pattern EXTERNAL_CALL = Pattern.compile("\\.(?:transfer|send|call)\\s*[({]");
    private static final Pattern WRITE =
            Pattern.compile("^\\s*(?:delete\\s+([A-Za-z_]\\w*)\\s*\\[.*|([A-Za-z_]\\w*)\\s*\\[.*]\\s*[-+*/%]?=(?!=).*);\\s*$");
    private static final Pattern TUPLE_BINDING = Pattern.compile("^\\s*\\(([^)]*)\\)\\s*=(?!=)");
    private static final Pattern DECLARATION = Pattern.compile(
            "^\\s*[A-Za-z_][\\w.]*(?:\\[\\d*])*(?:\\s+(?:memory|storage|calldata|payable))?\\s+([A-Za-z_]\\w*)\\s*(?:=(?!=)|;)");
    private static final Pattern ASSIGNMENT = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*=(?!=)");

    @Override
    public String name() {
        return "reentrancy-order";
    }

    @Override
    public boolean isEnabled(CompilerConfig config) {
        return config.securityChecksEnabled();
    }

    @Override
    public String apply(String code, List<String> warnings) {
        List<String> lines = GeneratedSource.lines(code);
        Set<String> notes = new LinkedHashSet<>();
        for (GeneratedSource.Region contract : GeneratedSource.contracts(lines)) {
            Set<String> balances = new HashSet<>();
            for (GeneratedSource.Declaration d : GeneratedSource.stateVariables(lines, contract)) {
                if (BALANCE_MAPPING.matcher(d.type()).matches()) balances.add(d.name());
            }
            if (balances.isEmpty()) continue;
            for (GeneratedSource.Region fn : GeneratedSource.functions(lines, contract)) {
                // moves keep the line count, so regions stay valid
                boolean moved = true;
                while (moved) moved = moveOne(lines, fn, balances, notes);
            }
        }
        warnings.addAll(notes);
        return GeneratedSource.join(lines);
    }

    private static boolean moveOne(List<String> lines, GeneratedSource.Region fn, Set<String> balances, Set<String> notes) {
        int[] depths = GeneratedSource.depths(lines);
        for (int c = fn.start() + 1; c < fn.end(); c++) {
            String call = lines.get(c);
            if (!EXTERNAL_CALL.matcher(call).find() || GeneratedSource.braceDelta(call) != 0) continue;

            Set<String> blocked = boundNames(call);
            boolean nestedBetween = false;
            for (int w = c + 1; w < fn.end(); w++) {
                if (depths[w] < depths[c]) break;
                String line = lines.get(w);
                String mapping = balanceWrite(line, balances);
                boolean sameBlock = depths[w] == depths[c] && GeneratedSource.braceDelta(line) == 0;

                if (mapping != null) {
                    if (!sameBlock || nestedBetween || mentionsAny(line, blocked) || readBefore(lines, c, w, mapping)) {
                        notes.add("Function " + fn.name() + " writes " + mapping
                                + " after an external call; move the update before the call");
                        break;
                    }
                    lines.remove(w);
                    lines.add(c, line);
                    return true;
                }
                if (!sameBlock) nestedBetween = true;
                blocked.addAll(boundNames(line));
            }
        }
        return false;
    }

    private static String balanceWrite(String line, Set<String> balances) {
        Matcher m = WRITE.matcher(line);
        if (!m.matches()) return null;
        String name = m.group(1) != null ? m.group(1) : m.group(2);
        return balances.contains(name) ? name : null;
    }

    // names a statement binds: tuple destructuring, declarations, plain assignments
    private static Set<String> boundNames(String line) {
        Set<String> out = new HashSet<>();
        Matcher t = TUPLE_BINDING.matcher(line);
        if (t.find()) {
            for (String part : t.group(1).split(",")) {
                String[] words = part.trim().split("\\s+");
                String last = words[words.length - 1];
                if (!last.isEmpty()) out.add(last);
            }
            return out;
        }
        Matcher d = DECLARATION.matcher(line);
        if (d.find()) {
            out.add(d.group(1));
            return out;
        }
        Matcher a = ASSIGNMENT.matcher(line);
        if (a.find()) out.add(a.group(1));
        return out;
    }

    // the call or a statement between it and the write reads the mapping being written
    private static boolean readBefore(List<String> lines, int call, int write, String mapping) {
        for (int i = call; i < write; i++) {
            if (GeneratedSource.mentions(lines.get(i), mapping)) return true;
        }
        return false;
    }

    private static boolean mentionsAny(String line, Set<String> names) {
        for (String n : names) {
            if (GeneratedSource.mentions(line, n)) return true;
        }
        return false;
    }
}
