package solidrail.optimizer;

import solidrail.config.CompilerConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Reorders each contiguous run of state-variable declarations so that small types pack
 * into shared storage slots: constants first, then full-slot types, then smaller types by
 * descending width. The sort is stable; names and visibility are untouched.
 */
public final class StorageLayoutPass implements OptimizationPass {

    private record Entry(String line, GeneratedSource.Declaration declaration, int width) {
        int group() {
            if (declaration.constant()) return 0;
            return width >= 32 ? 1 : 2;
        }
    }

    @Override
    public String name() {
        return "storage-layout";
    }

    @Override
    public boolean isEnabled(CompilerConfig config) {
        return config.gasOptimizationEnabled();
    }

    @Override
    public String apply(String code, List<String> warnings) {
        List<String> lines = GeneratedSource.lines(code);
        for (GeneratedSource.Region contract : GeneratedSource.contracts(lines)) {
            Set<String> enums = GeneratedSource.enumNames(lines, contract);
            int[] depths = GeneratedSource.depths(lines);
            int i = contract.start() + 1;
            while (i < contract.end()) {
                int runEnd = runEnd(lines, depths, contract, i);
                if (runEnd > i + 1) reorder(lines, i, runEnd, enums, contract.name(), warnings);
                i = Math.max(runEnd, i + 1);
            }
        }
        return GeneratedSource.join(lines);
    }

    // first line after the run of declarations starting at `from`
    private static int runEnd(List<String> lines, int[] depths, GeneratedSource.Region contract, int from) {
        int j = from;
        while (j < contract.end() && GeneratedSource.isMember(depths, contract, j)
                && GeneratedSource.parseStateVariable(lines.get(j)) != null) {
            j++;
        }
        return j;
    }

    private static void reorder(List<String> lines, int from, int to, Set<String> enums,
                                String contract, List<String> warnings) {
        List<Entry> entries = new ArrayList<>();
        for (int i = from; i < to; i++) {
            GeneratedSource.Declaration d = GeneratedSource.parseStateVariable(lines.get(i));
            entries.add(new Entry(lines.get(i), d, GeneratedSource.storageWidth(d.type(), enums)));
        }
        for (Entry e : entries) {
            if (e.declaration().initializer() == null) continue;
            for (Entry other : entries) {
                if (other != e && GeneratedSource.mentions(e.declaration().initializer(), other.declaration().name())) {
                    warnings.add("Storage layout of " + contract + " left unchanged: initializer of "
                            + e.declaration().name() + " reads " + other.declaration().name());
                    return;
                }
            }
        }
        entries.sort(Comparator.comparingInt(Entry::group)
                .thenComparingInt(e -> e.group() == 2 ? -e.width() : 0));
        for (int i = 0; i < entries.size(); i++) lines.set(from + i, entries.get(i).line());
    }
}
