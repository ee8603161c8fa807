package solidrail.codegen;

import solidrail.types.StaticType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Block-structured local variables of one function. Ruby names are resolved innermost
 * first; each declaration picks a target name that collides neither with a state variable
 * nor with a visible local.
 */
final class LocalScope {

    record Local(String sourceName, String name, StaticType type) {}

    private final Deque<Map<String, Local>> frames = new ArrayDeque<>();
    private final Set<String> memberNames;

    LocalScope(Set<String> memberNames) {
        this.memberNames = memberNames;
    }

    void push() {
        frames.push(new HashMap<>());
    }

    void pop() {
        frames.pop();
    }

    Local resolve(String sourceName) {
        for (Map<String, Local> f : frames) {
            Local l = f.get(sourceName);
            if (l != null) return l;
        }
        return null;
    }

    /** Declares a Ruby local or parameter in the innermost frame. */
    Local declare(String sourceName, StaticType type) {
        String name = Names.safeIdentifier(sourceName);
        if (memberNames.contains(name)) name = "_" + name;
        name = unique(name);
        Local l = new Local(sourceName, name, type);
        frames.peek().put(sourceName, l);
        return l;
    }

    /** Declares a compiler-introduced local (loop index, cached length). */
    Local declareSynthetic(String base, StaticType type) {
        String name = unique(memberNames.contains(base) ? "_" + base : base);
        // keyed by target name; synthetic locals are never looked up by Ruby name
        Local l = new Local("#" + name, name, type);
        frames.peek().put(l.sourceName(), l);
        return l;
    }

    private String unique(String base) {
        if (!isVisible(base)) return base;
        int n = 2;
        while (isVisible(base + n)) n++;
        return base + n;
    }

    private boolean isVisible(String targetName) {
        for (Map<String, Local> f : frames) {
            for (Local l : f.values()) {
                if (l.name().equals(targetName)) return true;
            }
        }
        return false;
    }

    StaticType typeOf(String sourceName) {
        Local l = resolve(sourceName);
        return l == null ? null : l.type();
    }
}
