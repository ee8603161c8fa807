package solidrail.codegen;

import solidrail.SolidRailException;

import java.util.List;

/**
 * Translation failure. Carries every message that caused it, in the order they were found.
 */
public class CompilationException extends SolidRailException {
    private final List<String> messages;

    public CompilationException(String message) {
        this(List.of(message));
    }

    public CompilationException(List<String> messages) {
        super(summary(messages));
        this.messages = List.copyOf(messages);
    }

    public List<String> messages() {
        return messages;
    }

    private static String summary(List<String> messages) {
        if (messages.isEmpty()) return "Compilation failed";
        if (messages.size() == 1) return messages.get(0);
        return "Compilation failed with " + messages.size() + " errors: " + String.join("; ", messages);
    }
}
