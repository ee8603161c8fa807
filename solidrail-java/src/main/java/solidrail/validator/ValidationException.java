package solidrail.validator;

import solidrail.SolidRailException;

import java.util.List;

/**
 * Raised when findings are promoted to failures, e.g. warnings under strict mode.
 */
public class ValidationException extends SolidRailException {
    private final List<String> messages;

    public ValidationException(List<String> messages) {
        super(messages.size() == 1 ? messages.get(0)
                : "Validation failed with " + messages.size() + " findings: " + String.join("; ", messages));
        this.messages = List.copyOf(messages);
    }

    public List<String> messages() {
        return messages;
    }
}
