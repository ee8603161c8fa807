package solidrail.compiler;

import solidrail.ast.Node;

import java.util.List;

/**
 * Outcome of one successful compile.
 *
 * @param ast      the parsed Ruby program
 * @param errors   always empty for a returned result; failures are thrown
 * @param warnings generator, optimizer and output-validation notes, in that order
 */
public record CompilationResult(String code, Node ast, List<String> errors, List<String> warnings) {
    public CompilationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean success() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
