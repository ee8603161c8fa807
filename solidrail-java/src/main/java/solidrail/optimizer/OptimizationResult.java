package solidrail.optimizer;

import java.util.List;

public record OptimizationResult(String code, List<String> warnings) {
    public OptimizationResult {
        warnings = List.copyOf(warnings);
    }
}
