package solidrail.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solidrail.config.CompilerConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the optimization passes in fixed order: storage layout, checked arithmetic,
 * reentrancy ordering. Each pass is switched by its own configuration flag, and the whole
 * optimizer by {@link CompilerConfig#optimizationEnabled()}.
 */
public final class Optimizer {
    private static final Logger log = LoggerFactory.getLogger(Optimizer.class);

    private final CompilerConfig config;
    private final List<OptimizationPass> passes;

    public Optimizer(CompilerConfig config) {
        this(config, List.of(new StorageLayoutPass(), new CheckedArithmeticPass(), new ReentrancyOrderPass()));
    }

    public Optimizer(CompilerConfig config, List<OptimizationPass> passes) {
        this.config = config;
        this.passes = List.copyOf(passes);
    }

    public OptimizationResult optimize(String code) {
        if (!config.optimizationEnabled()) {
            log.debug("Optimization disabled");
            return new OptimizationResult(code, List.of());
        }
        List<String> warnings = new ArrayList<>();
        String current = code;
        for (OptimizationPass pass : passes) {
            if (!pass.isEnabled(config)) {
                log.debug("Skipping pass {}", pass.name());
                continue;
            }
            String next = pass.apply(current, warnings);
            if (!next.equals(current)) log.debug("Pass {} rewrote the code", pass.name());
            current = next;
        }
        return new OptimizationResult(current, warnings);
    }

    public List<OptimizationPass> passes() {
        return passes;
    }
}
