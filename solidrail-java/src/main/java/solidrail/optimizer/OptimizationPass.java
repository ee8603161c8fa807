package solidrail.optimizer;

import solidrail.config.CompilerConfig;

import java.util.List;

/**
 * A text-level rewrite of generated Solidity. Applying a pass to its own output must not
 * change it further.
 */
public interface OptimizationPass {

    String name();

    boolean isEnabled(CompilerConfig config);

    /**
     * @param warnings sink for notes about code the pass recognized but left unchanged
     */
    String apply(String code, List<String> warnings);
}
