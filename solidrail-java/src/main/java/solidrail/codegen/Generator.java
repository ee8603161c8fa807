package solidrail.codegen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solidrail.ast.Node;
import solidrail.ast.NodeKind;
import solidrail.config.CompilerConfig;
import solidrail.ir.ContractSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a parsed Ruby program into Solidity source text.
 *
 * <p>One instance serves one generation run; {@link #warnings()} holds the non-fatal notes
 * collected along the way.
 */
public final class Generator {
    private static final Logger log = LoggerFactory.getLogger(Generator.class);

    private final CompilerConfig config;
    private final List<String> warnings = new ArrayList<>();

    public Generator(CompilerConfig config) {
        this.config = config;
    }

    public String generate(Node program) {
        List<ContractSpec> contracts = buildContracts(program);
        List<String> imports = imports(program);
        String code = new SolidityWriter().render(config.targetVersion(), imports, contracts);
        log.debug("Generated {} contract(s), {} import(s), {} line(s)",
                contracts.size(), imports.size(), code.lines().count());
        return code;
    }

    /** One contract per top-level class, in source order. */
    public List<ContractSpec> buildContracts(Node program) {
        if (!program.is(NodeKind.PROGRAM)) {
            throw new IllegalArgumentException("Expected PROGRAM node, got " + program.kind());
        }
        List<ContractSpec> contracts = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Node stmt : program.children()) {
            switch (stmt.kind()) {
                case CLASS -> {
                    try {
                        ContractSpec c = new ContractBuilder(stmt, warnings).build();
                        log.debug("Built contract {}: {} state variable(s), {} function(s)",
                                c.name(), c.stateVariables().size(), c.functions().size());
                        contracts.add(c);
                    } catch (CompilationException ex) {
                        errors.addAll(ex.messages());
                    }
                }
                case IMPORT -> { }
                default -> warnings.add(stmt.where() + "Ignoring top-level " + stmt.kind().name().toLowerCase()
                        + " outside a class");
            }
        }
        if (!errors.isEmpty()) throw new CompilationException(errors);
        if (contracts.isEmpty()) throw new CompilationException("No class declaration to translate");
        return contracts;
    }

    /** Import paths of every require in the program, first occurrence order. */
    static List<String> imports(Node program) {
        Set<String> out = new LinkedHashSet<>();
        for (Node imp : program.findNodes(NodeKind.IMPORT)) out.add(importPath(imp.text()));
        return new ArrayList<>(out);
    }

    private static String importPath(String path) {
        if (path.endsWith(".sol")) return path;
        if (path.endsWith(".rb")) return path.substring(0, path.length() - 3) + ".sol";
        return path + ".sol";
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
