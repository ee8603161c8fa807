package solidrail.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solidrail.ast.Node;
import solidrail.codegen.CompilationException;
import solidrail.codegen.Generator;
import solidrail.config.CompilerConfig;
import solidrail.config.Configuration;
import solidrail.optimizer.OptimizationResult;
import solidrail.optimizer.Optimizer;
import solidrail.parser.Parser;
import solidrail.validator.Finding;
import solidrail.validator.Validator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Ruby to Solidity pipeline: validate source, parse, generate, optimize, validate output.
 *
 * <p>Settings are fixed at construction or, for the no-argument constructor, read from
 * {@link Configuration#current()} once at the start of every compile. Instances hold no
 * per-compile state and may be shared between threads.
 */
public final class Compiler {
    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CompilerConfig config;

    public Compiler() {
        this(null);
    }

    public Compiler(CompilerConfig config) {
        this.config = config;
    }

    public CompilationResult compile(String source) {
        return run(source, snapshot());
    }

    /** Compiles and writes the generated code to {@code output}. */
    public CompilationResult compile(String source, Path output) throws IOException {
        CompilationResult result = run(source, snapshot());
        if (output != null) write(output, result.code());
        return result;
    }

    /** Compiles {@code input} to a sibling file with the {@code .sol} extension. */
    public CompilationResult compileFile(Path input) throws IOException {
        return compileFile(input, defaultOutput(input));
    }

    public CompilationResult compileFile(Path input, Path output) throws IOException {
        log.debug("Reading {}", input);
        String source = Files.readString(input);
        CompilationResult result = compile(source, output);
        log.info("Compiled {} -> {} ({} warning(s))", input, output, result.warnings().size());
        return result;
    }

    public static Path defaultOutput(Path input) {
        String file = input.getFileName().toString();
        String base = file.endsWith(".rb") ? file.substring(0, file.length() - 3) : file;
        return input.resolveSibling(base + ".sol");
    }

    private CompilerConfig snapshot() {
        return config != null ? config : Configuration.current();
    }

    private CompilationResult run(String source, CompilerConfig cfg) {
        if (source == null) throw new IllegalArgumentException("source");
        log.debug("Compiling {} character(s), target {}", source.length(), cfg.targetVersion());

        // 1. reject disallowed input before parsing
        List<Finding> pre = Validator.validateSource(source);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Finding f : pre) {
            if (f.isError()) errors.add(f.message());
            else warnings.add(f.message());
        }
        if (!errors.isEmpty()) {
            log.debug("Source validation failed: {}", errors);
            throw new CompilationException(errors);
        }

        // 2. parse
        Node ast = Parser.parse(source);
        log.debug("Parsed {} top-level statement(s)", ast.childCount());

        // 3. generate
        Generator generator = new Generator(cfg);
        String code = generator.generate(ast);
        warnings.addAll(generator.warnings());

        // 4. optimize
        OptimizationResult optimized = new Optimizer(cfg).optimize(code);
        code = optimized.code();
        warnings.addAll(optimized.warnings());

        // 5. check the output; findings never fail the compile
        for (Finding f : Validator.validateGenerated(code)) warnings.add(f.toString());

        log.debug("Generated {} line(s) with {} warning(s)", code.lines().count(), warnings.size());
        return new CompilationResult(code, ast, List.of(), warnings);
    }

    private static void write(Path output, String code) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(output, code);
        log.debug("Wrote {}", output);
    }
}
