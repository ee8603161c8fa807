package solidrail.cli;

import solidrail.SolidRailException;
import solidrail.Version;
import solidrail.compiler.BatchCompiler;
import solidrail.compiler.CompilationResult;
import solidrail.compiler.Compiler;
import solidrail.config.CompilerConfig;
import solidrail.config.Configuration;
import solidrail.parser.Parser;
import solidrail.validator.Finding;
import solidrail.validator.ValidationException;
import solidrail.validator.Validator;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Main {
    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT = String.join("\n",
            "Usage: solidrail <command> [options]",
            "  compile <input.rb>... [-o <output>] [--config <file>] [--target <version>]",
            "                        [--no-optimize] [--strict] [--threads <n>]",
            "  parse <input.rb>",
            "  validate <input.rb>...",
            "  version");

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1) {
            err.println(USAGE_TEXT);
            return USAGE;
        }
        String command = args[0];
        List<String> rest = List.of(args).subList(1, args.length);
        try {
            return switch (command) {
                case "compile" -> compile(rest, out, err);
                case "parse" -> parse(rest, out, err);
                case "validate" -> validate(rest, out, err);
                case "version", "--version" -> {
                    out.println("solidrail " + Version.VERSION);
                    yield OK;
                }
                case "help", "--help", "-h" -> {
                    out.println(USAGE_TEXT);
                    yield OK;
                }
                default -> usage(err, "Unknown command: " + command);
            };
        } catch (UsageException ex) {
            return usage(err, ex.getMessage());
        } catch (SolidRailException ex) {
            err.println("✗ " + ex.getMessage());
            return FAILED;
        } catch (IOException ex) {
            err.println("✗ I/O error: " + ex.getMessage());
            return FAILED;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            err.println("✗ Interrupted");
            return FAILED;
        }
    }

    private static int compile(List<String> args, PrintStream out, PrintStream err)
            throws IOException, InterruptedException {
        List<Path> inputs = new ArrayList<>();
        Path output = null;
        Path configFile = null;
        String target = null;
        boolean optimize = true;
        boolean strict = false;
        int threads = Runtime.getRuntime().availableProcessors();

        for (int i = 0; i < args.size(); i++) {
            String a = args.get(i);
            switch (a) {
                case "-o", "--output" -> output = Path.of(value(args, ++i, a));
                case "--config" -> configFile = Path.of(value(args, ++i, a));
                case "--target" -> target = value(args, ++i, a);
                case "--threads" -> threads = positive(value(args, ++i, a), a);
                case "--no-optimize" -> optimize = false;
                case "--strict" -> strict = true;
                default -> {
                    if (a.startsWith("-")) throw new UsageException("Unknown option: " + a);
                    inputs.add(Path.of(a));
                }
            }
        }
        if (inputs.isEmpty()) throw new UsageException("compile needs at least one input file");

        CompilerConfig config = configFile != null ? loadConfig(configFile) : Configuration.current();
        if (target != null) config = config.withTargetVersion(target);
        if (!optimize) config = config.withOptimization(false);
        Compiler compiler = new Compiler(config);

        if (inputs.size() == 1) {
            Path input = inputs.get(0);
            Path dest = output != null ? output : Compiler.defaultOutput(input);
            out.println("[1/2] Compiling: " + input);
            CompilationResult result = compiler.compileFile(input, dest);
            printWarnings(result.warnings(), err);
            if (strict && result.hasWarnings()) throw new ValidationException(result.warnings());
            out.println("[2/2] Written: " + dest);
            out.println("\n✓ Success: " + dest);
            out.println("  Lines:    " + result.code().lines().count());
            out.println("  Warnings: " + result.warnings().size());
            return OK;
        }

        int failed = 0;
        try (BatchCompiler batch = new BatchCompiler(compiler, threads)) {
            for (BatchCompiler.Outcome o : batch.compileAll(inputs, output)) {
                if (!o.success()) {
                    failed++;
                    err.println("✗ " + o.input() + ": " + o.failure().getMessage());
                    continue;
                }
                printWarnings(o.result().warnings(), err);
                if (strict && o.result().hasWarnings()) {
                    failed++;
                    err.println("✗ " + o.input() + ": warnings treated as errors");
                    continue;
                }
                out.println("✓ " + o.input() + " -> " + o.output());
            }
        }
        out.println("\n" + (inputs.size() - failed) + " compiled, " + failed + " failed");
        return failed == 0 ? OK : FAILED;
    }

    private static int parse(List<String> args, PrintStream out, PrintStream err) throws IOException {
        if (args.size() != 1) throw new UsageException("parse takes exactly one input file");
        String source = Files.readString(Path.of(args.get(0)));
        out.print(AstPrinter.print(Parser.parse(source)));
        return OK;
    }

    private static int validate(List<String> args, PrintStream out, PrintStream err) throws IOException {
        if (args.isEmpty()) throw new UsageException("validate needs at least one input file");
        boolean clean = true;
        for (String a : args) {
            List<Finding> findings = Validator.validateSource(Files.readString(Path.of(a)));
            for (Finding f : findings) err.println(a + ": " + f);
            if (Validator.hasErrors(findings)) {
                clean = false;
            } else {
                out.println("✓ " + a);
            }
        }
        return clean ? OK : FAILED;
    }

    static CompilerConfig loadConfig(Path file) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        try {
            return CompilerConfig.fromProperties(props);
        } catch (IllegalArgumentException ex) {
            throw new UsageException(file + ": " + ex.getMessage());
        }
    }

    private static void printWarnings(List<String> warnings, PrintStream err) {
        for (String w : warnings) err.println("  ! " + w);
    }

    private static String value(List<String> args, int i, String option) {
        if (i >= args.size()) throw new UsageException(option + " needs a value");
        return args.get(i);
    }

    private static int positive(String v, String option) {
        int n;
        try {
            n = Integer.parseInt(v);
        } catch (NumberFormatException ex) {
            n = 0;
        }
        if (n < 1) throw new UsageException(option + " expects a positive integer, got " + v);
        return n;
    }

    private static int usage(PrintStream err, String message) {
        err.println(message);
        err.println(USAGE_TEXT);
        return USAGE;
    }

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
