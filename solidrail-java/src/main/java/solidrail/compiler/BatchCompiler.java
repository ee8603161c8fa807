package solidrail.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compiles many files on a fixed thread pool. Every task parses its own tree and takes its
 * own configuration snapshot; one failing file does not stop the others.
 */
public final class BatchCompiler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchCompiler.class);

    /** Result for one input; exactly one of {@code result} and {@code failure} is set. */
    public record Outcome(Path input, Path output, CompilationResult result, Exception failure) {
        public boolean success() {
            return failure == null;
        }
    }

    private final Compiler compiler;
    private final ExecutorService pool;

    public BatchCompiler(Compiler compiler, int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be positive: " + threads);
        this.compiler = compiler;
        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "solidrail-batch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Compiles every input; outputs go next to the inputs, or into {@code outputDir} when given.
     * Outcomes are returned in input order.
     */
    public List<Outcome> compileAll(List<Path> inputs, Path outputDir) throws InterruptedException {
        List<Future<CompilationResult>> futures = new ArrayList<>();
        List<Path> outputs = new ArrayList<>();
        for (Path input : inputs) {
            Path output = outputDir == null
                    ? Compiler.defaultOutput(input)
                    : outputDir.resolve(Compiler.defaultOutput(input).getFileName());
            outputs.add(output);
            futures.add(pool.submit(() -> compiler.compileFile(input, output)));
        }

        List<Outcome> outcomes = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            try {
                outcomes.add(new Outcome(inputs.get(i), outputs.get(i), futures.get(i).get(), null));
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof Error err) throw err;
                log.debug("Compiling {} failed", inputs.get(i), cause);
                outcomes.add(new Outcome(inputs.get(i), outputs.get(i), null, (Exception) cause));
            }
        }
        long failed = outcomes.stream().filter(o -> !o.success()).count();
        log.info("Batch finished: {} compiled, {} failed", outcomes.size() - failed, failed);
        return outcomes;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) pool.shutdownNow();
        } catch (InterruptedException ex) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
