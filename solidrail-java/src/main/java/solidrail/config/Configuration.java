package solidrail.config;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Process-wide default settings. Compile runs read {@link #current()} once at entry and
 * keep that snapshot, so a concurrent {@link #configure} never leaks into a run in flight.
 */
public final class Configuration {
    private static final AtomicReference<CompilerConfig> CURRENT =
            new AtomicReference<>(CompilerConfig.defaults());

    private Configuration() {}

    public static CompilerConfig current() {
        return CURRENT.get();
    }

    public static void init(CompilerConfig config) {
        if (config == null) throw new IllegalArgumentException("config");
        CURRENT.set(config);
    }

    public static CompilerConfig configure(UnaryOperator<CompilerConfig> change) {
        return CURRENT.updateAndGet(change);
    }

    public static void reset() {
        CURRENT.set(CompilerConfig.defaults());
    }
}
