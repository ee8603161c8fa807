package solidrail.compiler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import solidrail.codegen.CompilationException;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchCompilerTest {

    @TempDir
    Path tmp;

    private Path writeContract(String name, int supply) throws Exception {
        Path p = tmp.resolve(name.toLowerCase() + ".rb");
        Files.writeString(p, "class " + name + "\n  def initialize\n    @supply = " + supply + "\n  end\nend\n");
        return p;
    }

    @Test
    void compiles_many_files_concurrently_in_input_order() throws Exception {
        List<Path> inputs = new ArrayList<>();
        for (int i = 0; i < 20; i++) inputs.add(writeContract("C" + i, i));
        Path outDir = tmp.resolve("out");

        List<BatchCompiler.Outcome> outcomes;
        try (BatchCompiler batch = new BatchCompiler(new Compiler(), 4)) {
            outcomes = batch.compileAll(inputs, outDir);
        }

        assertEquals(20, outcomes.size());
        for (int i = 0; i < 20; i++) {
            var o = outcomes.get(i);
            assertTrue(o.success(), String.valueOf(o.failure()));
            assertEquals(inputs.get(i), o.input());
            assertEquals(outDir.resolve("c" + i + ".sol"), o.output());
            String code = Files.readString(o.output());
            assertTrue(code.contains("contract C" + i + " {"));
            assertTrue(code.contains("uint256 public supply = " + i + ";"));
        }
    }

    @Test
    void one_failure_does_not_stop_the_batch() throws Exception {
        Path good = writeContract("Good", 1);
        Path bad = tmp.resolve("bad.rb");
        Files.writeString(bad, "class Bad\n  def initialize\n    eval('x')\n  end\nend\n");
        Path missing = tmp.resolve("missing.rb");

        List<BatchCompiler.Outcome> outcomes;
        try (BatchCompiler batch = new BatchCompiler(new Compiler(), 2)) {
            outcomes = batch.compileAll(List.of(good, bad, missing), null);
        }

        assertTrue(outcomes.get(0).success());
        assertEquals(tmp.resolve("good.sol"), outcomes.get(0).output());
        assertTrue(Files.exists(tmp.resolve("good.sol")));

        assertInstanceOf(CompilationException.class, outcomes.get(1).failure());
        assertNull(outcomes.get(1).result());
        assertFalse(Files.exists(tmp.resolve("bad.sol")));

        assertInstanceOf(NoSuchFileException.class, outcomes.get(2).failure());
    }

    @Test
    void rejects_non_positive_thread_count() {
        assertThrows(IllegalArgumentException.class, () -> new BatchCompiler(new Compiler(), 0));
    }
}
