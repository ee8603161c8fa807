package solidrail.compiler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import solidrail.codegen.CompilationException;
import solidrail.config.CompilerConfig;
import solidrail.config.Configuration;
import solidrail.parser.ParseException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CompilerTest {

    @TempDir
    Path tmp;

    @AfterEach
    void restoreDefaults() {
        Configuration.reset();
    }

    static String fixture(String name) throws IOException {
        try (InputStream in = CompilerTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void compiles_token_fixture() throws IOException {
        var result = new Compiler().compile(fixture("token.rb"));
        assertTrue(result.success());
        assertEquals(fixture("token.sol"), result.code());
        assertTrue(result.errors().isEmpty());
        assertFalse(result.hasWarnings(), result.warnings().toString());
        assertNotNull(result.ast());
    }

    @Test
    void rejects_dynamic_code_before_parsing() {
        String src = """
                class Evil
                  def initialize
                    eval("1")
                    system("ls")
                  end
                end
                """;
        var ex = assertThrows(CompilationException.class, () -> new Compiler().compile(src));
        assertEquals(2, ex.messages().size());
        assertTrue(ex.messages().get(0).contains("eval"));
        assertTrue(ex.messages().get(1).contains("system"));
    }

    @Test
    void rejects_dynamic_code_inside_string_interpolation() {
        String src = "class Evil\n  def initialize\n    @name = \"#{eval('1')}\"\n  end\nend\n";
        var ex = assertThrows(CompilationException.class, () -> new Compiler().compile(src));
        assertEquals(1, ex.messages().size());
        assertTrue(ex.messages().get(0).contains("eval at line 3"), ex.messages().toString());
    }

    @Test
    void withdraw_that_reads_the_balance_keeps_its_order() {
        String src = """
                class Vault
                  def initialize
                    @balances = {}
                  end

                  def withdraw_all
                    msg.sender.transfer(@balances[msg.sender])
                    @balances[msg.sender] = 0
                  end
                end
                """;
        var result = new Compiler(CompilerConfig.defaults()).compile(src);
        String code = result.code();
        int call = code.indexOf("payable(msg.sender).transfer(balances[msg.sender]);");
        int write = code.indexOf("balances[msg.sender] = 0;");
        assertTrue(call >= 0 && call < write, code);
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("writes balances after an external call")),
                result.warnings().toString());
    }

    @Test
    void parse_errors_propagate() {
        String src = "class A\n  def initialize\n    x = (1\n  end\nend\n";
        assertThrows(ParseException.class, () -> new Compiler().compile(src));
    }

    @Test
    void configuration_is_read_per_compile() throws IOException {
        var compiler = new Compiler();
        Configuration.configure(c -> c.withTargetVersion("^0.8.21"));
        assertTrue(compiler.compile(fixture("token.rb")).code().contains("pragma solidity ^0.8.21;"));
        Configuration.reset();
        assertTrue(compiler.compile(fixture("token.rb")).code().contains("pragma solidity ^0.8.30;"));
    }

    @Test
    void explicit_config_wins_over_process_defaults() throws IOException {
        Configuration.configure(c -> c.withTargetVersion("^0.8.21"));
        var compiler = new Compiler(CompilerConfig.defaults().withTargetVersion("0.8.24"));
        assertTrue(compiler.compile(fixture("token.rb")).code().contains("pragma solidity 0.8.24;"));
    }

    @Test
    void legacy_target_gets_arithmetic_guards() {
        String src = """
                class Counter
                  def initialize
                    @count = 0
                  end

                  def bump(step)
                    @count += step
                  end
                end
                """;
        var result = new Compiler(CompilerConfig.defaults().withTargetVersion("^0.7.6")).compile(src);
        assertTrue(result.code().contains("require(count + step >= count, \"addition overflow\");"), result.code());
    }

    @Test
    void output_findings_become_warnings() {
        String src = """
                class Clock
                  def initialize
                    @started = block.timestamp
                  end
                end
                """;
        var result = new Compiler().compile(src);
        assertTrue(result.success());
        assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith("warning: block.timestamp")),
                result.warnings().toString());
    }

    @Test
    void writes_output_file_creating_directories() throws IOException {
        Path out = tmp.resolve("build/contracts/Token.sol");
        var result = new Compiler().compile(fixture("token.rb"), out);
        assertEquals(result.code(), Files.readString(out));
    }

    @Test
    void compile_file_defaults_to_sibling_sol() throws IOException {
        Path input = tmp.resolve("token.rb");
        Files.writeString(input, fixture("token.rb"));
        new Compiler().compileFile(input);
        assertEquals(fixture("token.sol"), Files.readString(tmp.resolve("token.sol")));
    }

    @Test
    void default_output_path() {
        assertEquals(Path.of("a/b/vault.sol"), Compiler.defaultOutput(Path.of("a/b/vault.rb")));
        assertEquals(Path.of("script.sol"), Compiler.defaultOutput(Path.of("script")));
    }

    @Test
    void null_source_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new Compiler().compile(null));
    }
}
