package solidrail.codegen;

import org.junit.jupiter.api.Test;
import solidrail.config.CompilerConfig;
import solidrail.ir.ContractSpec;
import solidrail.ir.FunctionSpec;
import solidrail.parser.Parser;
import solidrail.types.Mutability;
import solidrail.types.Visibility;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorTest {

    private static String generate(String src) {
        return new Generator(CompilerConfig.defaults()).generate(Parser.parse(src));
    }

    private static ContractSpec contract(String src) {
        return new Generator(CompilerConfig.defaults()).buildContracts(Parser.parse(src)).get(0);
    }

    private static int occurrences(String text, String needle) {
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) n++;
        return n;
    }

    @Test
    void token_contract_renders_exactly() {
        String code = generate("""
            class Token
              def initialize(name, symbol)
                @name = name
                @symbol = symbol
                @total_supply = 1000000
              end
            end
            """);
        assertEquals("""
            // SPDX-License-Identifier: MIT
            pragma solidity ^0.8.30;

            contract Token {
                string public name;
                string public symbol;
                uint256 public total_supply = 1000000;

                constructor(string memory _name, string memory _symbol) {
                    name = _name;
                    symbol = _symbol;
                }
            }
            """, code);
    }

    @Test
    void target_version_comes_from_config() {
        var gen = new Generator(CompilerConfig.defaults().withTargetVersion("^0.8.20"));
        String code = gen.generate(Parser.parse("class A\n  def initialize\n  end\nend\n"));
        assertTrue(code.contains("pragma solidity ^0.8.20;"));
    }

    @Test
    void visibility_from_underscore_tag_and_section() {
        var c = contract("""
            class Vault
              def initialize
                @total = 0
              end

              def _bump
                @total += 1
              end

              # @public
              def _forced
                @total -= 1
              end

              private

              def helper
                @total = 5
              end
            end
            """);
        assertEquals(Visibility.PRIVATE, c.function("_bump").visibility());
        assertEquals(Visibility.PUBLIC, c.function("_forced").visibility());
        assertEquals(Visibility.PRIVATE, c.function("helper").visibility());
        assertTrue(c.functions().get(0).isConstructor());
        assertEquals("0", c.stateVariable("total").initializer());
    }

    @Test
    void sequence_loop_caches_length_once() {
        String code = generate("""
            class Airdrop
              def initialize
                @total = 0
              end

              def distribute(recipients, amount)
                recipients.each do |recipient|
                  @total += recipients.length
                end
              end
            end
            """);
        assertTrue(code.contains("""
                function distribute(address[] memory recipients, uint256 amount) public {
                    uint256 recipientsLength = recipients.length;
                    for (uint256 i = 0; i < recipientsLength; i++) {
                        address recipient = recipients[i];
                        total += recipientsLength;
                    }
                }
            """), code);
        assertEquals(1, occurrences(code, "recipients.length"));
    }

    @Test
    void range_and_times_loops() {
        String code = generate("""
            class Counter
              def initialize
                @count = 0
              end

              def run(n)
                for k in 1..n
                  @count += k
                end
                n.times do
                  @count -= 1
                end
              end
            end
            """);
        assertTrue(code.contains("for (uint256 k = 1; k <= n; k++) {"), code);
        assertTrue(code.contains("for (uint256 i = 0; i < n; i++) {"), code);
    }

    @Test
    void nested_mapping_from_index_depth() {
        String code = generate("""
            class Allowances
              def initialize
                @allowances = {}
              end

              def approve(spender, amount)
                @allowances[msg.sender][spender] = amount
              end
            end
            """);
        assertTrue(code.contains("mapping(address => mapping(address => uint256)) public allowances;"), code);
        assertTrue(code.contains("allowances[msg.sender][spender] = amount;"), code);
        assertTrue(code.contains("function approve(address spender, uint256 amount) public {"), code);
    }

    @Test
    void symbol_array_constant_becomes_enum() {
        String code = generate("""
            class Order
              STATUS = [:pending, :shipped]

              def initialize
                @status = :pending
              end

              def ship
                @status = :shipped
              end
            end
            """);
        assertTrue(code.contains("enum Status { Pending, Shipped }"), code);
        assertTrue(code.contains("Status public status = Status.Pending;"), code);
        assertTrue(code.contains("status = Status.Shipped;"), code);
    }

    @Test
    void numeric_constants() {
        var c = contract("""
            class Capped
              MAX = 10 ** 18
              HALF = MAX / 2

              def initialize
              end
            end
            """);
        assertTrue(c.stateVariable("MAX").constant());
        assertEquals("10 ** 18", c.stateVariable("MAX").initializer());
        assertEquals("MAX / 2", c.stateVariable("HALF").initializer());
    }

    @Test
    void emitted_events_are_declared() {
        String code = generate("""
            class Bank
              def initialize
                @balances = {}
              end

              def deposit(amount)
                @balances[msg.sender] += amount
                emit :Deposited, msg.sender, amount
              end
            end
            """);
        assertTrue(code.contains("mapping(address => uint256) public balances;"), code);
        assertTrue(code.contains("event Deposited(address sender, uint256 amount);"), code);
        assertTrue(code.contains("balances[msg.sender] += amount;"), code);
        assertTrue(code.contains("emit Deposited(msg.sender, amount);"), code);
    }

    @Test
    void keyword_emit_uses_labels_as_parameter_names() {
        var c = contract("""
            class Pay
              def initialize
              end

              def pay(to, amount)
                emit :Paid, to: to, value: amount
              end
            end
            """);
        var event = c.events().get(0);
        assertEquals("Paid", event.name());
        assertEquals("to", event.parameters().get(0).name());
        assertEquals("address", event.parameters().get(0).type().typeName());
        assertEquals("value", event.parameters().get(1).name());
    }

    @Test
    void trailing_expression_is_returned() {
        var c = contract("""
            class Calc
              def initialize
              end

              # @view
              def double(value)
                value * 2
              end
            end
            """);
        FunctionSpec f = c.function("double");
        assertEquals("uint256", f.returnType().typeName());
        assertEquals(Mutability.VIEW, f.mutability());

        String code = generate("""
            class Calc
              def initialize
              end

              # @view
              def double(value)
                value * 2
              end
            end
            """);
        assertTrue(code.contains("function double(uint256 value) public view returns (uint256) {"), code);
        assertTrue(code.contains("return value * 2;"), code);
    }

    @Test
    void local_assigned_in_branches_is_declared_before_them() {
        String expected = String.join("\n",
                "        uint256 y;",
                "        if (amount > 10) {",
                "            y = 1;",
                "        } else {",
                "            y = 2;",
                "        }",
                "        return y;");
        for (String header : new String[] {"class Picker", "class Picker < Base"}) {
            String code = generate(header + """

                  def initialize
                  end

                  def pick(amount)
                    if amount > 10
                      y = 1
                    else
                      y = 2
                    end
                    y
                  end
                end
                """);
            assertTrue(code.contains(expected), code);
            assertFalse(code.contains("y()"), code);
        }
    }

    @Test
    void local_assigned_in_loop_survives_the_loop() {
        String code = generate("""
            class Counter
              def initialize
              end

              def count_down(amount)
                while amount > 0
                  last = amount
                  amount -= 1
                end
                return last
              end
            end
            """);
        assertTrue(code.contains(String.join("\n",
                "        uint256 last;",
                "        while (amount > 0) {",
                "            last = amount;")), code);
        assertTrue(code.contains("return last;"), code);
    }

    @Test
    void block_local_read_after_the_block_is_an_error() {
        var ex = assertThrows(CompilationException.class, () -> generate("""
            class Scan < Base
              def initialize
              end

              def f(items)
                items.each do |item|
                  y = item
                end
                return y
              end
            end
            """));
        assertTrue(ex.getMessage().contains("Local variable 'y' is read where no assignment to it is visible"),
                ex.getMessage());
    }

    @Test
    void numeric_use_overrides_name_based_parameter_type() {
        String code = generate("""
            class Switch
              def initialize
              end

              def pick(flag)
                require flag > 0, "zero"
              end

              def toggle(flag)
                @on = flag
              end
            end
            """);
        assertTrue(code.contains("function pick(uint256 flag)"), code);
        assertTrue(code.contains("function toggle(bool flag)"), code);
    }

    @Test
    void declared_param_and_return_types() {
        String code = generate("""
            class Registry
              def initialize
              end

              # @param label [String]
              # @param weight [uint8]
              # @return [Boolean]
              def register(label, weight)
                true
              end
            end
            """);
        assertTrue(code.contains("function register(string memory label, uint8 weight) public returns (bool) {"), code);
    }

    @Test
    void predicate_method_and_require_and_unless() {
        String code = generate("""
            class Pausable
              def initialize
                @paused = false
              end

              def paused?
                @paused
              end

              def withdraw(amount)
                require amount > 0, "zero amount"
                raise "paused" if @paused
                revert "too much" unless amount < 100
                payable(msg.sender).transfer(amount)
              end
            end
            """);
        assertTrue(code.contains("function isPaused() public returns (bool) {"), code);
        assertTrue(code.contains("require(amount > 0, \"zero amount\");"), code);
        assertTrue(code.contains("if (paused) {"), code);
        assertTrue(code.contains("revert(\"paused\");"), code);
        assertTrue(code.contains("if (!(amount < 100)) {"), code);
        assertTrue(code.contains("revert(\"too much\");"), code);
        assertTrue(code.contains("payable(msg.sender).transfer(amount);"), code);
    }

    @Test
    void trivial_getter_of_public_field_is_dropped() {
        var gen = new Generator(CompilerConfig.defaults());
        var c = gen.buildContracts(Parser.parse("""
            class Owned
              def initialize(owner)
                @owner = owner
              end

              def owner
                @owner
              end
            end
            """)).get(0);
        assertEquals(1, c.functions().size());
        assertTrue(gen.warnings().stream().anyMatch(w -> w.contains("Dropping method 'owner'")));
    }

    @Test
    void parents_and_imports() {
        String code = generate("""
            require 'ownable'
            require_relative 'lib/math.rb'

            class Token < ERC20
              include Ownable

              def initialize
              end
            end
            """);
        assertTrue(code.contains("import \"ownable.sol\";"), code);
        assertTrue(code.contains("import \"./lib/math.sol\";"), code);
        assertTrue(code.contains("contract Token is ERC20, Ownable {"), code);
    }

    @Test
    void float_is_rejected_with_fixed_point_hint() {
        var ex = assertThrows(CompilationException.class, () -> generate("""
            class Rate
              def initialize
                @rate = 1.5
              end
            end
            """));
        assertTrue(ex.getMessage().contains("fixed-point"), ex.getMessage());
    }

    @Test
    void nil_field_is_rejected() {
        var ex = assertThrows(CompilationException.class, () -> generate("""
            class Holder
              def initialize
                @owner = nil
              end
            end
            """));
        assertTrue(ex.getMessage().contains("nil"), ex.getMessage());
    }

    @Test
    void errors_from_all_methods_are_reported_together() {
        var ex = assertThrows(CompilationException.class, () -> generate("""
            class Broken
              def initialize
              end

              def a
                x = 1.5
              end

              def b
                y = nil
              end
            end
            """));
        assertEquals(2, ex.messages().size());
        assertTrue(ex.getMessage().startsWith("Compilation failed with 2 errors"));
    }

    @Test
    void unsupported_iterator_is_an_error() {
        var ex = assertThrows(CompilationException.class, () -> generate("""
            class Mapper
              def initialize
              end

              def f(items)
                items.map do |x|
                  x
                end
              end
            end
            """));
        assertTrue(ex.getMessage().contains("Iterator 'map' is not supported"), ex.getMessage());
    }

    @Test
    void program_without_class_fails() {
        var ex = assertThrows(CompilationException.class, () -> generate("x = 1\n"));
        assertEquals("No class declaration to translate", ex.getMessage());
    }

    @Test
    void generation_does_not_mutate_the_tree() {
        var ast = Parser.parse("class A\n  def initialize\n    @x = 1\n  end\nend\n");
        String before = ast.toString();
        var gen = new Generator(CompilerConfig.defaults());
        String first = gen.generate(ast);
        assertEquals(before, ast.toString());
        assertEquals(first, new Generator(CompilerConfig.defaults()).generate(ast));
    }
}
