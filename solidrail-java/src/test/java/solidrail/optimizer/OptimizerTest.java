package solidrail.optimizer;

import org.junit.jupiter.api.Test;
import solidrail.config.CompilerConfig;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptimizerTest {

    private static final String UNPACKED = """
            // SPDX-License-Identifier: MIT
            pragma solidity ^0.8.30;

            contract Packed {
                bool public active;
                uint256 public total;
                address public owner;
                uint8 public level;

                function touch() public {
                    total += 1;
                }
            }
            """;

    private static final String LEGACY = """
            // SPDX-License-Identifier: MIT
            pragma solidity ^0.7.6;

            contract Old {
                uint256 public constant LIMIT = 100;
                uint256 public total;

                function add(uint256 amount) public {
                    total += amount;
                    total--;
                }
            }
            """;

    private static final String BANK = """
            // SPDX-License-Identifier: MIT
            pragma solidity ^0.8.30;

            contract Bank {
                mapping(address => uint256) public balances;

                function withdraw(uint256 amount) public {
                    require(balances[msg.sender] >= amount);
                    payable(msg.sender).transfer(amount);
                    balances[msg.sender] -= amount;
                }
            }
            """;

    private static OptimizationResult optimize(String code) {
        return new Optimizer(CompilerConfig.defaults()).optimize(code);
    }

    @Test
    void storage_layout_packs_small_types_together() {
        String out = new StorageLayoutPass().apply(UNPACKED, new ArrayList<>());
        assertTrue(out.contains("""
                    uint256 public total;
                    address public owner;
                    bool public active;
                    uint8 public level;
                """), out);
        assertTrue(out.contains("total += 1;"));
    }

    @Test
    void storage_layout_keeps_order_when_initializers_depend_on_each_other() {
        String code = """
                pragma solidity ^0.8.30;

                contract Dep {
                    bool public flag = true;
                    uint256 public base = 10;
                    uint256 public doubled = base * 2;
                }
                """;
        List<String> warnings = new ArrayList<>();
        assertEquals(code, new StorageLayoutPass().apply(code, warnings));
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("doubled reads base"));
    }

    @Test
    void checked_arithmetic_only_for_legacy_targets() {
        assertTrue(CheckedArithmeticPass.checkedByDefault(UNPACKED));
        assertFalse(CheckedArithmeticPass.checkedByDefault(LEGACY));
        assertEquals(UNPACKED, new CheckedArithmeticPass().apply(UNPACKED, new ArrayList<>()));
    }

    @Test
    void checked_arithmetic_guards_state_updates() {
        String out = new CheckedArithmeticPass().apply(LEGACY, new ArrayList<>());
        assertTrue(out.contains("""
                        require(total + amount >= total, "addition overflow");
                        total += amount;
                        require(total > 0, "decrement underflow");
                        total--;
                """), out);
        assertEquals(out, new CheckedArithmeticPass().apply(out, new ArrayList<>()));
    }

    @Test
    void balance_write_moves_before_external_call() {
        List<String> warnings = new ArrayList<>();
        String out = new ReentrancyOrderPass().apply(BANK, warnings);
        assertTrue(out.contains("""
                        require(balances[msg.sender] >= amount);
                        balances[msg.sender] -= amount;
                        payable(msg.sender).transfer(amount);
                """), out);
        assertTrue(warnings.isEmpty());
    }

    @Test
    void nested_balance_write_is_reported_not_moved() {
        String code = """
                pragma solidity ^0.8.30;

                contract Bank {
                    mapping(address => uint256) public balances;

                    function withdraw(uint256 amount) public {
                        payable(msg.sender).transfer(amount);
                        if (amount > 0) {
                            balances[msg.sender] -= amount;
                        }
                    }
                }
                """;
        List<String> warnings = new ArrayList<>();
        assertEquals(code, new ReentrancyOrderPass().apply(code, warnings));
        assertEquals(List.of("Function withdraw writes balances after an external call; move the update before the call"),
                warnings);
    }

    private static final String WITHDRAW_ALL = """
            // SPDX-License-Identifier: MIT
            pragma solidity ^0.8.30;

            contract Vault {
                mapping(address => uint256) public balances;

                function withdrawAll() public {
                    payable(msg.sender).transfer(balances[msg.sender]);
                    balances[msg.sender] = 0;
                }
            }
            """;

    @Test
    void balance_write_stays_after_a_call_that_reads_it() {
        List<String> warnings = new ArrayList<>();
        assertEquals(WITHDRAW_ALL, new ReentrancyOrderPass().apply(WITHDRAW_ALL, warnings));
        assertEquals(List.of("Function withdrawAll writes balances after an external call; move the update before the call"),
                warnings);

        var result = optimize(WITHDRAW_ALL);
        assertEquals(WITHDRAW_ALL, result.code());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void balance_write_stays_when_an_intermediate_statement_reads_it() {
        String code = """
                pragma solidity ^0.8.30;

                contract Vault {
                    mapping(address => uint256) public balances;

                    function withdraw(uint256 amount) public {
                        payable(msg.sender).transfer(amount);
                        emit Paid(msg.sender, balances[msg.sender]);
                        balances[msg.sender] -= amount;
                    }
                }
                """;
        List<String> warnings = new ArrayList<>();
        assertEquals(code, new ReentrancyOrderPass().apply(code, warnings));
        assertEquals(1, warnings.size());
    }

    @Test
    void call_result_in_legacy_arithmetic_is_not_guarded_twice() {
        String code = """
                pragma solidity ^0.7.6;

                contract Old {
                    uint256 public total;

                    function add() public {
                        total += fee();
                        total += uint256(7);
                    }
                }
                """;
        List<String> warnings = new ArrayList<>();
        String out = new CheckedArithmeticPass().apply(code, warnings);
        assertEquals(1, occurrences(out, "fee()"), out);
        assertTrue(out.contains("require(total + uint256(7) >= total, \"addition overflow\");"), out);
        assertEquals(List.of("Function add updates total with a call result; bind it to a local to get an overflow guard"),
                warnings);
    }

    private static int occurrences(String text, String needle) {
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) n++;
        return n;
    }

    @Test
    void optimizer_is_idempotent() {
        for (String code : List.of(UNPACKED, LEGACY, BANK, WITHDRAW_ALL)) {
            String once = optimize(code).code();
            assertEquals(once, optimize(once).code());
        }
    }

    @Test
    void disabled_optimizer_returns_input() {
        var config = CompilerConfig.defaults().withOptimization(false);
        var result = new Optimizer(config).optimize(BANK);
        assertEquals(BANK, result.code());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void pass_flags_are_honoured() {
        var noGas = CompilerConfig.defaults().withGasOptimization(false);
        assertEquals(UNPACKED, new Optimizer(noGas).optimize(UNPACKED).code());

        var noSecurity = CompilerConfig.defaults().withSecurityChecks(false);
        assertEquals(BANK, new Optimizer(noSecurity).optimize(BANK).code());
        assertEquals(LEGACY, new Optimizer(noSecurity.withGasOptimization(false)).optimize(LEGACY).code());
    }

    @Test
    void custom_passes_run_in_order() {
        List<String> seen = new ArrayList<>();
        OptimizationPass first = recording("first", seen);
        OptimizationPass second = recording("second", seen);
        var result = new Optimizer(CompilerConfig.defaults(), List.of(first, second)).optimize("x");
        assertEquals("x+first+second", result.code());
        assertEquals(List.of("first", "second"), seen);
    }

    private static OptimizationPass recording(String name, List<String> seen) {
        return new OptimizationPass() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean isEnabled(CompilerConfig config) {
                return true;
            }

            @Override
            public String apply(String code, List<String> warnings) {
                seen.add(name);
                return code + "+" + name;
            }
        };
    }

    @Test
    void source_scanner_ignores_braces_in_strings_and_comments() {
        assertEquals(0, GeneratedSource.braceDelta("require(x, \"{\"); // }"));
        assertEquals(1, GeneratedSource.braceDelta("if (a) {"));
        var d = GeneratedSource.parseStateVariable("mapping(address => mapping(address => uint256)) public allowances;");
        assertNotNull(d);
        assertEquals("allowances", d.name());
        assertEquals("mapping(address => mapping(address => uint256))", d.type());
        assertNull(GeneratedSource.parseStateVariable("emit Transfer(a, b);"));
        assertNull(GeneratedSource.parseStateVariable("return total;"));
    }
}
