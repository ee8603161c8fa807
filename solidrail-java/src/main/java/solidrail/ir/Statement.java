package solidrail.ir;

import solidrail.types.StaticType;

import java.util.List;

/**
 * Function body statements. Expressions are already rendered Solidity text.
 */
public sealed interface Statement {

    /** {@code target op= value;}, where op is empty for plain assignment. */
    record Assign(String target, String operator, String value) implements Statement {}

    record LocalDeclaration(StaticType type, String name, String initializer) implements Statement {}

    /** if / else-if chain; {@code elseBody} is null when there is no else. */
    record Conditional(List<Branch> branches, List<Statement> elseBody) implements Statement {
        public Conditional {
            branches = List.copyOf(branches);
            if (elseBody != null) elseBody = List.copyOf(elseBody);
        }
    }

    record Branch(String condition, List<Statement> body) {
        public Branch {
            body = List.copyOf(body);
        }
    }

    record ForLoop(Statement init, String condition, String update, List<Statement> body) implements Statement {
        public ForLoop {
            body = List.copyOf(body);
        }
    }

    record WhileLoop(String condition, List<Statement> body) implements Statement {
        public WhileLoop {
            body = List.copyOf(body);
        }
    }

    /** {@code message} is null for a bare condition. */
    record RequireCheck(String condition, String message) implements Statement {}

    record AssertCheck(String condition) implements Statement {}

    record EventEmit(String event, List<String> arguments) implements Statement {
        public EventEmit {
            arguments = List.copyOf(arguments);
        }
    }

    /** {@code message} is null for a bare revert. */
    record Revert(String message) implements Statement {}

    /** {@code value} is null for a bare return. */
    record Return(String value) implements Statement {}

    record ExpressionStatement(String expression) implements Statement {}

    record Break() implements Statement {}

    record Continue() implements Statement {}
}
