package solidrail.codegen;

import solidrail.ir.ContractSpec;
import solidrail.ir.EnumSpec;
import solidrail.ir.EventSpec;
import solidrail.ir.FunctionSpec;
import solidrail.ir.Parameter;
import solidrail.ir.Statement;
import solidrail.ir.StateVariable;
import solidrail.types.Mutability;
import solidrail.types.StaticType;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented renderer for contract specs. Four spaces per indentation level.
 */
public final class SolidityWriter {
    public static final String LICENSE_HEADER = "// SPDX-License-Identifier: MIT";
    private static final String INDENT = "    ";

    private final List<String> lines = new ArrayList<>();
    private int depth = 0;

    public String render(String targetVersion, List<String> imports, List<ContractSpec> contracts) {
        line(LICENSE_HEADER);
        line("pragma solidity " + targetVersion + ";");
        if (!imports.isEmpty()) {
            blank();
            for (String path : imports) line("import \"" + path + "\";");
        }
        for (ContractSpec c : contracts) {
            blank();
            contract(c);
        }
        return String.join("\n", lines) + "\n";
    }

    // ---------- contract ----------
    private void contract(ContractSpec c) {
        String header = "contract " + c.name();
        if (!c.parentNames().isEmpty()) header += " is " + String.join(", ", c.parentNames());
        open(header);

        boolean first = true;
        if (!c.enums().isEmpty()) {
            for (EnumSpec e : c.enums()) {
                line("enum " + e.name() + " { " + String.join(", ", e.members()) + " }");
            }
            first = false;
        }
        if (!c.stateVariables().isEmpty()) {
            if (!first) blank();
            for (StateVariable v : c.stateVariables()) line(stateVariable(v));
            first = false;
        }
        if (!c.events().isEmpty()) {
            if (!first) blank();
            for (EventSpec e : c.events()) line("event " + e.name() + "(" + eventParams(e.parameters()) + ");");
            first = false;
        }
        for (FunctionSpec f : c.functions()) {
            if (!first) blank();
            function(f);
            first = false;
        }
        close();
    }

    private static String stateVariable(StateVariable v) {
        StringBuilder sb = new StringBuilder();
        sb.append(v.type().typeName()).append(' ').append(v.visibility().keyword());
        if (v.constant()) sb.append(" constant");
        sb.append(' ').append(v.name());
        if (v.initializer() != null) sb.append(" = ").append(v.initializer());
        return sb.append(';').toString();
    }

    private static String eventParams(List<Parameter> params) {
        List<String> out = new ArrayList<>();
        for (Parameter p : params) out.add(p.type().typeName() + " " + p.name());
        return String.join(", ", out);
    }

    private void function(FunctionSpec f) {
        StringBuilder sb = new StringBuilder();
        if (f.isConstructor()) {
            sb.append("constructor(").append(params(f.parameters())).append(')');
            if (f.mutability() == Mutability.PAYABLE) sb.append(" payable");
        } else {
            sb.append("function ").append(f.name()).append('(').append(params(f.parameters())).append(") ")
                    .append(f.visibility().keyword());
            if (f.mutability() != Mutability.NONE) sb.append(' ').append(f.mutability().keyword());
            if (f.returnType() != null) sb.append(" returns (").append(withLocation(f.returnType())).append(')');
        }
        open(sb.toString());
        body(f.body());
        close();
    }

    private static String params(List<Parameter> params) {
        List<String> out = new ArrayList<>();
        for (Parameter p : params) out.add(withLocation(p.type()) + " " + p.name());
        return String.join(", ", out);
    }

    private static String withLocation(StaticType t) {
        return t.isReferenceType() ? t.typeName() + " memory" : t.typeName();
    }

    // ---------- statements ----------
    private void body(List<Statement> stmts) {
        for (Statement s : stmts) statement(s);
    }

    private void statement(Statement s) {
        if (s instanceof Statement.Assign a) {
            line(a.target() + " " + a.operator() + "= " + a.value() + ";");
        } else if (s instanceof Statement.LocalDeclaration d) {
            line(declaration(d) + ";");
        } else if (s instanceof Statement.Conditional c) {
            for (int i = 0; i < c.branches().size(); i++) {
                Statement.Branch b = c.branches().get(i);
                String head = "if (" + b.condition() + ")";
                if (i == 0) open(head);
                else reopen("} else " + head);
                body(b.body());
            }
            if (c.elseBody() != null) {
                reopen("} else");
                body(c.elseBody());
            }
            close();
        } else if (s instanceof Statement.ForLoop f) {
            String init = f.init() instanceof Statement.LocalDeclaration d ? declaration(d) : "";
            open("for (" + init + "; " + f.condition() + "; " + f.update() + ")");
            body(f.body());
            close();
        } else if (s instanceof Statement.WhileLoop w) {
            open("while (" + w.condition() + ")");
            body(w.body());
            close();
        } else if (s instanceof Statement.RequireCheck r) {
            line(r.message() == null ? "require(" + r.condition() + ");"
                    : "require(" + r.condition() + ", " + r.message() + ");");
        } else if (s instanceof Statement.AssertCheck a) {
            line("assert(" + a.condition() + ");");
        } else if (s instanceof Statement.EventEmit e) {
            line("emit " + e.event() + "(" + String.join(", ", e.arguments()) + ");");
        } else if (s instanceof Statement.Revert r) {
            line(r.message() == null ? "revert();" : "revert(" + r.message() + ");");
        } else if (s instanceof Statement.Return r) {
            line(r.value() == null ? "return;" : "return " + r.value() + ";");
        } else if (s instanceof Statement.ExpressionStatement e) {
            line(e.expression() + ";");
        } else if (s instanceof Statement.Break) {
            line("break;");
        } else if (s instanceof Statement.Continue) {
            line("continue;");
        } else {
            throw new IllegalStateException("Unknown statement: " + s);
        }
    }

    private static String declaration(Statement.LocalDeclaration d) {
        String decl = withLocation(d.type()) + " " + d.name();
        return d.initializer() == null ? decl : decl + " = " + d.initializer();
    }

    // ---------- lines ----------
    private void line(String text) {
        lines.add(INDENT.repeat(depth) + text);
    }

    private void blank() {
        lines.add("");
    }

    private void open(String header) {
        line(header + " {");
        depth++;
    }

    private void reopen(String header) {
        depth--;
        line(header + " {");
        depth++;
    }

    private void close() {
        depth--;
        line("}");
    }
}
