package solidrail.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import solidrail.ast.Node;
import solidrail.ast.NodeKind;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Node parse(String src) {
        return Parser.parse(src);
    }

    private static Node firstClass(Node program) {
        return program.childrenOf(NodeKind.CLASS).get(0);
    }

    private static Node classBody(Node cls) {
        return cls.child(cls.childCount() - 1);
    }

    private static Node firstMethod(Node program) {
        return program.findNodes(NodeKind.METHOD_DEF).get(0);
    }

    private static List<Node> methodStatements(String src) {
        return firstMethod(parse(src)).child(2).children();
    }

    static Stream<Arguments> classSources() {
        return Stream.of(
                Arguments.of("x = 1\n", 0),
                Arguments.of("class A\n  def initialize\n  end\nend\n", 1),
                Arguments.of("""
                    class A
                    end

                    class B < A
                      class Inner
                      end
                    end
                    """, 3));
    }

    @ParameterizedTest
    @MethodSource("classSources")
    void find_nodes_counts_every_class(String src, int expected) {
        var p = parse(src);
        assertEquals(NodeKind.PROGRAM, p.kind());
        assertEquals(expected, p.findNodes(NodeKind.CLASS).size());
        // a second traversal sees the same tree
        assertEquals(expected, p.findNodes(NodeKind.CLASS).size());
    }

    @Test
    void parse_class_with_parent_and_methods() {
        var p = parse("""
            class Token < Base
              def initialize(name)
                @name = name
              end

              def name
                @name
              end
            end
            """);
        assertTrue(p.is(NodeKind.PROGRAM));
        var cls = firstClass(p);
        assertEquals(3, cls.childCount());
        assertEquals("Token", cls.child(0).text());
        assertEquals("Base", cls.child(1).text());
        assertEquals(2, classBody(cls).childrenOf(NodeKind.METHOD_DEF).size());
    }

    @Test
    void parse_method_def_shape() {
        var m = firstMethod(parse("""
            class A
              def transfer(to, amount)
                x = amount
              end
            end
            """));
        assertEquals("transfer", m.child(0).text());
        var params = m.child(1);
        assertTrue(params.is(NodeKind.PARAMS));
        assertEquals(List.of("to", "amount"), params.children().stream().map(Node::text).toList());
        assertTrue(m.child(2).is(NodeKind.BODY));
        assertEquals(1, m.child(2).childCount());
    }

    @Test
    void parse_doc_tags_directly_above_def() {
        var m = firstMethod(parse("""
            class A
              # Moves tokens.
              # @param to [Address]
              # @return [Boolean]
              def send_to(to)
                true
              end
            end
            """));
        var tags = m.childrenOf(NodeKind.DOC_TAG).stream().map(Node::text).toList();
        assertEquals(List.of("@param to [Address]", "@return [Boolean]"), tags);
    }

    @Test
    void parse_visibility_prefix_becomes_doc_tag() {
        var m = firstMethod(parse("""
            class A
              private def helper
                1
              end
            end
            """));
        assertEquals("helper", m.child(0).text());
        assertTrue(m.childrenOf(NodeKind.DOC_TAG).stream().anyMatch(t -> t.text().equals("@private")));
    }

    @Test
    void parse_visibility_section_and_include() {
        var body = classBody(firstClass(parse("""
            class A
              include Ownable, Pausable
              private
              def x
              end
            end
            """)));
        assertTrue(body.child(0).is(NodeKind.INCLUDE));
        assertEquals(2, body.child(0).childCount());
        assertTrue(body.child(1).is(NodeKind.VISIBILITY));
        assertEquals("private", body.child(1).text());
    }

    @Test
    void parse_require_becomes_import() {
        var p = parse("""
            require 'ownable'
            require_relative 'lib/math'
            class A
            end
            """);
        var imports = p.childrenOf(NodeKind.IMPORT).stream().map(Node::text).toList();
        assertEquals(List.of("ownable", "./lib/math"), imports);
    }

    @Test
    void parse_if_elsif_else_chain() {
        var stmts = methodStatements("""
            class A
              def f(x)
                if x > 1
                  a = 1
                elsif x > 0
                  a = 2
                else
                  a = 3
                end
              end
            end
            """);
        var iff = stmts.get(0);
        assertTrue(iff.is(NodeKind.IF));
        assertEquals(3, iff.childCount());
        assertTrue(iff.child(2).is(NodeKind.IF));
        assertEquals(3, iff.child(2).childCount());
        assertTrue(iff.child(2).child(2).is(NodeKind.BODY));
    }

    @Test
    void parse_unless_and_modifiers_negate() {
        var stmts = methodStatements("""
            class A
              def f(x)
                return 0 unless x
                x += 1 if x < 10
              end
            end
            """);
        var first = stmts.get(0);
        assertTrue(first.is(NodeKind.IF));
        assertTrue(first.child(0).is(NodeKind.UNARY));
        assertEquals("!", first.child(0).text());
        assertTrue(first.child(1).child(0).is(NodeKind.RETURN));

        var second = stmts.get(1);
        assertTrue(second.is(NodeKind.IF));
        var opAssign = second.child(1).child(0);
        assertTrue(opAssign.is(NodeKind.OP_ASSIGN));
        assertEquals("+", opAssign.text());
    }

    @Test
    void parse_each_block_becomes_iteration() {
        var stmts = methodStatements("""
            class A
              def f(items)
                items.each do |item|
                  @total += item
                end
                3.times { |i| x = i }
              end
            end
            """);
        var each = stmts.get(0);
        assertTrue(each.is(NodeKind.ITERATION));
        assertEquals("each", each.text());
        assertEquals("items", each.child(0).text());
        assertEquals("item", each.child(1).child(0).text());
        assertEquals(1, each.child(2).childCount());

        var times = stmts.get(1);
        assertEquals("times", times.text());
        assertEquals(BigInteger.valueOf(3), times.child(0).value());
    }

    @Test
    void parse_for_in_range() {
        var stmts = methodStatements("""
            class A
              def f(n)
                for i in 0...n do
                  x = i
                end
              end
            end
            """);
        var loop = stmts.get(0);
        assertTrue(loop.is(NodeKind.FOR));
        assertEquals("i", loop.child(0).text());
        assertTrue(loop.child(1).is(NodeKind.RANGE));
        assertEquals("...", loop.child(1).text());
    }

    @Test
    void parse_while_do_keeps_loop_header() {
        var stmts = methodStatements("""
            class A
              def f(n)
                while n > 0 do
                  n -= 1
                end
              end
            end
            """);
        assertTrue(stmts.get(0).is(NodeKind.WHILE));
        assertTrue(stmts.get(0).child(0).is(NodeKind.BINARY));
    }

    @Test
    void parse_operator_precedence() {
        var stmts = methodStatements("""
            class A
              def f(a, b, c)
                x = a + b * c ** 2
              end
            end
            """);
        var rhs = stmts.get(0).child(1);
        assertEquals("+", rhs.text());
        var mul = rhs.child(1);
        assertEquals("*", mul.text());
        assertEquals("**", mul.child(1).text());
    }

    @Test
    void parse_calls_index_and_keyword_args() {
        var stmts = methodStatements("""
            class A
              def f(to, amount)
                require amount > 0, "zero"
                @balances[msg.sender] -= amount
                emit :Transfer, from: msg.sender, to: to
              end
            end
            """);
        var req = stmts.get(0);
        assertTrue(req.is(NodeKind.CALL));
        assertEquals("require", req.text());
        assertEquals(2, req.childCount());

        var op = stmts.get(1);
        assertTrue(op.is(NodeKind.OP_ASSIGN));
        var index = op.child(0);
        assertTrue(index.is(NodeKind.INDEX));
        assertTrue(index.child(0).is(NodeKind.IVAR));
        assertTrue(index.child(1).is(NodeKind.METHOD_CALL));
        assertEquals("sender", index.child(1).text());

        var emit = stmts.get(2);
        assertEquals("emit", emit.text());
        assertTrue(emit.child(0).is(NodeKind.SYMBOL));
        var kw = emit.child(1);
        assertTrue(kw.is(NodeKind.HASH));
        assertEquals(2, kw.childCount());
        assertEquals("from", kw.child(0).child(0).text());
    }

    @Test
    void parse_literals() {
        var stmts = methodStatements("""
            class A
              def f
                a = [1, 2]
                b = { "x" => 1 }
                c = nil
                d = 1.5
                e = true ? 1 : 2
              end
            end
            """);
        assertTrue(stmts.get(0).child(1).is(NodeKind.ARRAY));
        assertTrue(stmts.get(1).child(1).is(NodeKind.HASH));
        assertTrue(stmts.get(2).child(1).is(NodeKind.NIL));
        assertTrue(stmts.get(3).child(1).is(NodeKind.FLOAT));
        assertTrue(stmts.get(4).child(1).is(NodeKind.TERNARY));
    }

    @Test
    void find_nodes_is_preorder_and_repeatable() {
        var p = parse("""
            class A
              def a
              end
              def b
              end
            end
            class B
              def c
              end
            end
            """);
        var first = p.findNodes(NodeKind.METHOD_DEF);
        assertEquals(3, first.size());
        assertEquals(List.of("a", "b", "c"), first.stream().map(m -> m.child(0).text()).toList());
        assertEquals(first, p.findNodes(NodeKind.METHOD_DEF));
    }

    @Test
    void parse_errors_report_position() {
        var ex = assertThrows(ParseException.class, () -> parse("""
            class A
              def f(
            end
            """));
        assertTrue(ex.hasPosition());

        assertThrows(ParseException.class, () -> parse("module M\nend\n"));
        assertThrows(ParseException.class, () -> parse("class A\n  def self.x\n  end\nend\n"));
        assertThrows(ParseException.class, () -> parse("class A\n  def f(a = 1)\n  end\nend\n"));
        assertThrows(ParseException.class, () -> parse("class A\n"));
        assertThrows(ParseException.class, () -> parse(null));
    }
}
