package solidrail.types;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import solidrail.ast.Node;
import solidrail.ast.NodeKind;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TypeMapperTest {

    private static Node leaf(NodeKind kind, Object value) {
        return Node.leaf(kind, value, null);
    }

    private static Node pair(Node k, Node v) {
        return Node.of(NodeKind.PAIR, null, k, v);
    }

    @Test
    void map_literal_types() {
        assertEquals(Optional.of(ElementaryType.UINT256), TypeMapper.mapType(leaf(NodeKind.INTEGER, BigInteger.TEN)));
        assertEquals(Optional.of(ElementaryType.STRING), TypeMapper.mapType(leaf(NodeKind.STRING, "x")));
        assertEquals(Optional.of(ElementaryType.STRING), TypeMapper.mapType(leaf(NodeKind.SYMBOL, "x")));
        assertEquals(Optional.of(ElementaryType.BOOL), TypeMapper.mapType(leaf(NodeKind.BOOLEAN, true)));
    }

    @Test
    void map_collections() {
        var strings = Node.of(NodeKind.ARRAY, null, leaf(NodeKind.STRING, "a"));
        assertEquals("string[]", TypeMapper.mapType(strings).orElseThrow().typeName());

        var empty = Node.of(NodeKind.ARRAY, null, List.of());
        assertEquals("uint256[]", TypeMapper.mapType(empty).orElseThrow().typeName());

        var hash = Node.of(NodeKind.HASH, null,
                pair(leaf(NodeKind.STRING, "k"), leaf(NodeKind.BOOLEAN, false)));
        assertEquals("mapping(string => bool)", TypeMapper.mapType(hash).orElseThrow().typeName());

        var emptyHash = Node.of(NodeKind.HASH, null, List.of());
        assertEquals("mapping(address => uint256)", TypeMapper.mapType(emptyHash).orElseThrow().typeName());
    }

    @Test
    void negative_integer_is_signed() {
        var neg = Node.named(NodeKind.UNARY, "-", null, List.of(leaf(NodeKind.INTEGER, BigInteger.ONE)));
        assertEquals(Optional.of(ElementaryType.INT256), TypeMapper.mapType(neg));
    }

    @Test
    void nil_and_float_are_unmappable() {
        var nil = leaf(NodeKind.NIL, null);
        var flt = leaf(NodeKind.FLOAT, "1.5");
        assertTrue(TypeMapper.mapType(nil).isEmpty());
        assertTrue(TypeMapper.mapType(flt).isEmpty());
        assertTrue(TypeMapper.isUnmappable(nil));
        assertTrue(TypeMapper.isUnmappable(flt));
        assertFalse(TypeMapper.isUnmappable(leaf(NodeKind.INTEGER, BigInteger.ONE)));
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "Integer; uint256",
            "String; string",
            "Symbol; string",
            "Boolean; bool",
            "Address; address",
            "uint8; uint8",
            "uint; uint256",
            "bytes32; bytes32",
            "Array<String>; string[]",
            "Address[]; address[]",
            "Hash{Address => Integer}; mapping(address => uint256)",
            "Hash{Address => Hash{Address => Integer}}; mapping(address => mapping(address => uint256))",
            "'Integer, nil'; uint256"
    })
    void map_declared_names(String declared, String expected) {
        assertEquals(expected, TypeMapper.mapDeclared(declared).orElseThrow().typeName());
    }

    @Test
    void unmappable_declared_names() {
        assertTrue(TypeMapper.mapDeclared("Float").isEmpty());
        assertTrue(TypeMapper.mapDeclared("NilClass").isEmpty());
        assertTrue(TypeMapper.mapDeclared("Widget").isEmpty());
        assertTrue(TypeMapper.mapDeclared("uint7").isEmpty());
        assertTrue(TypeMapper.mapDeclared(null).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
            "owner, address",
            "_to, address",
            "new_owner, address",
            "fee_recipient, address",
            "name, string",
            "token_uri, string",
            "paused, bool",
            "is_active, bool",
            "amount, uint256",
            "total_supply, uint256"
    })
    void infer_from_name(String identifier, String expected) {
        assertEquals(expected, TypeMapper.inferFromName(identifier).typeName());
    }

    @Test
    void infer_element_from_plural() {
        assertEquals(ElementaryType.ADDRESS, TypeMapper.inferElementFromName("recipients"));
        assertEquals(ElementaryType.UINT256, TypeMapper.inferElementFromName("amounts"));
        assertEquals(ElementaryType.STRING, TypeMapper.inferElementFromName("names"));
    }

    @Test
    void visibility_and_mutability() {
        assertEquals(Visibility.PUBLIC, TypeMapper.mapVisibility(null));
        assertEquals(Visibility.PRIVATE, TypeMapper.mapVisibility("private"));
        assertEquals(Visibility.INTERNAL, TypeMapper.mapVisibility("protected"));
        assertEquals(Mutability.VIEW, TypeMapper.mapMutability(Set.of("view", "payable")));
        assertEquals(Mutability.PURE, TypeMapper.mapMutability(Set.of("pure", "view")));
        assertEquals(Mutability.PAYABLE, TypeMapper.mapMutability(Set.of("payable")));
        assertEquals(Mutability.NONE, TypeMapper.mapMutability(Set.of()));
    }

    @Test
    void storage_widths() {
        assertEquals(1, ElementaryType.BOOL.storageBytes());
        assertEquals(20, ElementaryType.ADDRESS.storageBytes());
        assertEquals(32, ElementaryType.UINT256.storageBytes());
        assertEquals(16, ElementaryType.of("uint128").storageBytes());
        assertEquals(32, new MappingType(ElementaryType.ADDRESS, ElementaryType.UINT256).storageBytes());
        assertTrue(new MappingType(ElementaryType.ADDRESS, ElementaryType.UINT256).isBalanceLike());
        assertFalse(new MappingType(ElementaryType.ADDRESS, ElementaryType.BOOL).isBalanceLike());
    }
}
