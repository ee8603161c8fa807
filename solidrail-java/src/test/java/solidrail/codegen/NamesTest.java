package solidrail.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NamesTest {

    @ParameterizedTest
    @CsvSource({
            "transfer, transfer",
            "total_supply, totalSupply",
            "balance_of, balanceOf",
            "paused?, isPaused",
            "is_owner?, isOwner",
            "has_role?, hasRole",
            "reset!, reset",
            "_mint, _mint",
            "_burn_from, _burnFrom",
            "emit, emit_",
            "delete, delete_"
    })
    void function_names(String ruby, String expected) {
        assertEquals(expected, Names.toFunctionName(ruby));
    }

    @Test
    void case_conversions() {
        assertEquals("tokenIds", Names.toCamelCase("token_ids"));
        assertEquals("tokenIds", Names.toCamelCase("tokenIds"));
        assertEquals("Status", Names.toPascalCase("STATUS"));
        assertEquals("OrderState", Names.toPascalCase("order_state"));
        assertEquals("Active", Names.toPascalCase("active"));
    }

    @Test
    void reserved_words_get_suffix() {
        assertTrue(Names.isReserved("address"));
        assertFalse(Names.isReserved("owner"));
        assertEquals("owner", Names.safeIdentifier("owner"));
        assertEquals("address_", Names.safeIdentifier("address"));
    }

    @Test
    void quote_escapes() {
        assertEquals("\"a\\\"b\"", Names.quote("a\"b"));
        assertEquals("\"line\\nnext\"", Names.quote("line\nnext"));
        assertEquals("\"back\\\\slash\"", Names.quote("back\\slash"));
    }
}
