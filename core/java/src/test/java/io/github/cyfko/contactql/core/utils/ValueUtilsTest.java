package io.github.cyfko.contactql.core.utils;

import io.github.cyfko.contactql.core.exception.SearchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValueUtils Tests")
class ValueUtilsTest {

    @Test
    @DisplayName("Decimal literals")
    void testParseDecimal() {
        assertEquals(0, new BigDecimal("18.5").compareTo(ValueUtils.parseDecimal(" 18.5 ")));
        assertEquals(0, new BigDecimal("-3").compareTo(ValueUtils.parseDecimal("-3")));

        SearchException e = assertThrows(SearchException.class, () -> ValueUtils.parseDecimal("4a"));
        assertEquals("4a isn't a valid number", e.getMessage());
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    @DisplayName("Stored decimals that don't parse are missing")
    void testToDecimal() {
        assertEquals(Optional.of(new BigDecimal("23")), ValueUtils.toDecimal("23"));
        assertTrue(ValueUtils.toDecimal("X").isEmpty());
        assertTrue(ValueUtils.toDecimal(null).isEmpty());
    }

    @Test
    @DisplayName("Text keys are upper-cased and truncated to 32 characters")
    void testTextKey() {
        assertEquals("FARMER", ValueUtils.textKey("Farmer"));
        assertEquals("X".repeat(32), ValueUtils.textKey("x".repeat(50)));
    }

    @ParameterizedTest
    @CsvSource({
            "'Rwanda > Eastern Province > Gatsibo > Kageyo', 1, Eastern Province",
            "'Rwanda > Eastern Province > Gatsibo > Kageyo', 2, Gatsibo",
            "'Rwanda > Eastern Province > Gatsibo > Kageyo', 3, Kageyo",
            "' Gatsibo ', 2, Gatsibo"
    })
    @DisplayName("Boundary names by level")
    void testBoundaryName(String path, int level, String expected) {
        assertEquals(Optional.of(expected), ValueUtils.boundaryName(path, level));
    }

    @Test
    @DisplayName("Paths not reaching a level have no name there")
    void testBoundaryNameMissing() {
        assertTrue(ValueUtils.boundaryName("Rwanda > Eastern Province", 2).isEmpty());
        assertTrue(ValueUtils.boundaryName("Rwanda > Eastern Province > ", 2).isEmpty());
        assertTrue(ValueUtils.boundaryName("  ", 1).isEmpty());
        assertTrue(ValueUtils.boundaryName(null, 1).isEmpty());
    }

    @Test
    @DisplayName("Case-insensitive matching")
    void testIgnoreCase() {
        assertTrue(ValueUtils.equalsIgnoreCase("Kayônza", "KAYÔNZA"));
        assertTrue(ValueUtils.containsIgnoreCase("Gatsibo", "TSI"));
        assertFalse(ValueUtils.containsIgnoreCase("Gatsibo", "kag"));
    }
}
