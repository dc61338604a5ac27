package io.github.cyfko.contactql.core.tree;

import io.github.cyfko.contactql.core.impl.BasicQueryParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContactQuery Tests")
class ContactQueryTest {

    private final BasicQueryParser parser = new BasicQueryParser();

    @ParameterizedTest
    @ValueSource(strings = {
            "will",
            "will felix or matt",
            "age > 18 and (gender = male or gender = \"non binary\")",
            "name = \"say \"\"hi\"\"\"",
            "nickname = \"and\"",
            "twitter != \"\" or tel = \"\"",
            "age = -5.5 or age = 1e3",
            "join_date >= 1/2/2014 and join_date < \"2014-03-01T00:00:00Z\""
    })
    @DisplayName("Canonical text parses back to the same query")
    void testRoundTrip(String text) {
        ContactQuery query = parser.parse(text);
        assertEquals(query, parser.parse(query.asText()));
    }

    @Test
    @DisplayName("Numbers are written bare and text quoted")
    void testLiteralQuoting() {
        assertEquals("age > 18.5", new Condition("age", ">", "18.5").asText());
        assertEquals("nickname = \"Bob\"", new Condition("nickname", "is", "Bob").asText());
        assertEquals("quote = \"a\"\"b\"", new Condition("quote", "=", "a\"b").asText());
        assertEquals("ward = \"\"", new IsSetCondition("ward", "is").asText());
    }

    @Test
    @DisplayName("Property names in order of first appearance")
    void testPropNames() {
        ContactQuery query = parser.parse("age > 18 and gender = male or age < 5 and tel = \"\"");
        assertEquals(List.of("age", "gender", "tel"), List.copyOf(query.propNames()));
    }

    @Test
    @DisplayName("Name and id can't back a dynamic group")
    void testCanBeDynamicGroup() {
        assertTrue(parser.parse("age > 18").canBeDynamicGroup());
        assertFalse(parser.parse("age > 18 or trey").canBeDynamicGroup());
        assertFalse(parser.parse("1234", true).canBeDynamicGroup());
    }

    @Test
    @DisplayName("Presence checks are reported")
    void testHasIsNotSetCondition() {
        assertTrue(parser.parse("age > 18 or ward = \"\"").hasIsNotSetCondition());
        assertFalse(parser.parse("ward != \"\"").hasIsNotSetCondition());
        assertFalse(parser.parse("ward = kageyo").hasIsNotSetCondition());
    }

    @Test
    @DisplayName("URN conditions are reported")
    void testHasUrnCondition() {
        assertTrue(parser.parse("age > 18 or twitter ~ tweep").hasUrnCondition());
        assertTrue(parser.parse("urn ~ 0788").hasUrnCondition());
        assertTrue(parser.parse("0788").hasUrnCondition());
        assertFalse(parser.parse("age > 18").hasUrnCondition());
    }

    @Test
    @DisplayName("Combinations need two children on the right property")
    void testCombinationInvariants() {
        Condition age = new Condition("age", ">", "18");
        assertThrows(IllegalArgumentException.class, () -> BoolCombination.of(BoolOp.AND, age));
        assertThrows(IllegalArgumentException.class,
                () -> SinglePropCombination.of("age", BoolOp.AND, age, new Condition("gender", "=", "m")));
    }
}
