package io.github.cyfko.contactql.core.eval;

import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.impl.BasicQueryParser;
import io.github.cyfko.contactql.core.model.ContactField;
import io.github.cyfko.contactql.core.model.Org;
import io.github.cyfko.contactql.core.model.ValueType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryEvaluator Tests")
class QueryEvaluatorTest {

    private static final Org ORG = Org.builder()
            .id(1L)
            .timezone(ZoneId.of("Africa/Kigali"))
            .dayFirst(true)
            .field(ContactField.of("gender", ValueType.TEXT))
            .field(ContactField.of("profession", ValueType.TEXT))
            .field(ContactField.of("age", ValueType.DECIMAL))
            .field(ContactField.of("join_date", ValueType.DATETIME))
            .field(ContactField.of("state", ValueType.STATE))
            .field(ContactField.of("home", ValueType.DISTRICT))
            .field(ContactField.of("ward", ValueType.WARD))
            .build();

    private static final ContactSnapshot TREY = ContactSnapshot.builder()
            .uuid("c7d2b1a4-0000-4000-8000-000000000001")
            .id(42L)
            .name("Trey Anastasio")
            .language("eng")
            .createdOn(Instant.parse("2014-01-30T22:30:00Z"))
            .urn("tel", "+250788382011")
            .urn("twitter", "tweep_13")
            .field("gender", "Male")
            .field("age", "23")
            .field("join_date", "2014-01-30T10:00:00.000000+02:00")
            .field("state", "Rwanda > Eastern Province")
            .field("home", "Rwanda > Eastern Province > Gatsibo")
            .build();

    private static final ContactSnapshot NAMELESS = ContactSnapshot.builder()
            .uuid("c7d2b1a4-0000-4000-8000-000000000002")
            .id(43L)
            .createdOn(Instant.parse("2014-02-01T08:00:00Z"))
            .field("age", "X")
            .field("join_date", "31-01-2014")
            .build();

    private final BasicQueryParser parser = new BasicQueryParser();

    private boolean matches(String query, ContactSnapshot contact) {
        return matches(query, ORG, contact);
    }

    private boolean matches(String query, Org org, ContactSnapshot contact) {
        return QueryEvaluator.evaluate(parser.parse(query, org.anon()), org, contact);
    }

    @Nested
    @DisplayName("Attributes")
    class Attributes {

        @ParameterizedTest
        @ValueSource(strings = {"trey", "ANASTASIO", "name = \"trey anastasio\"", "name != bob", "language = ENG",
                "uuid = C7D2B1A4-0000-4000-8000-000000000001", "name != \"\""})
        @DisplayName("Matching attribute conditions")
        void testMatching(String query) {
            assertTrue(matches(query, TREY));
        }

        @ParameterizedTest
        @ValueSource(strings = {"mike", "name = trey", "language != eng", "name = \"\""})
        @DisplayName("Non-matching attribute conditions")
        void testNonMatching(String query) {
            assertFalse(matches(query, TREY));
        }

        @Test
        @DisplayName("A missing attribute fails positive tests and satisfies negative ones")
        void testMissing() {
            assertFalse(matches("name ~ a", NAMELESS));
            assertTrue(matches("name != trey", NAMELESS));
            assertTrue(matches("name = \"\"", NAMELESS));
            assertTrue(matches("language = \"\"", NAMELESS));
        }

        @Test
        @DisplayName("created_on compares local days")
        void testCreatedOn() {
            // 22:30 UTC is already the 31st in Kigali
            assertTrue(matches("created_on = 31/1/2014", TREY));
            assertTrue(matches("created_on > 30/1/2014", TREY));
            assertFalse(matches("created_on < 31/1/2014", TREY));
            assertTrue(matches("created_on <= 31/1/2014", TREY));
            assertTrue(matches("created_on != \"\"", TREY));
        }

        @Test
        @DisplayName("Contact ids in anonymous orgs")
        void testId() {
            Org anon = ORG.withAnon(true);
            assertTrue(matches("42", anon, TREY));
            assertTrue(matches("0042", anon, TREY));
            assertFalse(matches("43", anon, TREY));
        }
    }

    @Nested
    @DisplayName("URNs")
    class Urns {

        @Test
        @DisplayName("Any URN of the scheme may match")
        void testScheme() {
            assertTrue(matches("0788382011", TREY));
            assertTrue(matches("tel = +250788382011", TREY));
            assertTrue(matches("twitter has TWEEP", TREY));
            assertFalse(matches("twitter = tweep", TREY));
            assertFalse(matches("tel ~ tweep", TREY));
            assertTrue(matches("urn ~ tweep", TREY));
        }

        @Test
        @DisplayName("URN presence")
        void testPresence() {
            assertTrue(matches("twitter != \"\"", TREY));
            assertFalse(matches("mailto != \"\"", TREY));
            assertTrue(matches("tel = \"\"", NAMELESS));
            assertTrue(matches("twitter != \"\"", ORG.withAnon(true), TREY));
        }

        @Test
        @DisplayName("A contact without URNs satisfies !=")
        void testNegation() {
            assertTrue(matches("tel != +250788382011", NAMELESS));
            assertFalse(matches("tel != +250788382011", TREY));
        }

        @Test
        @DisplayName("URN values can't be queried in anonymous orgs")
        void testAnon() {
            assertThrows(SearchException.class, () -> matches("tel = +250788382011", ORG.withAnon(true), TREY));
        }
    }

    @Nested
    @DisplayName("Custom fields")
    class Fields {

        @Test
        @DisplayName("Text fields compare case-insensitively")
        void testText() {
            assertTrue(matches("gender = male", TREY));
            assertTrue(matches("gender != female", TREY));
            assertTrue(matches("profession = \"\"", TREY));
            assertFalse(matches("profession = farmer", TREY));
        }

        @Test
        @DisplayName("Text fields don't support contains")
        void testTextContains() {
            SearchException e = assertThrows(SearchException.class, () -> matches("gender ~ \"male\"", TREY));
            assertEquals("Can't query text fields with ~", e.getMessage());
        }

        @Test
        @DisplayName("Only the first 32 characters of text are compared")
        void testTextLimit() {
            ContactSnapshot contact = ContactSnapshot.builder()
                    .field("profession", "a".repeat(32) + "b")
                    .build();
            assertTrue(matches("profession = " + "A".repeat(32) + "c", contact));
        }

        @Test
        @DisplayName("Decimal comparisons")
        void testDecimal() {
            assertTrue(matches("age > 18", TREY));
            assertTrue(matches("age >= 23", TREY));
            assertTrue(matches("age = 23.0", TREY));
            assertFalse(matches("age < 23", TREY));
            assertTrue(matches("age = 20 or age = 23", TREY));
        }

        @Test
        @DisplayName("A value that isn't a number counts as missing")
        void testDecimalUnparseable() {
            assertTrue(matches("age = \"\"", NAMELESS));
            assertFalse(matches("age != \"\"", NAMELESS));
            assertFalse(matches("age > 0", NAMELESS));
            assertTrue(matches("age != 5", NAMELESS));
        }

        @Test
        @DisplayName("Dates compare local days in the org timezone")
        void testDatetime() {
            assertTrue(matches("join_date = 30-1-2014", TREY));
            assertTrue(matches("join_date < 31.1.14", TREY));
            assertFalse(matches("join_date > 30/1/2014", TREY));
            assertTrue(matches("join_date = 31/1/2014", NAMELESS));
            assertTrue(matches("join_date >= 31/1/2014", NAMELESS));
        }

        @Test
        @DisplayName("Unparseable dates match nothing under = and fail otherwise")
        void testDatetimeUnparseable() {
            assertFalse(matches("join_date = someday", TREY));
            assertThrows(SearchException.class, () -> matches("join_date > someday", TREY));
        }

        @Test
        @DisplayName("Locations match the boundary at the field's level")
        void testLocation() {
            assertTrue(matches("state = \"eastern province\"", TREY));
            assertTrue(matches("home = gatsibo", TREY));
            assertTrue(matches("home ~ ga", TREY));
            assertFalse(matches("home = rwanda", TREY));
            assertTrue(matches("home = kaynza or home = gatsibo", TREY));
        }

        @Test
        @DisplayName("A location path not reaching the field's level is not set")
        void testLocationMissing() {
            assertTrue(matches("ward = \"\"", TREY));
            assertFalse(matches("ward ~ a", TREY));
            assertTrue(matches("ward != kageyo", TREY));
        }
    }

    @Test
    @DisplayName("Combined conditions")
    void testCombinations() {
        assertTrue(matches("age < 18 and gender = male or age > 18 and gender = male", TREY));
        assertFalse(matches("(age < 18 and gender = \"male\") or (age > 18 and gender = \"female\")", TREY));
        assertTrue(matches("(trey or mike) and home = gatsibo", TREY));
        assertFalse(matches("trey and mike", TREY));
    }

    @Nested
    @DisplayName("Boundaries")
    class Boundaries {

        private final Org utcOrg = Org.builder()
                .id(2L)
                .timezone(ZoneOffset.UTC)
                .dayFirst(true)
                .field(ContactField.of("age", ValueType.DECIMAL))
                .field(ContactField.of("joined", ValueType.DATETIME))
                .build();

        private final ContactSnapshot joined = ContactSnapshot.builder()
                .uuid("c7d2b1a4-0000-4000-8000-000000000003")
                .id(44L)
                .field("joined", "2018-03-01")
                .build();

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(quoteCharacter = '"', value = {
                "joined = 01-03-2018, true",
                "joined <= 01-03-2018, true",
                "joined > 01-04-2018, false",
                "joined < 01-04-2018, true",
                "joined >= 01-03-2018, true",
                "joined < 01-03-2018, false",
                "joined > 28-02-2018, true",
                "joined = 2018-03-01, true",
                "joined = 02-03-2018, false"
        })
        @DisplayName("Dates stored in ISO form compare by day")
        void testDatetimeBoundaries(String query, boolean expected) {
            assertEquals(expected, matches(query, utcOrg, joined));
        }

        @Test
        @DisplayName("A date stored in ISO form is set")
        void testIsoDateIsSet() {
            assertTrue(matches("joined != \"\"", utcOrg, joined));
            assertFalse(matches("joined = \"\"", utcOrg, joined));
        }

        @ParameterizedTest(name = "age {0}")
        @ValueSource(ints = {13, 14, 15, 16})
        @DisplayName("Inclusive and exclusive bounds agree for integers")
        void testDecimalBoundaries(int age) {
            ContactSnapshot contact = ContactSnapshot.builder()
                    .uuid("c7d2b1a4-0000-4000-8000-000000000004")
                    .field("age", String.valueOf(age))
                    .build();

            assertEquals(matches("age >= 15", utcOrg, contact), matches("age > 14", utcOrg, contact));
            assertEquals(matches("age <= 14", utcOrg, contact), matches("age < 15", utcOrg, contact));
            assertEquals(age >= 15, matches("age >= 15", utcOrg, contact));
        }
    }

    @Test
    @DisplayName("Optimization doesn't change results")
    void testOptimizedEquivalence() {
        String[] queries = {
                "trey or mike and age > 18",
                "age > 18 and age < 30 and home = gatsibo",
                "(gender = male or gender = female) age != 23",
                "home = kaynza or home = gatsibo or ward = \"\""
        };
        for (String text : queries) {
            for (ContactSnapshot contact : new ContactSnapshot[]{TREY, NAMELESS}) {
                boolean raw = QueryEvaluator.evaluate(parser.parse(text, false, false), ORG, contact);
                boolean optimized = QueryEvaluator.evaluate(parser.parse(text, false, true), ORG, contact);
                assertEquals(raw, optimized, text);
            }
        }
    }

    @Test
    @DisplayName("Unknown identifiers are errors")
    void testUnknownIdentifier() {
        SearchException e = assertThrows(SearchException.class, () -> matches("credits > 10", TREY));
        assertEquals("Unrecognized contact field identifier credits", e.getMessage());
    }
}
