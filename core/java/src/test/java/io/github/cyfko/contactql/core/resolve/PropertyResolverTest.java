package io.github.cyfko.contactql.core.resolve;

import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.model.ContactField;
import io.github.cyfko.contactql.core.model.Org;
import io.github.cyfko.contactql.core.model.ValueType;
import io.github.cyfko.contactql.core.tree.Condition;
import io.github.cyfko.contactql.core.tree.IsSetCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PropertyResolver Tests")
class PropertyResolverTest {

    private static final Org ORG = Org.builder()
            .id(1L)
            .field(ContactField.of("profession", ValueType.TEXT))
            .field(ContactField.of("age", ValueType.DECIMAL))
            .field(ContactField.of("join_date", ValueType.DATETIME))
            .field(ContactField.of("state", ValueType.STATE))
            .field(ContactField.of("home", ValueType.DISTRICT))
            .field(ContactField.of("ward", ValueType.WARD))
            .field(ContactField.of("tel", ValueType.TEXT))
            .field(ContactField.of("name", ValueType.TEXT))
            .build();

    private static final Org ANON_ORG = ORG.withAnon(true);

    @Nested
    @DisplayName("Identifier lookup")
    class Lookup {

        @ParameterizedTest
        @CsvSource({
                "name, NAME",
                "UUID, UUID",
                "language, LANGUAGE",
                "created_on, CREATED_ON",
                "urn, URN",
                "tel, SCHEME",
                "Twitter, SCHEME",
                "whatsapp, SCHEME",
                "profession, TEXT_FIELD",
                "AGE, DECIMAL_FIELD",
                "join_date, DATETIME_FIELD",
                "state, LOCATION_FIELD",
                "home, LOCATION_FIELD",
                "ward, LOCATION_FIELD"
        })
        @DisplayName("Identifiers resolve case-insensitively")
        void testResolve(String identifier, PropertyKind kind) {
            assertEquals(kind, PropertyResolver.resolve(ORG, identifier).kind());
        }

        @Test
        @DisplayName("Attributes and schemes take precedence over fields")
        void testPrecedence() {
            ResolvedProperty tel = PropertyResolver.resolve(ORG, "tel");
            assertEquals(PropertyKind.SCHEME, tel.kind());
            assertEquals("tel", tel.scheme());
            assertNull(tel.field());
            assertEquals(PropertyKind.NAME, PropertyResolver.resolve(ORG, "name").kind());
        }

        @Test
        @DisplayName("Field properties carry their definition")
        void testField() {
            ResolvedProperty home = PropertyResolver.resolve(ORG, "home");
            assertEquals(ValueType.DISTRICT, home.field().valueType());
            assertNull(home.scheme());
        }

        @Test
        @DisplayName("The generic urn property matches any scheme")
        void testUrn() {
            assertNull(PropertyResolver.resolve(ORG, "urn").scheme());
        }

        @Test
        @DisplayName("id is only an identifier in anonymous orgs")
        void testId() {
            SearchException e = assertThrows(SearchException.class, () -> PropertyResolver.resolve(ORG, "id"));
            assertEquals("Unrecognized contact field identifier id", e.getMessage());
            assertEquals(PropertyKind.ID, PropertyResolver.resolve(ANON_ORG, "id").kind());
        }

        @Test
        @DisplayName("Unknown identifiers are rejected")
        void testUnknown() {
            SearchException e = assertThrows(SearchException.class, () -> PropertyResolver.resolve(ORG, "credits"));
            assertEquals("Unrecognized contact field identifier credits", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Comparator checks")
    class ComparatorChecks {

        @ParameterizedTest
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "name|>|Can't query contact properties with >",
                "uuid|~|Can't query contact properties with ~",
                "language|<|Can't query contact properties with <",
                "created_on|~|Can't query contact properties with ~",
                "tel|<|Can't query contact URNs with <",
                "urn|>=|Can't query contact URNs with >=",
                "profession|~|Can't query text fields with ~",
                "profession|>|Can't query text fields with >",
                "age|~|Can't query decimal fields with ~",
                "join_date|~|Can't query date fields with ~",
                "join_date|!=|Can't query date fields with !=",
                "home|>|Can't query location fields with >"
        })
        @DisplayName("Comparators not supported by a kind are rejected")
        void testRejected(String prop, String comparator, String message) {
            Condition condition = new Condition(prop, comparator, "x");
            SearchException e = assertThrows(SearchException.class, () -> PropertyResolver.resolveFor(ORG, condition));
            assertEquals(message, e.getMessage());
        }

        @ParameterizedTest
        @CsvSource({
                "name, ~", "name, !=", "uuid, =", "created_on, >=", "tel, ~", "twitter, !=",
                "profession, =", "age, <=", "join_date, >", "ward, ~", "state, !="
        })
        @DisplayName("Supported comparators pass")
        void testAccepted(String prop, String comparator) {
            assertDoesNotThrow(() -> PropertyResolver.resolveFor(ORG, new Condition(prop, comparator, "x")));
        }

        @Test
        @DisplayName("Only = applies to contact ids")
        void testId() {
            assertDoesNotThrow(() -> PropertyResolver.resolveFor(ANON_ORG, new Condition("id", "=", "12")));
            assertThrows(SearchException.class, () -> PropertyResolver.resolveFor(ANON_ORG, new Condition("id", "!=", "12")));
        }

        @Test
        @DisplayName("URN values can't be compared in anonymous orgs")
        void testAnonUrns() {
            SearchException e = assertThrows(SearchException.class,
                    () -> PropertyResolver.resolveFor(ANON_ORG, new Condition("tel", "=", "+250788382011")));
            assertEquals("Can't query contact URNs in an anonymous organization", e.getMessage());
            assertThrows(SearchException.class, () -> PropertyResolver.resolveFor(ANON_ORG, new Condition("urn", "~", "0788")));
        }

        @Test
        @DisplayName("Presence checks are legal on every property")
        void testPresence() {
            assertDoesNotThrow(() -> PropertyResolver.resolveFor(ANON_ORG, new IsSetCondition("twitter", "=")));
            assertDoesNotThrow(() -> PropertyResolver.resolveFor(ORG, new IsSetCondition("join_date", "!=")));
            assertDoesNotThrow(() -> PropertyResolver.resolveFor(ORG, new IsSetCondition("created_on", "=")));
        }

        @Test
        @DisplayName("Presence checks only take = and !=")
        void testPresenceComparator() {
            SearchException e = assertThrows(SearchException.class,
                    () -> PropertyResolver.resolveFor(ORG, new IsSetCondition("tel", "<")));
            assertEquals("Invalid operator for empty string comparison", e.getMessage());
        }
    }

    @Test
    @DisplayName("Every field type maps to a field kind")
    void testFieldKinds() {
        for (ValueType type : ValueType.values()) {
            PropertyKind kind = PropertyResolver.fieldKind(ContactField.of("f", type));
            assertTrue(kind.isField());
            assertEquals(type.isLocation(), kind == PropertyKind.LOCATION_FIELD);
        }
    }
}
