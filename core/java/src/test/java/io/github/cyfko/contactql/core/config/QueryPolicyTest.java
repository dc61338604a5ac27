package io.github.cyfko.contactql.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryPolicy Tests")
class QueryPolicyTest {

    @Test
    @DisplayName("Predefined policies")
    void testPredefined() {
        assertEquals(5000, QueryPolicy.defaults().maxQueryLength());
        assertEquals("DEFAULT_POLICY", QueryPolicy.defaults().policyName());
        assertEquals(1000, QueryPolicy.strict().maxQueryLength());
        assertEquals(10000, QueryPolicy.relaxed().maxQueryLength());
        assertTrue(QueryPolicy.strict().cleanPhoneQueries());
    }

    @Test
    @DisplayName("Builder defaults to a custom policy")
    void testBuilder() {
        QueryPolicy policy = QueryPolicy.builder()
                .maxQueryLength(200)
                .cleanPhoneQueries(false)
                .build();

        assertEquals(QueryPolicy.PolicyName.CUSTOM_POLICY.name(), policy.policyName());
        assertEquals(200, policy.maxQueryLength());
        assertFalse(policy.cleanPhoneQueries());
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new QueryPolicy(" ", 10, true));
        assertThrows(IllegalArgumentException.class, () -> new QueryPolicy(null, 10, true));
        assertThrows(IllegalArgumentException.class, () -> QueryPolicy.builder().maxQueryLength(0).build());
    }
}
