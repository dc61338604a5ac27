package io.github.cyfko.contactql.core.eval;

import io.github.cyfko.contactql.core.api.FilterCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("SnapshotCondition Tests")
class SnapshotConditionTest {

    private static final ContactSnapshot MIKE = ContactSnapshot.builder().name("Mike").build();

    private final SnapshotCondition named = new SnapshotCondition(contact -> contact.name() != null);
    private final SnapshotCondition isTrey = new SnapshotCondition(contact -> "Trey".equals(contact.name()));

    @Test
    @DisplayName("Conditions combine with and, or and not")
    void testCombinators() {
        assertTrue(named.test(MIKE));
        assertFalse(isTrey.test(MIKE));
        assertFalse(((SnapshotCondition) named.and(isTrey)).test(MIKE));
        assertTrue(((SnapshotCondition) named.or(isTrey)).test(MIKE));
        assertTrue(((SnapshotCondition) isTrey.not()).test(MIKE));
    }

    @Test
    @DisplayName("Conditions of other backends can't be combined")
    void testOtherBackend() {
        FilterCondition other = mock(FilterCondition.class);
        assertThrows(IllegalArgumentException.class, () -> named.and(other));
        assertThrows(IllegalArgumentException.class, () -> named.or(other));
    }

    @Test
    @DisplayName("A predicate is required")
    void testNullPredicate() {
        assertThrows(NullPointerException.class, () -> new SnapshotCondition(null));
    }
}
