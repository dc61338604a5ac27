package io.github.cyfko.contactql.jpa;

import io.github.cyfko.contactql.core.api.FilterCondition;
import io.github.cyfko.contactql.jpa.model.Contact;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JpaFilterConditionTest {

    private Root<Contact> root;
    private CriteriaQuery<?> query;
    private CriteriaBuilder cb;
    private Predicate first;
    private Predicate second;
    private PredicateResolver<Contact> firstResolver;
    private PredicateResolver<Contact> secondResolver;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        root = mock(Root.class);
        query = mock(CriteriaQuery.class);
        cb = mock(CriteriaBuilder.class);
        first = mock(Predicate.class);
        second = mock(Predicate.class);
        firstResolver = mock(PredicateResolver.class);
        secondResolver = mock(PredicateResolver.class);
        when(firstResolver.resolve(root, query, cb)).thenReturn(first);
        when(secondResolver.resolve(root, query, cb)).thenReturn(second);
    }

    @Test
    void testConstructor() {
        JpaFilterCondition<Contact> condition = new JpaFilterCondition<>(firstResolver);
        assertSame(firstResolver, condition.resolver());
    }

    @Test
    void testNullResolver() {
        assertThrows(NullPointerException.class, () -> new JpaFilterCondition<Contact>(null));
    }

    @Test
    void testAndOperation() {
        Predicate combined = mock(Predicate.class);
        when(cb.and(first, second)).thenReturn(combined);

        FilterCondition result = new JpaFilterCondition<>(firstResolver).and(new JpaFilterCondition<>(secondResolver));

        assertTrue(result instanceof JpaFilterCondition);
        assertSame(combined, resolve(result));
    }

    @Test
    void testOrOperation() {
        Predicate combined = mock(Predicate.class);
        when(cb.or(first, second)).thenReturn(combined);

        FilterCondition result = new JpaFilterCondition<>(firstResolver).or(new JpaFilterCondition<>(secondResolver));

        assertTrue(result instanceof JpaFilterCondition);
        assertSame(combined, resolve(result));
    }

    @Test
    void testNotOperation() {
        Predicate negated = mock(Predicate.class);
        when(cb.not(first)).thenReturn(negated);

        FilterCondition result = new JpaFilterCondition<>(firstResolver).not();

        assertTrue(result instanceof JpaFilterCondition);
        assertSame(negated, resolve(result));
    }

    @Test
    void testCombinationIsDeferred() {
        new JpaFilterCondition<>(firstResolver).and(new JpaFilterCondition<>(secondResolver)).not();

        verifyNoInteractions(firstResolver, secondResolver, cb);
    }

    @Test
    void testAndOperationWithNonJpaCondition() {
        JpaFilterCondition<Contact> condition = new JpaFilterCondition<>(firstResolver);
        FilterCondition other = mock(FilterCondition.class);

        assertThrows(IllegalArgumentException.class, () -> condition.and(other));
    }

    @Test
    void testOrOperationWithNonJpaCondition() {
        JpaFilterCondition<Contact> condition = new JpaFilterCondition<>(firstResolver);
        FilterCondition other = mock(FilterCondition.class);

        assertThrows(IllegalArgumentException.class, () -> condition.or(other));
    }

    @SuppressWarnings("unchecked")
    private Predicate resolve(FilterCondition condition) {
        return ((JpaFilterCondition<Contact>) condition).resolver().resolve(root, query, cb);
    }
}
