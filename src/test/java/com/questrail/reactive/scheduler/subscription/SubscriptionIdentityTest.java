package com.questrail.reactive.scheduler.subscription;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SubscriptionIdentityTest
 * -----------------------------------------------------------------------------
 * Leaves are added to and removed from an aggregate by identity, and closing
 * the aggregate reaches every leaf it still holds.
 */
class SubscriptionIdentityTest {

    @Test
    void aggregateRemovesExactlyTheLeafWithThatIdentity() {
        SubscriptionGroup group = new SubscriptionGroup();
        SharedSubscription first = new SharedSubscription();
        SharedSubscription second = new SharedSubscription();
        group.add(first);
        group.add(second);

        assertTrue(group.remove(first.identity()));
        assertFalse(group.remove(first.identity()));
        assertEquals(1, group.size());
    }

    @Test
    void aggregateUnsubscribePropagatesToLeaves() {
        AtomicInteger aborts = new AtomicInteger();
        SubscriptionGroup group = new SubscriptionGroup();
        SharedSubscription shared = new SharedSubscription();
        LocalSubscription local = new LocalSubscription();
        shared.attach(() -> aborts.incrementAndGet() > 0);
        local.attach(() -> aborts.incrementAndGet() > 0);
        group.add(shared);
        group.add(local);

        group.unsubscribe();

        assertTrue(group.isClosed());
        assertTrue(shared.isClosed());
        assertTrue(local.isClosed());
        assertEquals(2, aborts.get());
    }

    @Test
    void removedLeafIsNotClosedByAggregate() {
        SubscriptionGroup group = new SubscriptionGroup();
        SharedSubscription leaf = new SharedSubscription();
        group.add(leaf);
        group.remove(leaf.identity());

        group.unsubscribe();

        assertFalse(leaf.isClosed());
    }

    @Test
    void idsAreUsableAsKeysAcrossSubscriptionKinds() {
        SubscriptionId shared = new SharedSubscription().identity();
        SubscriptionId local = new LocalSubscription().identity();

        assertNotEquals(shared, local);
        assertTrue(local.value() > shared.value());
        assertEquals("sub-" + shared.value(), shared.toString());
    }
}
