package com.rendezvous.registry;

import com.rendezvous.channel.ChannelException;
import com.rendezvous.store.memory.InMemoryMessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MembershipRegistry against the in-memory store, covering registration,
 * the join/leave bookkeeping and authorization.
 */
class MembershipRegistryTest {

    private InMemoryMessageStore store;
    private MembershipRegistry registry;
    private ChannelKeys keys;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore();
        keys = new ChannelKeys(7);
        registry = new MembershipRegistry(keys);
    }

    @Test
    void testRegisterSeedsSentinelsOnce() {
        assertTrue(registry.register(store));
        assertFalse(registry.register(store));

        assertEquals(Set.of("7"), store.setMembers(ChannelKeys.CHANNEL_SET_KEY));
        assertEquals(Set.of("9999"), store.setMembers(keys.membersKey()));
        assertEquals(Map.of("-1", "-1"), store.fields(keys.osMembersKey()));
        assertTrue(registry.members(store).isEmpty());
    }

    @Test
    void testJoinRecordsBothMappings() {
        registry.register(store);

        Caller caller = registry.join(store, 4242L, 3);

        assertEquals(new Caller(4242L, 3), caller);
        assertEquals("3", store.getField(keys.osMembersKey(), "4242").orElseThrow());
        assertTrue(store.isSetMember(keys.membersKey(), "3"));
        assertEquals(Set.of(3), registry.members(store));
    }

    @Test
    void testSameOsProcessCannotJoinTwice() {
        registry.register(store);
        registry.join(store, 100L, 1);

        ChannelException.AlreadyJoinedException e = assertThrows(
                ChannelException.AlreadyJoinedException.class, () -> registry.join(store, 100L, 2));
        assertEquals(100L, e.getOsProcessId());
        assertEquals(7, e.getChannelId());
        assertFalse(registry.isMember(store, 2));
    }

    @Test
    void testIdCannotBeTakenTwice() {
        registry.register(store);
        registry.join(store, 100L, 1);

        ChannelException.IdInUseException e = assertThrows(
                ChannelException.IdInUseException.class, () -> registry.join(store, 200L, 1));
        assertEquals(1, e.getProcessId());
        assertTrue(store.getField(keys.osMembersKey(), "200").isEmpty());
    }

    @Test
    void testSentinelIdIsNotJoinable() {
        registry.register(store);
        assertThrows(IllegalArgumentException.class, () -> registry.join(store, 1L, ChannelKeys.SENTINEL_PROCESS_ID));
        assertThrows(IllegalArgumentException.class, () -> registry.join(store, 1L, -1));
    }

    @Test
    void testAuthorizeRequiresBothEntries() {
        registry.register(store);
        assertThrows(ChannelException.UnknownProcessException.class, () -> registry.authorize(store, 55L));

        registry.join(store, 55L, 5);
        assertEquals(5, registry.authorize(store, 55L).processId());

        // OS entry left behind without a member entry is not enough
        store.removeFromSet(keys.membersKey(), "5");
        assertThrows(ChannelException.UnknownProcessException.class, () -> registry.authorize(store, 55L));
    }

    @Test
    void testLeaveRemovesBothEntriesAndFreesTheId() {
        registry.register(store);
        registry.join(store, 55L, 5);

        Caller left = registry.leave(store, 55L);

        assertEquals(5, left.processId());
        assertFalse(registry.isMember(store, 5));
        assertTrue(store.getField(keys.osMembersKey(), "55").isEmpty());
        assertThrows(ChannelException.UnknownProcessException.class, () -> registry.leave(store, 55L));

        registry.join(store, 66L, 5);
        assertEquals(Set.of(5), registry.members(store));
    }

    @Test
    void testSentinelIsNeverReportedAsMember() {
        registry.register(store);
        assertFalse(registry.isMember(store, ChannelKeys.SENTINEL_PROCESS_ID));
        registry.join(store, 1L, 0);
        registry.join(store, 2L, 9998);
        assertEquals(Set.of(0, 9998), registry.members(store));
    }

    @Test
    @Timeout(5)
    void testConcurrentJoinsUnderOneIdLetOnlyOneIn() throws Exception {
        CyclicBarrier bothClaiming = new CyclicBarrier(2);
        InMemoryMessageStore racing = new InMemoryMessageStore() {
            @Override
            public boolean addToSet(String key, String member) {
                if (key.equals(keys.membersKey()) && member.equals("3")) {
                    try {
                        bothClaiming.await(2, TimeUnit.SECONDS);
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                }
                return super.addToSet(key, member);
            }
        };
        registry.register(racing);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<Caller>> joins = List.of(
                    executor.submit(() -> registry.join(racing, 100L, 3)),
                    executor.submit(() -> registry.join(racing, 200L, 3)));

            int joined = 0;
            int rejected = 0;
            for (Future<Caller> join : joins) {
                try {
                    assertEquals(3, join.get(2, TimeUnit.SECONDS).processId());
                    joined++;
                } catch (ExecutionException e) {
                    assertInstanceOf(ChannelException.IdInUseException.class, e.getCause());
                    rejected++;
                }
            }
            assertEquals(1, joined);
            assertEquals(1, rejected);
            assertEquals(1, racing.fields(keys.osMembersKey()).size() - 1);
        } finally {
            executor.shutdownNow();
        }
    }
}
