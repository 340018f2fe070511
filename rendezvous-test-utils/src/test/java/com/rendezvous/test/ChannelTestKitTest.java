package com.rendezvous.test;

import com.rendezvous.channel.Channel;
import com.rendezvous.channel.ChannelException;
import com.rendezvous.channel.Receipt;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.Serializable;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class ChannelTestKitTest {

    private ChannelTestKit kit;

    @BeforeEach
    void setUp() {
        kit = ChannelTestKit.create(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        kit.close();
    }

    @Test
    void testHandlesHaveDistinctIdentities() {
        Channel<Serializable> a = kit.member(1, 100, 1);
        Channel<Serializable> b = kit.member(1, 200, 2);

        assertEquals(1, a.processId());
        assertEquals(2, b.processId());
        assertEquals(Set.of(1, 2), a.members());
    }

    @Test
    void testSameOsProcessCannotJoinTwice() {
        kit.member(1, 100, 1);
        Channel<Serializable> again = kit.process(1, 100);

        assertThrows(ChannelException.AlreadyJoinedException.class, () -> again.join(2));
    }

    @Test
    void testExpectFromReturnsMessage() throws Exception {
        Channel<Serializable> a = kit.member(1, 100, 1);
        Channel<Serializable> b = kit.member(1, 200, 2);

        a.sendTo(2, "hi");

        assertEquals("hi", kit.expectFrom(b, 1));
        assertEquals(0, kit.queueLength(1, 1, 2));
    }

    @Test
    void testExpectFromFailsWhenNothingArrives() {
        kit.member(1, 100, 1);
        Channel<Serializable> b = kit.member(1, 200, 2);
        ChannelTestKit quick = ChannelTestKit.create(Duration.ofMillis(100));
        try {
            Channel<Serializable> handle = quick.member(1, 300, 3);
            assertThrows(AssertionError.class, () -> quick.expectAny(handle));
        } finally {
            quick.close();
        }
        assertDoesNotThrow(() -> kit.expectNoMessage(b));
    }

    @Test
    void testSpawnedParticipantReceives() {
        Channel<Serializable> a = kit.member(1, 100, 1);
        Channel<Serializable> b = kit.member(1, 200, 2);

        Future<Receipt.Delivered<Serializable>> received = kit.spawn(() -> kit.expectAny(b));
        a.sendTo(2, 42);

        Receipt.Delivered<Serializable> delivered = kit.await(received);
        assertEquals(1, delivered.senderId());
        assertEquals(42, delivered.message());
    }

    @Test
    void testAwaitSurfacesParticipantFailure() {
        Future<Object> failing = kit.spawn(() -> {
            throw new IllegalStateException("boom");
        });

        AssertionError error = assertThrows(AssertionError.class, () -> kit.await(failing));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void testPendingWakeupsTrackSends() throws Exception {
        Channel<Serializable> a = kit.member(1, 100, 1);
        Channel<Serializable> b = kit.member(1, 200, 2);

        a.sendTo(2, "one");
        a.sendTo(2, "two");
        assertEquals(2, kit.queueLength(1, 1, 2));
        assertEquals(2, kit.pendingWakeups(1, 2));

        kit.expectFrom(b, 1);
        kit.expectFrom(b, 1);
        assertEquals(0, kit.queueLength(1, 1, 2));
    }

    @Test
    void testInvalidDefaultTimeout() {
        assertThrows(IllegalArgumentException.class, () -> ChannelTestKit.create(Duration.ZERO));
    }
}
