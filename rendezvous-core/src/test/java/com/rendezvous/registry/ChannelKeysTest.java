package com.rendezvous.registry;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChannelKeysTest {

    private final ChannelKeys keys = new ChannelKeys(1);

    @Test
    void testNamespaceKeys() {
        assertEquals("C0001", keys.channelKey());
        assertEquals("C0001MID", keys.membersKey());
        assertEquals("C0001OID", keys.osMembersKey());
        assertEquals("C0001WOS2", keys.wakeupKey(2));
    }

    @Test
    void testPairKeyIsZeroPadded() {
        assertEquals("C000100030002", keys.pairKey(3, 2));
        assertEquals("C000199980000", keys.pairKey(9998, 0));
    }

    @Test
    void testDecodeReversesEncode() {
        assertEquals(new PairKey(3, 2), keys.decodePairKey(keys.pairKey(3, 2)));
        assertEquals(new PairKey(0, 9999), keys.decodePairKey(keys.pairKey(0, 9999)));
        assertEquals(new PairKey(1234, 42), keys.decodePairKey("C000112340042"));
    }

    @Test
    void testPairKeysAreUniquePerChannelAndDirection() {
        ChannelKeys other = new ChannelKeys(2);
        Set<String> seen = new HashSet<>();
        for (int s = 0; s < 12; s++) {
            for (int r = 0; r < 12; r++) {
                assertTrue(seen.add(keys.pairKey(s, r)));
                assertTrue(seen.add(other.pairKey(s, r)));
            }
        }
        assertNotEquals(keys.pairKey(1, 2), keys.pairKey(2, 1));
    }

    @Test
    void testWakeupKeyNeverDecodesAsPairKey() {
        assertThrows(IllegalArgumentException.class, () -> keys.decodePairKey(keys.wakeupKey(12)));
        assertThrows(IllegalArgumentException.class, () -> keys.decodePairKey(keys.wakeupKey(1234)));
    }

    @Test
    void testDecodeRejectsMalformedKeys() {
        assertThrows(IllegalArgumentException.class, () -> keys.decodePairKey(null));
        assertThrows(IllegalArgumentException.class, () -> keys.decodePairKey("C00010003000"));
        assertThrows(IllegalArgumentException.class, () -> keys.decodePairKey("C000200030002"));
        assertThrows(IllegalArgumentException.class, () -> keys.decodePairKey("C00010A030002"));
        assertThrows(IllegalArgumentException.class, () -> keys.decodePairKey(keys.membersKey()));
    }

    @Test
    void testIdsOutOfRangeAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ChannelKeys(-1));
        assertThrows(IllegalArgumentException.class, () -> new ChannelKeys(10_000));
        assertThrows(IllegalArgumentException.class, () -> keys.pairKey(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> keys.pairKey(1, 10_000));
        assertThrows(IllegalArgumentException.class, () -> keys.wakeupKey(-5));
    }
}
