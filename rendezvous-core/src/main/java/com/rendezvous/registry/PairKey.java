package com.rendezvous.registry;

/**
 * Sender and receiver encoded in a pair queue key.
 */
public record PairKey(int senderId, int receiverId) {
}
