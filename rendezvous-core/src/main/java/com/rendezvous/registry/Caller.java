package com.rendezvous.registry;

/**
 * An authorized caller: its OS-level id and the channel-level id it joined under.
 */
public record Caller(long osProcessId, int processId) {
}
