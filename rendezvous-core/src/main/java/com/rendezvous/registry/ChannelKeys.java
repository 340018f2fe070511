package com.rendezvous.registry;

/**
 * Builds the store keys that make up one channel's namespace.
 *
 * <p>Store keys are flat strings, so the (sender, receiver) pair of a message queue is
 * encoded positionally: the channel prefix followed by both ids as fixed-width,
 * zero-padded decimal fields. The encoding depends only on its inputs and
 * {@link #decodePairKey(String)} reverses it exactly.
 *
 * <pre>
 *   C0001          channel prefix for channel 1
 *   C0001MID       set of channel-level member ids
 *   C0001OID       hash of OS process id to channel-level id
 *   C000100030002  queue of messages from 3 to 2
 *   C0001WOS2      wakeup queue of process 2
 * </pre>
 */
public final class ChannelKeys {

    /** Width in decimal digits of every encoded id. */
    public static final int ID_DIGITS = 4;

    /** Largest id that fits in {@link #ID_DIGITS} digits. */
    public static final int MAX_ID = 9999;

    /** Placeholder member seeded so that the member set is never empty. Never joinable. */
    public static final int SENTINEL_PROCESS_ID = MAX_ID;

    /** Placeholder OS-level entry seeded so that the OS member hash is never empty. */
    public static final String SENTINEL_OS_ID = "-1";

    /** Global set of every channel id that has been registered. */
    public static final String CHANNEL_SET_KEY = "channelSet";

    private static final String CHANNEL_PREFIX = "C";
    private static final String MEMBERS_SUFFIX = "MID";
    private static final String OS_MEMBERS_SUFFIX = "OID";
    private static final String WAKEUP_SUFFIX = "WOS";
    private static final String ID_FORMAT = "%0" + ID_DIGITS + "d";

    private final int channelId;
    private final String channelKey;

    public ChannelKeys(int channelId) {
        checkId(channelId, "Channel id");
        this.channelId = channelId;
        this.channelKey = CHANNEL_PREFIX + String.format(ID_FORMAT, channelId);
    }

    public int channelId() {
        return channelId;
    }

    /**
     * @return The prefix shared by every key of this channel
     */
    public String channelKey() {
        return channelKey;
    }

    public String membersKey() {
        return channelKey + MEMBERS_SUFFIX;
    }

    public String osMembersKey() {
        return channelKey + OS_MEMBERS_SUFFIX;
    }

    /**
     * Returns the queue key for messages from {@code senderId} to {@code receiverId}.
     *
     * @param senderId The sending process
     * @param receiverId The receiving process
     * @return The pair queue key
     */
    public String pairKey(int senderId, int receiverId) {
        checkId(senderId, "Sender id");
        checkId(receiverId, "Receiver id");
        return channelKey + String.format(ID_FORMAT, senderId) + String.format(ID_FORMAT, receiverId);
    }

    /**
     * Splits a pair queue key back into its sender and receiver.
     *
     * @param key A key produced by {@link #pairKey(int, int)} for this channel
     * @return The sender and receiver
     * @throws IllegalArgumentException if the key is not a pair key of this channel
     */
    public PairKey decodePairKey(String key) {
        int senderStart = channelKey.length();
        int receiverStart = senderStart + ID_DIGITS;
        if (key == null || !key.startsWith(channelKey) || key.length() != receiverStart + ID_DIGITS) {
            throw new IllegalArgumentException("Not a pair key of channel " + channelId + ": " + key);
        }
        return new PairKey(parseField(key, senderStart), parseField(key, receiverStart));
    }

    /**
     * Returns the wakeup queue key of a process. Wakeup keys carry a suffix no pair key
     * has, so the two never collide.
     *
     * @param processId The receiving process
     * @return The wakeup queue key
     */
    public String wakeupKey(int processId) {
        checkId(processId, "Process id");
        return channelKey + WAKEUP_SUFFIX + processId;
    }

    @Override
    public String toString() {
        return "ChannelKeys[" + channelKey + "]";
    }

    static void checkId(int id, String what) {
        if (id < 0 || id > MAX_ID) {
            throw new IllegalArgumentException(what + " must be between 0 and " + MAX_ID + ": " + id);
        }
    }

    private static int parseField(String key, int start) {
        int value = 0;
        for (int i = start; i < start + ID_DIGITS; i++) {
            char c = key.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Malformed pair key: " + key);
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }
}
