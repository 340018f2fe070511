package com.rendezvous.channel;

/**
 * Base exception for channel protocol misuse.
 * Membership and authorization failures are programming errors on the caller's side;
 * they are raised immediately and never retried.
 */
public class ChannelException extends RuntimeException {

    private final int channelId;

    public ChannelException(String message, int channelId) {
        super(message);
        this.channelId = channelId;
    }

    public ChannelException(String message, int channelId, Throwable cause) {
        super(message, cause);
        this.channelId = channelId;
    }

    /**
     * Returns the channel the failure happened on, or -1 when no channel was involved.
     *
     * @return The channel id
     */
    public int getChannelId() {
        return channelId;
    }

    /**
     * Thrown when the calling OS process has not joined the channel, or its channel-level
     * id is no longer a member.
     */
    public static class UnknownProcessException extends ChannelException {
        private final long osProcessId;

        public UnknownProcessException(int channelId, long osProcessId) {
            super(String.format("OS process %d is not a member of channel %d", osProcessId, channelId), channelId);
            this.osProcessId = osProcessId;
        }

        public long getOsProcessId() {
            return osProcessId;
        }
    }

    /**
     * Thrown when an OS process tries to join a channel it already joined.
     */
    public static class AlreadyJoinedException extends ChannelException {
        private final long osProcessId;

        public AlreadyJoinedException(int channelId, long osProcessId) {
            super(String.format("OS process %d already joined channel %d", osProcessId, channelId), channelId);
            this.osProcessId = osProcessId;
        }

        public long getOsProcessId() {
            return osProcessId;
        }
    }

    /**
     * Thrown when the requested channel-level id is taken by another process.
     */
    public static class IdInUseException extends ChannelException {
        private final int processId;

        public IdInUseException(int channelId, int processId) {
            super(String.format("Process id %d is already in use on channel %d", processId, channelId), channelId);
            this.processId = processId;
        }

        public int getProcessId() {
            return processId;
        }
    }

    /**
     * Thrown when sending to a process that is not a member of the channel.
     */
    public static class DestinationNotMemberException extends ChannelException {
        private final int processId;

        public DestinationNotMemberException(int channelId, int processId) {
            super(String.format("Destination %d is not a member of channel %d", processId, channelId), channelId);
            this.processId = processId;
        }

        public int getProcessId() {
            return processId;
        }
    }

    /**
     * Thrown when receiving from a sender that is not a member of the channel.
     */
    public static class UnknownSenderException extends ChannelException {
        private final int processId;

        public UnknownSenderException(int channelId, int processId) {
            super(String.format("Sender %d is not a member of channel %d", processId, channelId), channelId);
            this.processId = processId;
        }

        public int getProcessId() {
            return processId;
        }
    }

    /**
     * Thrown when a payload cannot be encoded or decoded.
     */
    public static class SerializationException extends ChannelException {
        public SerializationException(String message, Throwable cause) {
            super(message, -1, cause);
        }
    }
}
