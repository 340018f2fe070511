package com.rendezvous.registry;

import com.rendezvous.channel.ChannelException;
import com.rendezvous.store.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Membership bookkeeping of one channel, kept entirely in the store.
 *
 * <p>Two structures are maintained per channel: the set of channel-level ids that have
 * joined, and a hash from OS-level process id to channel-level id. A caller is authorized
 * only if it appears in both. Nothing is cached between calls; every check reads the store.
 *
 * <p>Each method works on a connection supplied by the caller and does not close it.
 */
public final class MembershipRegistry {

    private static final Logger logger = LoggerFactory.getLogger(MembershipRegistry.class);

    private final ChannelKeys keys;

    public MembershipRegistry(ChannelKeys keys) {
        this.keys = keys;
    }

    public ChannelKeys keys() {
        return keys;
    }

    /**
     * Registers the channel if no process has done so yet. Adding the id to the global
     * channel set decides the race: only the process whose add succeeds seeds the sentinel
     * entries.
     *
     * @param store An open connection
     * @return true if this call created the channel
     */
    public boolean register(MessageStore store) {
        if (!store.addToSet(ChannelKeys.CHANNEL_SET_KEY, Integer.toString(keys.channelId()))) {
            logger.debug("Attached to existing channel {}", keys.channelId());
            return false;
        }
        store.putField(keys.osMembersKey(), ChannelKeys.SENTINEL_OS_ID, ChannelKeys.SENTINEL_OS_ID);
        store.addToSet(keys.membersKey(), Integer.toString(ChannelKeys.SENTINEL_PROCESS_ID));
        logger.info("Registered channel {}", keys.channelId());
        return true;
    }

    /**
     * Joins the calling OS process under a channel-level id. The id is claimed by adding it
     * to the members set before the OS-level mapping is written.
     *
     * @param store An open connection
     * @param osProcessId The caller's OS-level id
     * @param processId The channel-level id to join under
     * @return The authorized caller
     * @throws ChannelException.AlreadyJoinedException if the OS process already joined
     * @throws ChannelException.IdInUseException if the channel-level id is taken
     */
    public Caller join(MessageStore store, long osProcessId, int processId) {
        if (processId < 0 || processId >= ChannelKeys.SENTINEL_PROCESS_ID) {
            throw new IllegalArgumentException(
                    "Process id must be between 0 and " + (ChannelKeys.SENTINEL_PROCESS_ID - 1) + ": " + processId);
        }
        String osId = Long.toString(osProcessId);
        String id = Integer.toString(processId);

        if (store.getField(keys.osMembersKey(), osId).isPresent()) {
            throw new ChannelException.AlreadyJoinedException(keys.channelId(), osProcessId);
        }
        // the set add claims the id; of two concurrent joins under one id only one succeeds
        if (!store.addToSet(keys.membersKey(), id)) {
            throw new ChannelException.IdInUseException(keys.channelId(), processId);
        }
        if (store.getField(keys.osMembersKey(), osId).isPresent()) {
            store.removeFromSet(keys.membersKey(), id);
            throw new ChannelException.AlreadyJoinedException(keys.channelId(), osProcessId);
        }
        store.putField(keys.osMembersKey(), osId, id);
        logger.debug("OS process {} joined channel {} as {}", osProcessId, keys.channelId(), processId);

        return authorize(store, osProcessId);
    }

    /**
     * Removes the calling process from the channel.
     *
     * @param store An open connection
     * @param osProcessId The caller's OS-level id
     * @return The caller as it was before leaving
     * @throws ChannelException.UnknownProcessException if the caller is not a member
     */
    public Caller leave(MessageStore store, long osProcessId) {
        Caller caller = authorize(store, osProcessId);
        store.removeField(keys.osMembersKey(), Long.toString(caller.osProcessId()));
        store.removeFromSet(keys.membersKey(), Integer.toString(caller.processId()));
        logger.debug("Process {} left channel {}", caller.processId(), keys.channelId());
        return caller;
    }

    /**
     * Resolves the caller's OS-level id to its channel-level id and checks that id is
     * still a member.
     *
     * @param store An open connection
     * @param osProcessId The caller's OS-level id
     * @return The authorized caller
     * @throws ChannelException.UnknownProcessException if either lookup fails
     */
    public Caller authorize(MessageStore store, long osProcessId) {
        Optional<String> processId = store.getField(keys.osMembersKey(), Long.toString(osProcessId));
        if (processId.isEmpty() || !store.isSetMember(keys.membersKey(), processId.get())) {
            throw new ChannelException.UnknownProcessException(keys.channelId(), osProcessId);
        }
        return new Caller(osProcessId, Integer.parseInt(processId.get()));
    }

    /**
     * Reads the current members, without the sentinel.
     *
     * @param store An open connection
     * @return The channel-level ids in ascending order
     */
    public SortedSet<Integer> members(MessageStore store) {
        Set<String> raw = store.setMembers(keys.membersKey());
        SortedSet<Integer> members = new TreeSet<>();
        for (String member : raw) {
            int id = Integer.parseInt(member);
            if (id != ChannelKeys.SENTINEL_PROCESS_ID) {
                members.add(id);
            }
        }
        return Collections.unmodifiableSortedSet(members);
    }

    public boolean isMember(MessageStore store, int processId) {
        return processId != ChannelKeys.SENTINEL_PROCESS_ID
                && store.isSetMember(keys.membersKey(), Integer.toString(processId));
    }
}
