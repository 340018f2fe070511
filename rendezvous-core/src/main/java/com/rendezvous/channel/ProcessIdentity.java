package com.rendezvous.channel;

import java.io.Serial;
import java.io.Serializable;

/**
 * Supplies the OS-level identity of the process calling into a channel.
 *
 * <p>The identity is asked for on every channel operation rather than captured once, so a
 * channel handle created in one process and passed to another reports the receiving
 * process.
 */
@FunctionalInterface
public interface ProcessIdentity extends Serializable {

    /**
     * Returns the OS-level id of the calling process.
     *
     * @return The OS process id
     */
    long osProcessId();

    /**
     * Identity of whichever JVM process is running the call.
     *
     * @return The current-process identity
     */
    static ProcessIdentity current() {
        return CurrentProcess.INSTANCE;
    }

    /**
     * A fixed identity. Lets several simulated processes share one JVM.
     *
     * @param osProcessId The id to report
     * @return A fixed identity
     */
    static ProcessIdentity of(long osProcessId) {
        return new Fixed(osProcessId);
    }

    /**
     * Reports {@link ProcessHandle#current()}'s pid.
     */
    enum CurrentProcess implements ProcessIdentity {
        INSTANCE;

        @Override
        public long osProcessId() {
            return ProcessHandle.current().pid();
        }
    }

    /**
     * Always reports the same id.
     */
    record Fixed(long osProcessId) implements ProcessIdentity {
        @Serial
        private static final long serialVersionUID = 1L;
    }
}
