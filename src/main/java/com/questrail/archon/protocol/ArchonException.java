package com.questrail.archon.protocol;

/**
 * ArchonException
 * -----------------------------------------------------------------------------
 * Base type for every failure the Archon protocol engine reports.
 *
 * <h2>Taxonomy</h2>
 * <ul>
 *   <li>{@link Busy}: the session already has an exchange in flight; nothing was sent</li>
 *   <li>{@link Timeout}: no reply arrived inside the poll window</li>
 *   <li>{@link Mismatch}: the reply checksum does not carry the id of the command sent</li>
 *   <li>{@link ControllerError}: the controller answered with {@code ?}</li>
 *   <li>{@link Validation}: a local precondition failed; nothing was sent</li>
 *   <li>{@link TransportClosed}: the peer closed the stream</li>
 * </ul>
 *
 * <p>Only {@link Busy} and {@link Timeout} are {@linkplain #retryable() retryable}.
 * A {@link Mismatch} means the session is out of step with the controller and must
 * be resynchronized, not retried. A {@link TransportClosed} session must be torn down.</p>
 */
public abstract sealed class ArchonException extends RuntimeException
        permits ArchonException.Busy,
                ArchonException.Timeout,
                ArchonException.Mismatch,
                ArchonException.ControllerError,
                ArchonException.Validation,
                ArchonException.TransportClosed
{
    protected ArchonException(String message) {
        super(message);
    }

    protected ArchonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may simply issue the same command again.
     */
    public abstract boolean retryable();

    /** Another exchange is in flight on the same session. */
    public static final class Busy extends ArchonException {
        public Busy(String command) {
            super("controller busy, not sent: " + command);
        }

        @Override
        public boolean retryable() {
            return true;
        }
    }

    /** No complete reply within the poll window. */
    public static final class Timeout extends ArchonException {
        public Timeout(String message) {
            super(message);
        }

        @Override
        public boolean retryable() {
            return true;
        }
    }

    /** Reply checksum does not match the reference id of the command sent. */
    public static final class Mismatch extends ArchonException {
        private final String expected;
        private final String received;

        public Mismatch(String expected, String received) {
            super("command-reply mismatch: expected " + expected + " but received " + received);
            this.expected = expected;
            this.received = received;
        }

        public String expected() {
            return expected;
        }

        public String received() {
            return received;
        }

        @Override
        public boolean retryable() {
            return false;
        }
    }

    /** The controller reported an error ({@code ?} reply). */
    public static final class ControllerError extends ArchonException {
        private final String reply;

        public ControllerError(String command, String reply) {
            super("controller returned error for " + command + ": " + reply);
            this.reply = reply;
        }

        /**
         * The reply text exactly as received, without the trailing newline.
         */
        public String reply() {
            return reply;
        }

        @Override
        public boolean retryable() {
            return false;
        }
    }

    /**
     * Precondition failure. On the client it is raised before anything is
     * written; the emulator answers it with a {@code ?RR} reply.
     */
    public static final class Validation extends ArchonException {
        public Validation(String message) {
            super(message);
        }

        @Override
        public boolean retryable() {
            return false;
        }
    }

    /** The transport reached end of stream. */
    public static final class TransportClosed extends ArchonException {
        public TransportClosed(String message) {
            super(message);
        }

        public TransportClosed(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public boolean retryable() {
            return false;
        }
    }
}
