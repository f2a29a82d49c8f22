package com.questrail.archon.emulator;

/**
 * Where the emulator writes replies and FETCH blocks for one connection.
 */
@FunctionalInterface
public interface EmulatorOutput
{
    void write(byte[] bytes);

    /**
     * Sends the blocks of an accepted FETCH. Network outputs override this to
     * pull blocks only as fast as the peer reads them; the default drains the
     * reply through {@link #write(byte[])}.
     */
    default void stream(FetchReply reply) {
        while (reply.hasNext()) {
            write(reply.next());
        }
    }
}
