package com.questrail.archon.api;

import com.questrail.archon.protocol.model.FrameRingState;

/**
 * DetectorController
 * =============================================================================
 * Capability interface shared by detector controller families.
 *
 * <p>The operations are the ones every family offers: open a session, pass a
 * raw command through, read the frame buffer status and pull raw image memory.
 * Family-specific operations (configuration upload, parameters, exposure
 * control) live on the concrete controller class.</p>
 *
 * <p>Failures are reported with unchecked exceptions; see
 * {@link com.questrail.archon.protocol.ArchonException} for the Archon family.</p>
 */
public interface DetectorController extends AutoCloseable
{
    /**
     * Open the connection to the controller. Opening an open controller is a no-op.
     */
    void open();

    boolean isOpen();

    /**
     * Send one native command and return the reply payload.
     */
    String command(String command);

    /**
     * Query the frame buffer ring.
     */
    FrameRingState readStatus();

    /**
     * Read raw controller memory.
     *
     * @param address controller memory address
     * @param blocks  number of transfer blocks
     * @return the bytes read
     */
    byte[] fetch(long address, long blocks);

    @Override
    void close();
}
