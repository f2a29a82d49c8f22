package com.questrail.archon.observability;

/**
 * Main interface for receiving Archon protocol observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ArchonObservabilitySink {
    /**
     * Called once per completed or failed command exchange.
     * @param event the exchange details
     */
    void onCommand(ArchonCommandEvent event);

    /**
     * Called when a transport-level event occurs (connect, close, client accepted).
     * @param event the transport event
     */
    void onTransportEvent(ArchonTransportEvent event);

    /**
     * Called when the exposure sequencer changes state or completes a frame.
     * @param event the exposure event
     */
    void onExposureEvent(ExposureStateEvent event);

    /**
     * Called when an error or anomaly occurs in the protocol stack.
     * @param event the error event
     */
    void onError(ArchonErrorEvent event);
}
