package com.questrail.archon.observability;

/**
 * No-op implementation of ArchonObservabilitySink.
 */
public final class NullObservabilitySink implements ArchonObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCommand(ArchonCommandEvent event) {}

    @Override
    public void onTransportEvent(ArchonTransportEvent event) {}

    @Override
    public void onExposureEvent(ExposureStateEvent event) {}

    @Override
    public void onError(ArchonErrorEvent event) {}
}
