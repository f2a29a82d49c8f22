package com.questrail.archon.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ArchonObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onCommand(ArchonCommandEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(ArchonTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onExposureEvent(ExposureStateEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ArchonErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ArchonCommandEvent> getCommands() {
        return events.stream()
            .filter(e -> e instanceof ArchonCommandEvent)
            .map(e -> (ArchonCommandEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<ExposureStateEvent> getExposureEvents() {
        return events.stream()
            .filter(e -> e instanceof ExposureStateEvent)
            .map(e -> (ExposureStateEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
