package com.questrail.archon.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ArchonObservabilitySink that emits logs via SLF4J.
 *
 * <p>Polled verbs (STATUS, TIMER, FRAME, WCONFIG) go to TRACE so that an
 * exposure loop does not flood the log; every other command goes to DEBUG.</p>
 */
public final class Slf4jArchonObservabilitySink implements ArchonObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jArchonObservabilitySink.class);

    @Override
    public void onCommand(ArchonCommandEvent event) {
        if (event.quiet()) {
            if (log.isTraceEnabled()) {
                log.trace("Archon {} {} -> {}", event.refId(), event.command(), event.reply());
            }
            return;
        }
        if (event.success()) {
            log.debug("Archon {} {} -> {}", event.refId(), event.command(), event.reply());
        } else {
            log.debug("Archon {} {} failed: {}", event.refId(), event.command(), event.reply());
        }
    }

    @Override
    public void onTransportEvent(ArchonTransportEvent event) {
        log.info("Archon Transport Event: {} {}", event.kind(), event.peer());
    }

    @Override
    public void onExposureEvent(ExposureStateEvent event) {
        if (event.kind() == ExposureStateEvent.Kind.FRAME_COMPLETE) {
            log.info("Frame {} complete in buffer {}", event.frameNumber(), event.bufferIndex() + 1);
        } else {
            log.info("Exposure {}: last frame {}", event.kind(), event.frameNumber());
        }
    }

    @Override
    public void onError(ArchonErrorEvent event) {
        log.error("Archon Error: {}", event.message(), event.cause());
    }
}
