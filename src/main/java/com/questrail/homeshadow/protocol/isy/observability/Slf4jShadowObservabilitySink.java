package com.questrail.homeshadow.protocol.isy.observability;

import com.questrail.homeshadow.api.ConnectionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ShadowObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jShadowObservabilitySink implements ShadowObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jShadowObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        if (event.isSessionStateChange()) {
            log.info("Event stream: {} -> {} (session {}, attempt {})",
                event.oldState().sessionState(),
                event.newState().sessionState(),
                event.newState().sessionId(),
                event.newState().attempt());
        }

        if (event.isStatusChange()) {
            if (event.newState().status() == ConnectionStatus.FAILED) {
                log.error("Event stream gave up after {} attempts", event.newState().attempt());
            } else {
                log.info("Connection status: {} -> {}",
                    event.oldState().status(),
                    event.newState().status());
            }
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.cause() != null) {
            log.info("Session {} transport {}: {}", event.sessionId(), event.kind(), event.cause().toString());
        } else {
            log.debug("Session {} transport {}", event.sessionId(), event.kind());
        }
    }

    @Override
    public void onError(ShadowErrorEvent event) {
        log.error("Shadow client error: {}", event.message(), event.cause());
    }
}
