package com.questrail.gridlink.protocol.lludp.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LludpObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLludpObservabilitySink implements LludpObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLludpObservabilitySink.class);

    @Override
    public void onCircuitStateTransition(CircuitStateTransitionEvent event) {
        log.info("Circuit {} ({}): {} -> {} [{}]",
            event.remote(),
            event.circuitCode(),
            event.oldState(),
            event.newState(),
            event.cause());
    }

    @Override
    public void onReliabilityEvent(ReliabilityEvent event) {
        switch (event.kind()) {
            case DELIVERY_FAILED -> log.warn("Circuit {}: {} seq={} not acknowledged after {} resends",
                event.remote(), event.type(), event.sequence(), event.count());
            case RESENT -> log.debug("Circuit {}: resent {} seq={} (attempt {})",
                event.remote(), event.type(), event.sequence(), event.count());
            case DUPLICATE_RECEIVED -> log.debug("Circuit {}: duplicate {} seq={}",
                event.remote(), event.type(), event.sequence());
            case ACKS_FLUSHED -> log.trace("Circuit {}: flushed {} acks",
                event.remote(), event.count());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        switch (event.kind()) {
            case UP -> log.info("Circuit {}: transport up", event.remote());
            case DOWN -> {
                if (event.cause() != null) {
                    log.warn("Circuit {}: transport down", event.remote(), event.cause());
                } else {
                    log.info("Circuit {}: transport down", event.remote());
                }
            }
            case DATAGRAM_MALFORMED -> log.warn("Circuit {}: dropped malformed datagram: {}",
                event.remote(), event.detail());
            case MESSAGE_UNRECOGNIZED -> log.debug("Circuit {}: dropped unrecognized message: {}",
                event.remote(), event.detail());
        }
    }

    @Override
    public void onError(LludpErrorEvent event) {
        if (event.remote() != null) {
            log.error("Circuit {}: {}", event.remote(), event.message(), event.cause());
        } else {
            log.error("LLUDP error: {}", event.message(), event.cause());
        }
    }
}
