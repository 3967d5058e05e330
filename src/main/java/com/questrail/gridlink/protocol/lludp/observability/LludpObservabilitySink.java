package com.questrail.gridlink.protocol.lludp.observability;

/**
 * Receives observability events from circuits. Implementations can provide
 * logging, metrics, or tracing. Calls arrive on the event loop and must not
 * block.
 */
public interface LludpObservabilitySink {
    /**
     * Called when a circuit changes handshake state.
     */
    void onCircuitStateTransition(CircuitStateTransitionEvent event);

    /**
     * Called for resends, delivery failures, duplicates and ack flushes.
     */
    void onReliabilityEvent(ReliabilityEvent event);

    /**
     * Called for socket lifecycle changes and dropped datagrams.
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs, e.g. a handler throws.
     */
    void onError(LludpErrorEvent event);
}
