package com.questrail.gridlink.protocol.lludp.observability;

/**
 * No-op implementation of LludpObservabilitySink.
 */
public final class NullObservabilitySink implements LludpObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCircuitStateTransition(CircuitStateTransitionEvent event) {}

    @Override
    public void onReliabilityEvent(ReliabilityEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(LludpErrorEvent event) {}
}
