package com.questrail.gridlink.protocol.lludp.circuit;

import com.questrail.gridlink.protocol.lludp.codec.PacketDecodeResult;
import com.questrail.gridlink.protocol.lludp.config.SessionContext;
import com.questrail.gridlink.protocol.lludp.internal.reliability.InboundDisposition;
import com.questrail.gridlink.protocol.lludp.internal.reliability.OutboundPending;
import com.questrail.gridlink.protocol.lludp.internal.reliability.ReliabilityEngine;
import com.questrail.gridlink.protocol.lludp.internal.reliability.ResendScan;
import com.questrail.gridlink.protocol.lludp.internal.time.Cancellable;
import com.questrail.gridlink.protocol.lludp.model.MessageType;
import com.questrail.gridlink.protocol.lludp.model.OutboundPacket;
import com.questrail.gridlink.protocol.lludp.model.Packet;
import com.questrail.gridlink.protocol.lludp.model.PacketHeader;
import com.questrail.gridlink.protocol.lludp.model.message.CompleteAgentMovement;
import com.questrail.gridlink.protocol.lludp.model.message.CompletePingCheck;
import com.questrail.gridlink.protocol.lludp.model.message.MessageBodyException;
import com.questrail.gridlink.protocol.lludp.model.message.PacketAck;
import com.questrail.gridlink.protocol.lludp.model.message.RegionHandshakeReply;
import com.questrail.gridlink.protocol.lludp.model.message.StartPingCheck;
import com.questrail.gridlink.protocol.lludp.model.message.UseCircuitCode;
import com.questrail.gridlink.protocol.lludp.observability.CircuitStateTransitionEvent;
import com.questrail.gridlink.protocol.lludp.observability.ReliabilityEvent;
import com.questrail.gridlink.protocol.lludp.observability.TransportObservabilityEvent;
import com.questrail.gridlink.protocol.lludp.transport.DatagramEndpoint;
import com.questrail.gridlink.protocol.lludp.transport.DatagramEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Circuit
 * =============================================================================
 * One reliable-messaging session with one region, over one UDP socket.
 *
 * <h2>Composition</h2>
 * A circuit owns its {@link DatagramEndpoint} and a {@link ReliabilityEngine},
 * and uses the shared codec from its {@link CircuitEnvironment}. It drives the
 * handshake:
 *
 * <pre>
 *   open()            DISCONNECTED → CONNECTING            (bind)
 *   transport up      send UseCircuitCode → AWAITING_HANDSHAKE_CONFIRM
 *   RegionHandshake   send RegionHandshakeReply
 *                       child circuit  → ACTIVE
 *                       agent circuit  send CompleteAgentMovement
 *   AgentMovementComplete (agent)      → ACTIVE
 *   close(reason)     → DISCONNECTING → DISCONNECTED
 * </pre>
 *
 * The packet currently driving the handshake is re-sent on every
 * {@code handshakeTimeout}; after {@code maxHandshakeAttempts} sends the
 * circuit closes with {@link DisconnectReason#HANDSHAKE_TIMEOUT}.
 *
 * <h2>Threading</h2>
 * Transport callbacks are handed to the environment's event loop. Circuit
 * state is guarded by one lock so application threads may call
 * {@link #send(OutboundPacket)} and {@link #close(DisconnectReason)} directly.
 * Listener callbacks run outside the lock. Once teardown begins nothing more
 * is dispatched.
 */
public final class Circuit
{
    private static final Logger log = LoggerFactory.getLogger(Circuit.class);

    private final CircuitEnvironment env;
    private final CircuitTimingPolicy timing;
    private final InetSocketAddress remote;
    private final long circuitCode;
    private final SessionContext session;
    private final DatagramEndpoint endpoint;
    private final CircuitListener listener;
    private final ReliabilityEngine reliability;
    private final StatisticsCounters counters = new StatisticsCounters();

    private final Object lock = new Object();

    // --- guarded by lock ------------------------------------------------------
    private volatile CircuitState state = CircuitState.DISCONNECTED;
    private volatile DisconnectReason disconnectReason;
    private boolean opened;
    private boolean agentCircuit;
    private boolean regionHandshakeReceived;
    private int handshakeAttempts;
    private long handshakeSequence = -1;
    private Cancellable resendTimer;
    private Cancellable ackTimer;
    private Cancellable handshakeTimer;

    public Circuit(
            CircuitEnvironment env,
            InetSocketAddress remote,
            long circuitCode,
            SessionContext session,
            boolean agentCircuit,
            DatagramEndpoint endpoint,
            CircuitListener listener)
    {
        this.env = Objects.requireNonNull(env, "env");
        this.timing = env.timing();
        this.remote = Objects.requireNonNull(remote, "remote");
        this.session = Objects.requireNonNull(session, "session");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.listener = Objects.requireNonNull(listener, "listener");
        if (circuitCode < 0 || circuitCode > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("circuitCode out of 32-bit range: " + circuitCode);
        }
        this.circuitCode = circuitCode;
        this.agentCircuit = agentCircuit;
        this.reliability = new ReliabilityEngine(
                timing.resendInterval(), timing.maxResendCount(), timing.seenWindowSize());
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public InetSocketAddress remote()
    {
        return remote;
    }

    public long circuitCode()
    {
        return circuitCode;
    }

    public CircuitState state()
    {
        return state;
    }

    public boolean isActive()
    {
        return state == CircuitState.ACTIVE;
    }

    /**
     * True once teardown has begun.
     */
    public boolean isClosed()
    {
        return disconnectReason != null;
    }

    public Optional<DisconnectReason> disconnectReason()
    {
        return Optional.ofNullable(disconnectReason);
    }

    public boolean isAgentCircuit()
    {
        synchronized (lock) {
            return agentCircuit;
        }
    }

    public CircuitStatistics statistics()
    {
        return counters.snapshot();
    }

    /**
     * Reliable packets sent and not yet acknowledged.
     */
    public int outstandingReliableCount()
    {
        synchronized (lock) {
            return reliability.outstandingCount();
        }
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Bind the socket and start the handshake. A circuit opens once.
     *
     * @throws IllegalStateException if already opened
     */
    public void open()
    {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (opened) {
                throw new IllegalStateException("Circuit to " + remote + " already opened");
            }
            opened = true;
            endpoint.setListener(new TransportListener());
            transitionLocked(CircuitState.CONNECTING, "open", after);
        }
        runAll(after);

        // Outside the lock: a synchronous endpoint reports up/down from start().
        endpoint.start();
    }

    /**
     * Tear the circuit down. Outstanding and owed state is discarded, timers
     * are cancelled and the socket is closed.
     *
     * @return {@code false} if the circuit was already closing or closed
     */
    public boolean close(DisconnectReason reason)
    {
        Objects.requireNonNull(reason, "reason");
        List<Runnable> after = new ArrayList<>();
        boolean closed;
        synchronized (lock) {
            closed = closeLocked(reason, after);
        }
        runAll(after);
        return closed;
    }

    /**
     * Mark this circuit as (or no longer as) the one the agent occupies. An
     * active circuit promoted to agent circuit sends CompleteAgentMovement.
     * A circuit demoted after answering RegionHandshake no longer waits for
     * AgentMovementComplete and becomes active as a child.
     */
    public void setAgentCircuit(boolean agent)
    {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            boolean promoted = agent && !agentCircuit;
            boolean demoted = !agent && agentCircuit;
            agentCircuit = agent;
            if (promoted && state == CircuitState.ACTIVE) {
                transmitLocked(completeAgentMovement());
            }
            if (demoted && state == CircuitState.AWAITING_HANDSHAKE_CONFIRM
                    && regionHandshakeReceived && disconnectReason == null) {
                activateLocked("demoted to child", after);
            }
        }
        runAll(after);
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Submit a packet. Only ACTIVE circuits accept application traffic; the
     * handshake packets are sent internally.
     */
    public SendOutcome send(OutboundPacket packet)
    {
        Objects.requireNonNull(packet, "packet");
        synchronized (lock) {
            if (disconnectReason != null) {
                return SendOutcome.rejected(SendOutcome.Reason.CLOSED);
            }
            if (state != CircuitState.ACTIVE) {
                return SendOutcome.rejected(SendOutcome.Reason.NOT_READY);
            }
            return transmitLocked(packet);
        }
    }

    private SendOutcome transmitLocked(OutboundPacket packet)
    {
        long seq = reliability.peekSequence();
        PacketHeader header = PacketHeader.outbound(packet.reliable(), packet.zeroCoded(), seq);
        byte[] bytes = env.encoder().encode(header, packet.type(), packet.body());
        if (bytes.length > env.maxPacketSize()) {
            log.debug("Circuit {}: {} of {} bytes exceeds max packet size {}",
                    remote, packet.type(), bytes.length, env.maxPacketSize());
            return SendOutcome.rejected(SendOutcome.Reason.TOO_LARGE);
        }
        reliability.nextSequence();

        if (packet.reliable()) {
            reliability.trackReliable(seq, packet.type(), bytes, env.clock().nowNanos());
        }

        writeLocked(piggybackLocked(bytes));
        return new SendOutcome.Sent(seq);
    }

    private byte[] piggybackLocked(byte[] datagram)
    {
        if (reliability.pendingAckCount() == 0 || timing.maxPiggybackedAcks() == 0) {
            return datagram;
        }
        int room = (env.maxPacketSize() - datagram.length - 1) / 4;
        int n = Math.min(timing.maxPiggybackedAcks(), room);
        if (n <= 0) {
            return datagram;
        }
        List<Long> acks = reliability.drainPendingAcks(n);
        counters.acksPiggybacked.addAndGet(acks.size());
        return env.encoder().appendAcks(datagram, acks);
    }

    private void flushAcksLocked()
    {
        while (reliability.pendingAckCount() > 0) {
            List<Long> acks = reliability.drainPendingAcks(PacketAck.MAX_PER_PACKET);
            long seq = reliability.nextSequence();
            byte[] bytes = env.encoder().encode(
                    PacketHeader.outbound(false, false, seq),
                    MessageType.PacketAck,
                    new PacketAck(acks).toBody());
            writeLocked(bytes);
            counters.acksStandalone.addAndGet(acks.size());
            env.sink().onReliabilityEvent(new ReliabilityEvent(
                    env.wallClock().now(), remote, ReliabilityEvent.Kind.ACKS_FLUSHED,
                    seq, null, acks.size()));
        }
    }

    private void writeLocked(byte[] datagram)
    {
        endpoint.send(remote, datagram);
        counters.sent(datagram.length);
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    private void handleDatagram(SocketAddress from, byte[] datagram)
    {
        List<Runnable> after = new ArrayList<>();
        Packet deliver = null;

        synchronized (lock) {
            if (disconnectReason != null || !transportUpLocked()) {
                return;
            }
            if (!remote.equals(from)) {
                log.debug("Circuit {}: ignoring datagram from {}", remote, from);
                return;
            }
            counters.received(datagram.length);

            PacketDecodeResult result = env.decoder().decode(datagram);
            if (result instanceof PacketDecodeResult.Malformed m) {
                counters.malformedDatagrams.incrementAndGet();
                env.sink().onTransportEvent(new TransportObservabilityEvent(
                        env.wallClock().now(), remote,
                        TransportObservabilityEvent.Kind.DATAGRAM_MALFORMED, m.reason(), null));
                return;
            }
            if (result instanceof PacketDecodeResult.Unrecognized u) {
                // The peer still needs its ack, or it will resend forever.
                counters.unrecognizedMessages.incrementAndGet();
                reliability.onAcknowledged(u.appendedAcks());
                reliability.onInbound(u.header().sequence(), u.header().reliable());
                env.sink().onTransportEvent(new TransportObservabilityEvent(
                        env.wallClock().now(), remote,
                        TransportObservabilityEvent.Kind.MESSAGE_UNRECOGNIZED, u.toString(), null));
                return;
            }

            Packet packet = ((PacketDecodeResult.Decoded) result).packet();
            reliability.onAcknowledged(packet.appendedAcks());

            InboundDisposition disposition =
                    reliability.onInbound(packet.sequence(), packet.header().reliable());
            if (disposition == InboundDisposition.DUPLICATE) {
                counters.duplicatesReceived.incrementAndGet();
                env.sink().onReliabilityEvent(new ReliabilityEvent(
                        env.wallClock().now(), remote, ReliabilityEvent.Kind.DUPLICATE_RECEIVED,
                        packet.sequence(), packet.type(), 0));
                return;
            }

            try {
                deliver = handleInboundLocked(packet, after);
            }
            catch (MessageBodyException e) {
                counters.malformedDatagrams.incrementAndGet();
                env.sink().onTransportEvent(new TransportObservabilityEvent(
                        env.wallClock().now(), remote,
                        TransportObservabilityEvent.Kind.DATAGRAM_MALFORMED,
                        packet.type() + ": " + e.getMessage(), e));
            }
        }

        runAll(after);

        if (deliver != null && disconnectReason == null) {
            listener.onPacket(this, deliver);
        }
    }

    /**
     * Transport-level handling of one new packet.
     *
     * @return the packet to dispatch to application handlers, or {@code null}
     */
    private Packet handleInboundLocked(Packet packet, List<Runnable> after)
    {
        switch (packet.type()) {
            case PacketAck -> {
                reliability.onAcknowledged(PacketAck.fromBody(packet.body()).sequences());
                return null;
            }
            case CloseCircuit -> {
                log.info("Circuit {}: region closed the circuit", remote);
                closeLocked(DisconnectReason.REMOTE_CLOSED, after);
                return null;
            }
            case StartPingCheck -> {
                StartPingCheck ping = StartPingCheck.fromBody(packet.body());
                transmitLocked(OutboundPacket.unreliable(MessageType.CompletePingCheck,
                        new CompletePingCheck(ping.pingId()).toBody()));
                return packet;
            }
            case RegionHandshake -> {
                onRegionHandshakeLocked(after);
                return packet;
            }
            case AgentMovementComplete -> {
                if (state == CircuitState.AWAITING_HANDSHAKE_CONFIRM && agentCircuit) {
                    activateLocked("agent movement complete", after);
                }
                return packet;
            }
            default -> {
                return packet;
            }
        }
    }

    private void onRegionHandshakeLocked(List<Runnable> after)
    {
        if (state != CircuitState.AWAITING_HANDSHAKE_CONFIRM || regionHandshakeReceived) {
            return;
        }
        regionHandshakeReceived = true;

        transmitLocked(OutboundPacket.reliable(MessageType.RegionHandshakeReply,
                new RegionHandshakeReply(session.agentId(), session.sessionId(),
                        RegionHandshakeReply.DEFAULT_FLAGS).toBody()));

        if (agentCircuit) {
            handshakeAttempts = 0;
            sendHandshakePacketLocked();
        }
        else {
            activateLocked("region handshake", after);
        }
    }

    // -------------------------------------------------------------------------
    // Handshake
    // -------------------------------------------------------------------------

    private void onTransportUp()
    {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (state != CircuitState.CONNECTING || disconnectReason != null) {
                return;
            }
            env.sink().onTransportEvent(new TransportObservabilityEvent(
                    env.wallClock().now(), remote, TransportObservabilityEvent.Kind.UP, null, null));

            armResendTimerLocked();
            armAckTimerLocked();

            sendHandshakePacketLocked();
            transitionLocked(CircuitState.AWAITING_HANDSHAKE_CONFIRM, "UseCircuitCode sent", after);
        }
        runAll(after);
    }

    /**
     * Send (or re-send) the packet currently driving the handshake, replacing
     * its previous reliable entry.
     */
    private void sendHandshakePacketLocked()
    {
        if (handshakeSequence >= 0) {
            reliability.forget(handshakeSequence);
        }
        // CompleteAgentMovement drives the handshake only for the agent circuit.
        OutboundPacket packet = regionHandshakeReceived && agentCircuit
                ? completeAgentMovement()
                : OutboundPacket.reliable(MessageType.UseCircuitCode,
                        new UseCircuitCode(circuitCode, session.sessionId(), session.agentId()).toBody());

        handshakeAttempts++;
        SendOutcome outcome = transmitLocked(packet);
        handshakeSequence = (outcome instanceof SendOutcome.Sent s) ? s.sequence() : -1;
        log.debug("Circuit {}: sent {} (attempt {}/{})",
                remote, packet.type(), handshakeAttempts, timing.maxHandshakeAttempts());

        cancel(handshakeTimer);
        handshakeTimer = env.scheduler().scheduleAfter(timing.handshakeTimeout(), env.clock(), this::onHandshakeTimeout);
    }

    private void onHandshakeTimeout()
    {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (state != CircuitState.AWAITING_HANDSHAKE_CONFIRM || disconnectReason != null) {
                return;
            }
            if (regionHandshakeReceived && !agentCircuit) {
                activateLocked("region handshake", after);
            }
            else if (handshakeAttempts >= timing.maxHandshakeAttempts()) {
                log.warn("Circuit {}: no handshake confirmation after {} attempts", remote, handshakeAttempts);
                closeLocked(DisconnectReason.HANDSHAKE_TIMEOUT, after);
            }
            else {
                sendHandshakePacketLocked();
            }
        }
        runAll(after);
    }

    private void activateLocked(String cause, List<Runnable> after)
    {
        cancel(handshakeTimer);
        handshakeTimer = null;
        handshakeSequence = -1;
        transitionLocked(CircuitState.ACTIVE, cause, after);
    }

    private OutboundPacket completeAgentMovement()
    {
        return OutboundPacket.reliable(MessageType.CompleteAgentMovement,
                new CompleteAgentMovement(session.agentId(), session.sessionId(), circuitCode).toBody());
    }

    // -------------------------------------------------------------------------
    // Timers
    // -------------------------------------------------------------------------

    private void armResendTimerLocked()
    {
        resendTimer = env.scheduler().scheduleAfter(timing.resendCheckInterval(), env.clock(), this::onResendTick);
    }

    private void armAckTimerLocked()
    {
        ackTimer = env.scheduler().scheduleAfter(timing.ackFlushInterval(), env.clock(), this::onAckTick);
    }

    private void onResendTick()
    {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (disconnectReason != null) {
                return;
            }

            ResendScan scan = reliability.scanForResend(env.clock().nowNanos());
            for (OutboundPending p : scan.resend()) {
                writeLocked(env.encoder().markResent(p.bytes()));
                counters.packetsResent.incrementAndGet();
                env.sink().onReliabilityEvent(new ReliabilityEvent(
                        env.wallClock().now(), remote, ReliabilityEvent.Kind.RESENT,
                        p.sequence(), p.type(), p.retries()));
            }

            boolean handshakeFailed = false;
            for (OutboundPending p : scan.failed()) {
                counters.deliveryFailures.incrementAndGet();
                env.sink().onReliabilityEvent(new ReliabilityEvent(
                        env.wallClock().now(), remote, ReliabilityEvent.Kind.DELIVERY_FAILED,
                        p.sequence(), p.type(), p.retries()));
                if (p.sequence() == handshakeSequence) {
                    handshakeFailed = true;
                }
                else {
                    after.add(() -> listener.onDeliveryFailed(this, p.type(), p.sequence()));
                }
            }

            if (handshakeFailed) {
                closeLocked(DisconnectReason.HANDSHAKE_DELIVERY_FAILED, after);
            }
            else {
                armResendTimerLocked();
            }
        }
        runAll(after);
    }

    private void onAckTick()
    {
        synchronized (lock) {
            if (disconnectReason != null) {
                return;
            }
            flushAcksLocked();
            armAckTimerLocked();
        }
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    private void onTransportDown(Throwable cause)
    {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (disconnectReason != null || !opened) {
                return;
            }
            env.sink().onTransportEvent(new TransportObservabilityEvent(
                    env.wallClock().now(), remote, TransportObservabilityEvent.Kind.DOWN,
                    cause == null ? "closed" : cause.getMessage(), cause));
            closeLocked(DisconnectReason.TRANSPORT_FAILURE, after);
        }
        runAll(after);
    }

    private boolean closeLocked(DisconnectReason reason, List<Runnable> after)
    {
        if (disconnectReason != null) {
            return false;
        }
        disconnectReason = reason;

        boolean wasActive = state == CircuitState.ACTIVE;
        boolean transportUp = transportUpLocked();

        if (opened) {
            transitionLocked(CircuitState.DISCONNECTING, reason.name(), after);
        }

        if (transportUp && reason.notifiesPeer()) {
            long seq = reliability.nextSequence();
            writeLocked(env.encoder().encode(
                    PacketHeader.outbound(false, false, seq), MessageType.CloseCircuit, new byte[0]));
        }

        cancel(resendTimer);
        cancel(ackTimer);
        cancel(handshakeTimer);
        resendTimer = null;
        ackTimer = null;
        handshakeTimer = null;
        handshakeSequence = -1;

        // Peer is being abandoned: nothing outstanding or owed survives.
        reliability.clear();

        if (opened) {
            endpoint.stop();
            transitionLocked(CircuitState.DISCONNECTED, reason.name(), after);
        }

        after.add(() -> listener.onClosed(this, reason, wasActive));
        return true;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private boolean transportUpLocked()
    {
        return state == CircuitState.AWAITING_HANDSHAKE_CONFIRM || state == CircuitState.ACTIVE;
    }

    private void transitionLocked(CircuitState next, String cause, List<Runnable> after)
    {
        CircuitState prev = state;
        if (prev == next) {
            return;
        }
        state = next;
        env.sink().onCircuitStateTransition(new CircuitStateTransitionEvent(
                env.wallClock().now(), remote, circuitCode, prev, next, cause));
        if (next == CircuitState.ACTIVE) {
            after.add(() -> listener.onActive(this));
        }
    }

    private static void cancel(Cancellable c)
    {
        if (c != null) {
            c.cancel();
        }
    }

    private static void runAll(List<Runnable> actions)
    {
        for (Runnable r : actions) {
            r.run();
        }
    }

    @Override
    public String toString()
    {
        return "Circuit[" + remote + ", code=" + circuitCode + ", " + state
                + (agentCircuit ? ", agent" : ", child") + "]";
    }

    /**
     * TransportListener
     * -------------------------------------------------------------------------
     * Hands endpoint callbacks to the event loop.
     */
    private final class TransportListener implements DatagramEndpointListener
    {
        @Override
        public void onTransportUp()
        {
            env.loop().execute(Circuit.this::onTransportUp);
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            env.loop().execute(() -> Circuit.this.onTransportDown(cause));
        }

        @Override
        public void onDatagram(SocketAddress remoteAddress, byte[] payload)
        {
            env.loop().execute(() -> handleDatagram(remoteAddress, payload));
        }
    }
}
