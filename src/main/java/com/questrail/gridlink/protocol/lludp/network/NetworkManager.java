package com.questrail.gridlink.protocol.lludp.network;

import com.questrail.gridlink.protocol.lludp.circuit.Circuit;
import com.questrail.gridlink.protocol.lludp.circuit.CircuitEnvironment;
import com.questrail.gridlink.protocol.lludp.circuit.CircuitListener;
import com.questrail.gridlink.protocol.lludp.circuit.DisconnectReason;
import com.questrail.gridlink.protocol.lludp.circuit.SendOutcome;
import com.questrail.gridlink.protocol.lludp.config.SessionContext;
import com.questrail.gridlink.protocol.lludp.internal.time.Cancellable;
import com.questrail.gridlink.protocol.lludp.model.MessageType;
import com.questrail.gridlink.protocol.lludp.model.OutboundPacket;
import com.questrail.gridlink.protocol.lludp.model.Packet;
import com.questrail.gridlink.protocol.lludp.model.message.LogoutRequest;
import com.questrail.gridlink.protocol.lludp.observability.LludpErrorEvent;
import com.questrail.gridlink.protocol.lludp.transport.DatagramEndpointFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * NetworkManager
 * =============================================================================
 * Owns every circuit of one session and routes their packets to application
 * handlers.
 *
 * <h2>Current and child circuits</h2>
 * Exactly one circuit at a time may be <em>current</em>: the region the agent
 * occupies. Other circuits are <em>children</em> kept open for neighbouring
 * regions. Agent-movement messages are only accepted for the current circuit.
 * When the current circuit closes, for whatever reason, listeners are told
 * the session is disconnected.
 *
 * <h2>Dispatch</h2>
 * Handlers are kept per {@link MessageType} in copy-on-write lists. Each
 * dispatch iterates a stable snapshot, so a handler may register or remove
 * handlers for the same type without affecting the packet being dispatched.
 * A handler that throws is logged and skipped; the remaining handlers still
 * run.
 */
public final class NetworkManager
{
    private static final Logger log = LoggerFactory.getLogger(NetworkManager.class);

    private final SessionContext session;
    private final CircuitEnvironment env;
    private final DatagramEndpointFactory endpoints;
    private final InetSocketAddress bindAddress;

    private final Map<InetSocketAddress, Circuit> circuits = new ConcurrentHashMap<>();
    private final AtomicReference<Circuit> current = new AtomicReference<>();
    private final Map<MessageType, CopyOnWriteArrayList<PacketHandler>> handlers = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<NetworkEventListener> listeners = new CopyOnWriteArrayList<>();
    private final CircuitListener circuitListener = new ManagerCircuitListener();

    private final AtomicReference<CompletableFuture<Boolean>> pendingLogout = new AtomicReference<>();
    private volatile Cancellable logoutTimer;
    private volatile boolean shutdown;

    public NetworkManager(
            SessionContext session,
            CircuitEnvironment env,
            DatagramEndpointFactory endpoints,
            InetSocketAddress bindAddress)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.env = Objects.requireNonNull(env, "env");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
    }

    public SessionContext session()
    {
        return session;
    }

    // -------------------------------------------------------------------------
    // Circuits
    // -------------------------------------------------------------------------

    /**
     * Open a circuit to a region. The first circuit becomes current.
     */
    public Circuit connect(InetSocketAddress endpoint, long circuitCode)
    {
        return connect(endpoint, circuitCode, current.get() == null);
    }

    /**
     * Open a circuit to a region.
     *
     * <p>If an open circuit to {@code endpoint} already exists it is returned
     * (and made current when asked). The handshake completes asynchronously;
     * see {@link NetworkEventListener#onCircuitConnected(Circuit)}.</p>
     *
     * @param makeCurrent whether the agent is moving into this region
     */
    public Circuit connect(InetSocketAddress endpoint, long circuitCode, boolean makeCurrent)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        if (shutdown) {
            throw new IllegalStateException("NetworkManager is shut down");
        }

        Circuit existing = circuits.get(endpoint);
        if (existing != null && !existing.isClosed()) {
            if (makeCurrent) {
                setCurrentCircuit(existing);
            }
            return existing;
        }

        Circuit circuit = new Circuit(env, endpoint, circuitCode, session, makeCurrent,
                endpoints.create(bindAddress), circuitListener);
        circuits.put(endpoint, circuit);
        if (makeCurrent) {
            Circuit prev = current.getAndSet(circuit);
            if (prev != null && prev != circuit) {
                prev.setAgentCircuit(false);
            }
        }

        log.info("Connecting to {} (circuit code {}, {})",
                endpoint, circuitCode, makeCurrent ? "current" : "child");
        circuit.open();
        return circuit;
    }

    /**
     * Close a circuit. Listeners are notified once it reaches DISCONNECTED.
     *
     * @return {@code false} if the circuit was already closing or closed
     */
    public boolean disconnect(Circuit circuit, DisconnectReason reason)
    {
        Objects.requireNonNull(circuit, "circuit");
        return circuit.close(reason);
    }

    /**
     * Make {@code circuit} the one the agent occupies (region crossing).
     */
    public void setCurrentCircuit(Circuit circuit)
    {
        Objects.requireNonNull(circuit, "circuit");
        if (!owns(circuit)) {
            throw new IllegalArgumentException("Circuit not owned by this manager: " + circuit);
        }
        Circuit prev = current.getAndSet(circuit);
        if (prev == circuit) {
            return;
        }
        if (prev != null) {
            prev.setAgentCircuit(false);
        }
        circuit.setAgentCircuit(true);
    }

    public Optional<Circuit> currentCircuit()
    {
        return Optional.ofNullable(current.get());
    }

    public List<Circuit> circuits()
    {
        return List.copyOf(circuits.values());
    }

    public Optional<Circuit> circuitFor(InetSocketAddress endpoint)
    {
        return Optional.ofNullable(circuits.get(endpoint));
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    public SendOutcome send(OutboundPacket packet, Circuit circuit)
    {
        Objects.requireNonNull(packet, "packet");
        if (circuit == null || !owns(circuit)) {
            return SendOutcome.rejected(SendOutcome.Reason.UNKNOWN_CIRCUIT);
        }
        if (packet.type().carriesAgentMovement() && circuit != current.get()) {
            return SendOutcome.rejected(SendOutcome.Reason.NOT_CURRENT_CIRCUIT);
        }
        return circuit.send(packet);
    }

    /**
     * Send on the current circuit.
     */
    public SendOutcome send(OutboundPacket packet)
    {
        Circuit c = current.get();
        if (c == null) {
            return SendOutcome.rejected(SendOutcome.Reason.NOT_READY);
        }
        return send(packet, c);
    }

    // -------------------------------------------------------------------------
    // Handlers and listeners
    // -------------------------------------------------------------------------

    public void registerHandler(MessageType type, PacketHandler handler)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /**
     * @return {@code true} if the handler was registered for {@code type}
     */
    public boolean unregisterHandler(MessageType type, PacketHandler handler)
    {
        Objects.requireNonNull(type, "type");
        CopyOnWriteArrayList<PacketHandler> list = handlers.get(type);
        return list != null && list.remove(handler);
    }

    public void addEventListener(NetworkEventListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeEventListener(NetworkEventListener listener)
    {
        return listeners.remove(listener);
    }

    // -------------------------------------------------------------------------
    // Logout and shutdown
    // -------------------------------------------------------------------------

    /**
     * Send LogoutRequest on the current circuit, wait for LogoutReply (or the
     * logout timeout), then close every circuit with
     * {@link DisconnectReason#LOGOUT}.
     *
     * @return completes with {@code true} if the region confirmed the logout
     */
    public CompletableFuture<Boolean> logout()
    {
        CompletableFuture<Boolean> attempt = new CompletableFuture<>();
        if (!pendingLogout.compareAndSet(null, attempt)) {
            CompletableFuture<Boolean> inFlight = pendingLogout.get();
            return inFlight != null ? inFlight : CompletableFuture.completedFuture(false);
        }

        Circuit c = current.get();
        SendOutcome outcome = (c == null)
                ? SendOutcome.rejected(SendOutcome.Reason.NOT_READY)
                : send(OutboundPacket.reliable(MessageType.LogoutRequest,
                        new LogoutRequest(session.agentId(), session.sessionId()).toBody()), c);

        if (!outcome.isSent()) {
            log.info("Logout without LogoutRequest ({})", outcome);
            finishLogout(attempt, false);
            return attempt;
        }

        logoutTimer = env.scheduler().scheduleAfter(
                env.timing().logoutTimeout(), env.clock(), () -> finishLogout(attempt, false));
        return attempt;
    }

    /**
     * Close every circuit and refuse new connections.
     */
    public void shutdown()
    {
        shutdown = true;
        CompletableFuture<Boolean> logout = pendingLogout.getAndSet(null);
        if (logout != null) {
            cancelLogoutTimer();
            logout.complete(false);
        }
        closeAll(DisconnectReason.SHUTDOWN);
    }

    private void finishLogout(CompletableFuture<Boolean> attempt, boolean confirmed)
    {
        if (!pendingLogout.compareAndSet(attempt, null)) {
            return;
        }
        cancelLogoutTimer();
        closeAll(DisconnectReason.LOGOUT);
        log.info("Logged out ({})", confirmed ? "confirmed" : "unconfirmed");
        notifyListeners(l -> l.onLoggedOut(confirmed));
        attempt.complete(confirmed);
    }

    private void cancelLogoutTimer()
    {
        Cancellable t = logoutTimer;
        logoutTimer = null;
        if (t != null) {
            t.cancel();
        }
    }

    private void closeAll(DisconnectReason reason)
    {
        for (Circuit c : List.copyOf(circuits.values())) {
            c.close(reason);
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private boolean owns(Circuit circuit)
    {
        return circuits.get(circuit.remote()) == circuit;
    }

    private void dispatch(Circuit circuit, Packet packet)
    {
        List<PacketHandler> list = handlers.get(packet.type());
        if (list != null) {
            for (PacketHandler h : list) {
                try {
                    h.onPacket(circuit, packet);
                }
                catch (RuntimeException e) {
                    log.error("Handler for {} on {} failed", packet.type(), circuit.remote(), e);
                    env.sink().onError(new LludpErrorEvent(env.wallClock().now(), circuit.remote(),
                            "Packet handler for " + packet.type() + " threw", e));
                }
            }
        }

        if (packet.type() == MessageType.LogoutReply && circuit == current.get()) {
            CompletableFuture<Boolean> attempt = pendingLogout.get();
            if (attempt != null) {
                finishLogout(attempt, true);
            }
        }
    }

    private void notifyListeners(Consumer<NetworkEventListener> call)
    {
        for (NetworkEventListener l : listeners) {
            try {
                call.accept(l);
            }
            catch (RuntimeException e) {
                log.error("Network event listener failed", e);
                env.sink().onError(new LludpErrorEvent(env.wallClock().now(), null,
                        "Network event listener threw", e));
            }
        }
    }

    /**
     * ManagerCircuitListener
     * -------------------------------------------------------------------------
     * Receives every owned circuit's upward notifications.
     */
    private final class ManagerCircuitListener implements CircuitListener
    {
        @Override
        public void onPacket(Circuit circuit, Packet packet)
        {
            dispatch(circuit, packet);
        }

        @Override
        public void onActive(Circuit circuit)
        {
            notifyListeners(l -> l.onCircuitConnected(circuit));
        }

        @Override
        public void onClosed(Circuit circuit, DisconnectReason reason, boolean wasActive)
        {
            circuits.remove(circuit.remote(), circuit);
            boolean wasCurrent = current.compareAndSet(circuit, null);

            if (wasActive) {
                notifyListeners(l -> l.onCircuitDisconnected(circuit, reason));
            }
            else {
                notifyListeners(l -> l.onConnectionFailed(circuit, reason));
            }
            if (wasCurrent) {
                log.warn("Current circuit {} closed ({}): session disconnected", circuit.remote(), reason);
                notifyListeners(l -> l.onSessionDisconnected(circuit, reason));
            }
        }

        @Override
        public void onDeliveryFailed(Circuit circuit, MessageType type, long sequence)
        {
            notifyListeners(l -> l.onDeliveryFailed(circuit, type, sequence));
        }
    }
}
