package com.questrail.gridlink.protocol.lludp.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * MessageType
 * =============================================================================
 * Closed table of the messages this client understands.
 *
 * <h2>Identifier forms</h2>
 * Every message has a frequency class and a number within that class. The
 * canonical 32-bit wire identifier is the big-endian value of the identifier
 * bytes as they appear on the wire:
 * <ul>
 *   <li>HIGH: {@code n}</li>
 *   <li>MEDIUM: {@code 0xFF00 | n}</li>
 *   <li>LOW: {@code 0xFFFF0000 | n}</li>
 *   <li>FIXED: the full 32-bit value ({@code 0xFFFFFFFA..0xFFFFFFFF})</li>
 * </ul>
 *
 * <p>A wire identifier not present here is an <em>unrecognized</em> message. The
 * codec reports it as a non-fatal outcome; it is never an exception.</p>
 *
 * <h2>Agent movement</h2>
 * Messages flagged {@link #carriesAgentMovement()} may only travel on the
 * current circuit (the region the agent occupies).
 */
public enum MessageType
{
    // --- High frequency -----------------------------------------------------
    StartPingCheck(MessageFrequency.HIGH, 1),
    CompletePingCheck(MessageFrequency.HIGH, 2),
    AgentUpdate(MessageFrequency.HIGH, 4, true),
    AgentAnimation(MessageFrequency.HIGH, 5, true),
    LayerData(MessageFrequency.HIGH, 11),
    ObjectUpdate(MessageFrequency.HIGH, 12),
    ObjectUpdateCompressed(MessageFrequency.HIGH, 13),
    ObjectUpdateCached(MessageFrequency.HIGH, 14),
    ImprovedTerseObjectUpdate(MessageFrequency.HIGH, 15),
    KillObject(MessageFrequency.HIGH, 16),
    TransferPacket(MessageFrequency.HIGH, 17),
    SendXferPacket(MessageFrequency.HIGH, 18),
    ConfirmXferPacket(MessageFrequency.HIGH, 19),
    AvatarAnimation(MessageFrequency.HIGH, 20),
    AvatarSitResponse(MessageFrequency.HIGH, 21),
    CameraConstraint(MessageFrequency.HIGH, 22),
    ParcelProperties(MessageFrequency.HIGH, 23),
    ChildAgentUpdate(MessageFrequency.HIGH, 25),
    SoundTrigger(MessageFrequency.HIGH, 29),

    // --- Medium frequency ---------------------------------------------------
    ObjectAdd(MessageFrequency.MEDIUM, 1),
    MultipleObjectUpdate(MessageFrequency.MEDIUM, 2),
    RequestMultipleObjects(MessageFrequency.MEDIUM, 3),
    ObjectPosition(MessageFrequency.MEDIUM, 4),
    RequestObjectPropertiesFamily(MessageFrequency.MEDIUM, 5),
    CoarseLocationUpdate(MessageFrequency.MEDIUM, 6),
    CrossedRegion(MessageFrequency.MEDIUM, 7),
    ConfirmEnableSimulator(MessageFrequency.MEDIUM, 8),
    ObjectProperties(MessageFrequency.MEDIUM, 9),
    ObjectPropertiesFamily(MessageFrequency.MEDIUM, 10),
    ParcelPropertiesRequest(MessageFrequency.MEDIUM, 11),
    ViewerEffect(MessageFrequency.MEDIUM, 17),

    // --- Low frequency ------------------------------------------------------
    TestMessage(MessageFrequency.LOW, 1),
    UseCircuitCode(MessageFrequency.LOW, 3),
    EconomyDataRequest(MessageFrequency.LOW, 24),
    ChatFromViewer(MessageFrequency.LOW, 80),
    AgentThrottle(MessageFrequency.LOW, 81),
    ChatFromSimulator(MessageFrequency.LOW, 139),
    SimStats(MessageFrequency.LOW, 140),
    RegionHandshake(MessageFrequency.LOW, 148),
    RegionHandshakeReply(MessageFrequency.LOW, 149),
    SimulatorViewerTimeMessage(MessageFrequency.LOW, 150),
    EnableSimulator(MessageFrequency.LOW, 151),
    DisableSimulator(MessageFrequency.LOW, 152),
    KickUser(MessageFrequency.LOW, 163),
    CompleteAgentMovement(MessageFrequency.LOW, 249, true),
    AgentMovementComplete(MessageFrequency.LOW, 250),
    LogoutRequest(MessageFrequency.LOW, 252),
    LogoutReply(MessageFrequency.LOW, 253),
    ImprovedInstantMessage(MessageFrequency.LOW, 254),

    // --- Fixed --------------------------------------------------------------
    PacketAck(MessageFrequency.FIXED, 0xFFFFFFFBL),
    OpenCircuit(MessageFrequency.FIXED, 0xFFFFFFFCL),
    CloseCircuit(MessageFrequency.FIXED, 0xFFFFFFFDL);

    private static final Map<Long, MessageType> BY_WIRE_ID;

    static {
        Map<Long, MessageType> m = new HashMap<>();
        for (MessageType t : values()) {
            MessageType prior = m.put(t.wireId, t);
            if (prior != null) {
                throw new IllegalStateException("Duplicate wire id for " + prior + " and " + t);
            }
        }
        BY_WIRE_ID = Collections.unmodifiableMap(m);
    }

    private final MessageFrequency frequency;
    private final long number;
    private final long wireId;
    private final boolean agentMovement;

    MessageType(MessageFrequency frequency, long number)
    {
        this(frequency, number, false);
    }

    MessageType(MessageFrequency frequency, long number, boolean agentMovement)
    {
        this.frequency = frequency;
        this.number = number;
        this.agentMovement = agentMovement;
        this.wireId = switch (frequency) {
            case HIGH -> number;
            case MEDIUM -> 0xFF00L | number;
            case LOW -> 0xFFFF0000L | number;
            case FIXED -> number;
        };
    }

    public MessageFrequency frequency()
    {
        return frequency;
    }

    /**
     * Message number within its frequency class. For FIXED messages this is
     * the full 32-bit identifier.
     */
    public long number()
    {
        return number;
    }

    /**
     * Canonical 32-bit wire identifier.
     */
    public long wireId()
    {
        return wireId;
    }

    public boolean carriesAgentMovement()
    {
        return agentMovement;
    }

    /**
     * Identifier bytes exactly as written on the wire (before zero-coding).
     */
    public byte[] wireBytes()
    {
        int len = frequency.wireLength();
        byte[] out = new byte[len];
        for (int i = 0; i < len; i++) {
            out[i] = (byte) (wireId >>> (8 * (len - 1 - i)));
        }
        return out;
    }

    /**
     * Resolve a canonical wire identifier against the closed table.
     */
    public static Optional<MessageType> fromWireId(long wireId)
    {
        return Optional.ofNullable(BY_WIRE_ID.get(wireId));
    }
}
