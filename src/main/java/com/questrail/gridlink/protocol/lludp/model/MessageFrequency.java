package com.questrail.gridlink.protocol.lludp.model;

/**
 * MessageFrequency
 * -----------------------------------------------------------------------------
 * Frequency class of a message. The class decides how many bytes the message
 * number occupies on the wire.
 *
 * <pre>
 *   HIGH    1 byte                    NN
 *   MEDIUM  2 bytes                   FF NN
 *   LOW     4 bytes                   FF FF NN NN   (big-endian number)
 *   FIXED   4 bytes                   FF FF FF FA..FF
 * </pre>
 */
public enum MessageFrequency
{
    HIGH(1),
    MEDIUM(2),
    LOW(4),
    FIXED(4);

    private final int wireLength;

    MessageFrequency(int wireLength)
    {
        this.wireLength = wireLength;
    }

    /**
     * Number of bytes the message identifier occupies on the wire.
     */
    public int wireLength()
    {
        return wireLength;
    }
}
