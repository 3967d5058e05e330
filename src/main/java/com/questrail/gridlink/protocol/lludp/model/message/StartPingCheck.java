package com.questrail.gridlink.protocol.lludp.model.message;

/**
 * Keep-alive probe. {@code oldestUnacked} is the sender's oldest
 * unacknowledged sequence number.
 */
public record StartPingCheck(int pingId, long oldestUnacked)
{
    public byte[] toBody()
    {
        return new BodyWriter()
                .writeU8(pingId)
                .writeU32(oldestUnacked)
                .toByteArray();
    }

    public static StartPingCheck fromBody(byte[] body)
    {
        BodyReader r = new BodyReader(body);
        return new StartPingCheck(r.readU8(), r.readU32());
    }
}
