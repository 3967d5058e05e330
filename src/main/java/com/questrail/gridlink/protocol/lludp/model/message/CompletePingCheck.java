package com.questrail.gridlink.protocol.lludp.model.message;

public record CompletePingCheck(int pingId)
{
    public byte[] toBody()
    {
        return new BodyWriter().writeU8(pingId).toByteArray();
    }

    public static CompletePingCheck fromBody(byte[] body)
    {
        return new CompletePingCheck(new BodyReader(body).readU8());
    }
}
