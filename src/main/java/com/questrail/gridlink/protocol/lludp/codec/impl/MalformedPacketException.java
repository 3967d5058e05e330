package com.questrail.gridlink.protocol.lludp.codec.impl;

/**
 * Structural failure while framing a datagram. Never escapes the codec.
 */
final class MalformedPacketException extends Exception
{
    MalformedPacketException(String message)
    {
        super(message);
    }
}
