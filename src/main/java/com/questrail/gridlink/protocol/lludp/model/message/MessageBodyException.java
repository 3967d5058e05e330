package com.questrail.gridlink.protocol.lludp.model.message;

/**
 * Thrown when a message body is too short or otherwise does not match the
 * block layout of its message type.
 */
public final class MessageBodyException extends RuntimeException
{
    public MessageBodyException(String message)
    {
        super(message);
    }
}
