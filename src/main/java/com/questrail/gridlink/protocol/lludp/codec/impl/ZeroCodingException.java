package com.questrail.gridlink.protocol.lludp.codec.impl;

/**
 * Invalid zero-run encoding. Never escapes the codec.
 */
final class ZeroCodingException extends Exception
{
    ZeroCodingException(String message)
    {
        super(message);
    }
}
