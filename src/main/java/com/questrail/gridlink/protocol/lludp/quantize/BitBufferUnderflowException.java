package com.questrail.gridlink.protocol.lludp.quantize;

/**
 * Thrown when a bit field extends past the end of its buffer.
 */
public final class BitBufferUnderflowException extends RuntimeException
{
    public BitBufferUnderflowException(int bitOffset, int bits, int bufferBits)
    {
        super("Bit field [" + bitOffset + ", +" + bits + ") exceeds buffer of " + bufferBits + " bits");
    }
}
