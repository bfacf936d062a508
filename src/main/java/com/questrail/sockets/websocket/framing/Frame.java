package com.questrail.sockets.websocket.framing;

import java.util.Arrays;
import java.util.Objects;

/**
 * Frame
 * -----------------------------------------------------------------------------
 * Immutable, decoded representation of one wire frame.
 *
 * <p>The payload is held unmasked. Immutability is enforced via defensive
 * copying.</p>
 */
public final class Frame
{
    private final OpCode opCode;
    private final boolean fin;
    private final byte[] payload;

    public Frame(OpCode opCode, boolean fin, byte[] payload)
    {
        this.opCode = Objects.requireNonNull(opCode, "opCode");
        this.fin = fin;
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    public OpCode opCode()
    {
        return opCode;
    }

    /**
     * True when this frame ends its message.
     */
    public boolean fin()
    {
        return fin;
    }

    /**
     * Returns a defensive copy of the payload.
     */
    public byte[] payload()
    {
        return payload.clone();
    }

    public int payloadLength()
    {
        return payload.length;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame)) {
            return false;
        }
        Frame other = (Frame) o;
        return fin == other.fin
                && opCode == other.opCode
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode()
    {
        int result = Objects.hash(opCode, fin);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString()
    {
        return "Frame[opCode=" + opCode + ", fin=" + fin + ", payloadLength=" + payload.length + ']';
    }
}
