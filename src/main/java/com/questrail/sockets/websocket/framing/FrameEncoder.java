package com.questrail.sockets.websocket.framing;

/**
 * FrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for a single wire frame.
 *
 * <p>The encoder owns all header mechanics: FIN bit, opcode nibble, payload
 * length encoding and masking. Callers decide only the opcode, the payload
 * slice and whether the frame ends its message.</p>
 */
public interface FrameEncoder
{
    /**
     * Encode one frame carrying {@code count} bytes of {@code payload} from
     * {@code offset}.
     *
     * @param fin true if this is the final frame of its message
     * @return wire-ready frame bytes
     * @throws IndexOutOfBoundsException if the slice does not fit {@code payload}
     * @throws IllegalArgumentException  if a control frame is not final or its
     *                                   payload exceeds 125 bytes
     */
    byte[] encode(OpCode opCode, byte[] payload, int offset, int count, boolean fin);

    /**
     * Encode a final (unfragmented) frame.
     */
    default byte[] encode(OpCode opCode, byte[] payload, int offset, int count)
    {
        return encode(opCode, payload, offset, count, true);
    }
}
