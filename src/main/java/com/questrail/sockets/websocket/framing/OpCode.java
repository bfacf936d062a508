package com.questrail.sockets.websocket.framing;

/**
 * Frame opcodes (RFC 6455 §5.2).
 */
public enum OpCode
{
    CONTINUATION(0x0),
    TEXT(0x1),
    BINARY(0x2),
    CLOSE(0x8),
    PING(0x9),
    PONG(0xA);

    private final int code;

    OpCode(int code)
    {
        this.code = code;
    }

    /**
     * The 4-bit wire value.
     */
    public int code()
    {
        return code;
    }

    /**
     * Control frames (close, ping, pong) may not be fragmented.
     */
    public boolean isControl()
    {
        return (code & 0x8) != 0;
    }

    /**
     * @throws IllegalArgumentException if {@code code} is reserved or out of range
     */
    public static OpCode fromCode(int code)
    {
        for (OpCode opCode : values()) {
            if (opCode.code == code) {
                return opCode;
            }
        }
        throw new IllegalArgumentException("Unknown opcode: 0x" + Integer.toHexString(code));
    }
}
