package com.questrail.sockets.websocket.framing.impl;

/**
 * FrameHeader
 * -----------------------------------------------------------------------------
 * Bit layout of the RFC 6455 §5.2 base header.
 *
 * <pre>
 *   byte 0 : FIN | RSV1 | RSV2 | RSV3 | opcode (4 bits)
 *   byte 1 : MASK | payload length (7 bits)
 *   then   : extended length (0, 2 or 8 bytes), masking key (0 or 4 bytes)
 * </pre>
 */
final class FrameHeader
{
    static final int FIN = 0x80;
    static final int RSV_MASK = 0x70;
    static final int OPCODE_MASK = 0x0F;

    static final int MASK = 0x80;
    static final int LENGTH_MASK = 0x7F;

    /** Largest length that fits the 7-bit field. Also the control-frame payload limit. */
    static final int MAX_SHORT_LENGTH = 125;

    /** 7-bit marker: a 16-bit length follows. */
    static final int LENGTH_16 = 126;

    /** 7-bit marker: a 64-bit length follows. */
    static final int LENGTH_64 = 127;

    static final int MASKING_KEY_LENGTH = 4;

    private FrameHeader() {}

    /**
     * Bytes taken by the extended length field for {@code payloadLength}.
     */
    static int extendedLengthBytes(int payloadLength)
    {
        if (payloadLength <= MAX_SHORT_LENGTH) {
            return 0;
        }
        return (payloadLength <= 0xFFFF) ? 2 : 8;
    }

    /**
     * XOR {@code count} bytes of {@code data} from {@code offset} with the key, in place.
     */
    static void mask(byte[] data, int offset, int count, byte[] key)
    {
        for (int i = 0; i < count; i++) {
            data[offset + i] ^= key[i % MASKING_KEY_LENGTH];
        }
    }
}
