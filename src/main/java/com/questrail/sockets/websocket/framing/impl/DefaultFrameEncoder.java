package com.questrail.sockets.websocket.framing.impl;

import com.questrail.sockets.websocket.framing.FrameEncoder;
import com.questrail.sockets.websocket.framing.OpCode;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * DefaultFrameEncoder
 * -----------------------------------------------------------------------------
 * RFC 6455 implementation of {@link FrameEncoder}.
 *
 * <p>Server-to-client frames are sent unmasked ({@link #unmasked()}).
 * Client-to-server frames must be masked ({@link #masked()}); a fresh 32-bit
 * key is drawn for every frame.</p>
 */
public final class DefaultFrameEncoder implements FrameEncoder
{
    private final SecureRandom maskSource;

    private DefaultFrameEncoder(SecureRandom maskSource)
    {
        this.maskSource = maskSource;
    }

    public static DefaultFrameEncoder unmasked()
    {
        return new DefaultFrameEncoder(null);
    }

    public static DefaultFrameEncoder masked()
    {
        return new DefaultFrameEncoder(new SecureRandom());
    }

    public static DefaultFrameEncoder masked(SecureRandom maskSource)
    {
        return new DefaultFrameEncoder(Objects.requireNonNull(maskSource, "maskSource"));
    }

    public boolean isMasking()
    {
        return maskSource != null;
    }

    @Override
    public byte[] encode(OpCode opCode, byte[] payload, int offset, int count, boolean fin)
    {
        Objects.requireNonNull(opCode, "opCode");
        Objects.requireNonNull(payload, "payload");
        Objects.checkFromIndexSize(offset, count, payload.length);

        if (opCode.isControl()) {
            if (!fin) {
                throw new IllegalArgumentException("Control frames must not be fragmented: " + opCode);
            }
            if (count > FrameHeader.MAX_SHORT_LENGTH) {
                throw new IllegalArgumentException("Control frame payload exceeds 125 bytes: " + count);
            }
        }

        final int extended = FrameHeader.extendedLengthBytes(count);
        final int keyLength = isMasking() ? FrameHeader.MASKING_KEY_LENGTH : 0;
        final byte[] frame = new byte[2 + extended + keyLength + count];
        int w = 0;

        // ---------------------------------------------------------------------
        // 1) FIN, RSV (always zero), opcode
        // ---------------------------------------------------------------------

        frame[w++] = (byte) ((fin ? FrameHeader.FIN : 0) | opCode.code());

        // ---------------------------------------------------------------------
        // 2) MASK bit and payload length
        // ---------------------------------------------------------------------

        final int maskBit = isMasking() ? FrameHeader.MASK : 0;
        if (extended == 0) {
            frame[w++] = (byte) (maskBit | count);
        }
        else if (extended == 2) {
            frame[w++] = (byte) (maskBit | FrameHeader.LENGTH_16);
            frame[w++] = (byte) (count >>> 8);
            frame[w++] = (byte) count;
        }
        else {
            frame[w++] = (byte) (maskBit | FrameHeader.LENGTH_64);
            long length = count;
            for (int shift = 56; shift >= 0; shift -= 8) {
                frame[w++] = (byte) (length >>> shift);
            }
        }

        // ---------------------------------------------------------------------
        // 3) Masking key and payload
        // ---------------------------------------------------------------------

        byte[] key = null;
        if (isMasking()) {
            key = new byte[FrameHeader.MASKING_KEY_LENGTH];
            maskSource.nextBytes(key);
            System.arraycopy(key, 0, frame, w, key.length);
            w += key.length;
        }

        System.arraycopy(payload, offset, frame, w, count);
        if (key != null) {
            FrameHeader.mask(frame, w, count, key);
        }
        return frame;
    }
}
