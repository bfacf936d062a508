package com.questrail.sockets.websocket.framing.impl;

import com.questrail.sockets.websocket.framing.Frame;
import com.questrail.sockets.websocket.framing.FrameDecoder;
import com.questrail.sockets.websocket.framing.OpCode;

import java.util.Arrays;
import java.util.Optional;

/**
 * DefaultFrameDecoder
 * -----------------------------------------------------------------------------
 * RFC 6455 implementation of {@link FrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Base header: FIN, reserved bits, opcode (§5.2)</li>
 *   <li>Payload length: 7-bit, 16-bit or 64-bit form</li>
 *   <li>Masking key, when the MASK bit is set, and unmasking (§5.3)</li>
 *   <li>Control-frame rules: final and at most 125 bytes (§5.5)</li>
 * </ol>
 *
 * <p>Masked and unmasked frames are both accepted. No extension is
 * negotiated, so any reserved bit is a framing defect.</p>
 */
public final class DefaultFrameDecoder implements FrameDecoder
{
    @Override
    public Optional<Frame> decode(byte[] wire)
    {
        try {
            return Optional.of(parse(wire));
        }
        catch (FrameFormatException e) {
            // Framing defect → drop frame
            return Optional.empty();
        }
    }

    private static Frame parse(byte[] wire)
            throws FrameFormatException
    {
        if (wire == null || wire.length < 2) {
            throw new FrameFormatException("Frame too short for a header");
        }
        int r = 0;

        // 1) Base header
        final int b0 = wire[r++] & 0xFF;
        if ((b0 & FrameHeader.RSV_MASK) != 0) {
            throw new FrameFormatException("Reserved bits set without a negotiated extension");
        }
        final boolean fin = (b0 & FrameHeader.FIN) != 0;
        final OpCode opCode;
        try {
            opCode = OpCode.fromCode(b0 & FrameHeader.OPCODE_MASK);
        }
        catch (IllegalArgumentException e) {
            throw new FrameFormatException(e.getMessage());
        }

        // 2) Payload length
        final int b1 = wire[r++] & 0xFF;
        final boolean masked = (b1 & FrameHeader.MASK) != 0;
        final int shortLength = b1 & FrameHeader.LENGTH_MASK;

        final long length;
        if (shortLength == FrameHeader.LENGTH_16) {
            require(wire, r, 2);
            length = ((wire[r] & 0xFF) << 8) | (wire[r + 1] & 0xFF);
            r += 2;
        }
        else if (shortLength == FrameHeader.LENGTH_64) {
            require(wire, r, 8);
            long value = 0;
            for (int i = 0; i < 8; i++) {
                value = (value << 8) | (wire[r + i] & 0xFF);
            }
            r += 8;
            if (value < 0) {
                throw new FrameFormatException("Most significant length bit must be zero");
            }
            length = value;
        }
        else {
            length = shortLength;
        }

        if (opCode.isControl() && (!fin || length > FrameHeader.MAX_SHORT_LENGTH)) {
            throw new FrameFormatException("Control frame fragmented or longer than 125 bytes");
        }

        // 3) Masking key
        byte[] key = null;
        if (masked) {
            require(wire, r, FrameHeader.MASKING_KEY_LENGTH);
            key = Arrays.copyOfRange(wire, r, r + FrameHeader.MASKING_KEY_LENGTH);
            r += FrameHeader.MASKING_KEY_LENGTH;
        }

        // 4) Payload: exactly the rest of the input
        if (length != wire.length - r) {
            throw new FrameFormatException("Payload length " + length
                    + " does not match the " + (wire.length - r) + " bytes remaining");
        }
        final byte[] payload = Arrays.copyOfRange(wire, r, wire.length);
        if (key != null) {
            FrameHeader.mask(payload, 0, payload.length, key);
        }
        return new Frame(opCode, fin, payload);
    }

    private static void require(byte[] wire, int from, int count)
            throws FrameFormatException
    {
        if (wire.length - from < count) {
            throw new FrameFormatException("Truncated frame header");
        }
    }
}
