package com.questrail.sockets.websocket.framing;

import java.util.Optional;

/**
 * FrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for a single wire frame.
 *
 * <p>The input is treated as exactly one complete frame. Accumulation across
 * calls is not supported.</p>
 */
public interface FrameDecoder
{
    /**
     * @param wire bytes of exactly one frame
     * @return the decoded frame, or {@link Optional#empty()} if the bytes are
     *         truncated, carry trailing data, or violate framing rules
     */
    Optional<Frame> decode(byte[] wire);
}
