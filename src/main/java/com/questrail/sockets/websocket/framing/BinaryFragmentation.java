package com.questrail.sockets.websocket.framing;

import java.util.List;

/**
 * A binary message pre-split into byte-array fragments.
 *
 * <p>Fragment arrays are referenced, not copied; callers must not mutate them
 * while the fragmentation is in use.</p>
 */
public final class BinaryFragmentation extends Fragmentation<byte[]>
{
    public BinaryFragmentation(List<byte[]> fragments, FrameEncoder encoder)
    {
        super(OpCode.BINARY, fragments, encoder);
    }

    @Override
    protected byte[] toBytes(byte[] fragment)
    {
        return fragment;
    }
}
