package com.questrail.sockets.websocket.framing;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A text message pre-split into string fragments.
 *
 * <p>Fragments are encoded as UTF-8. The caller chooses the split points; a
 * split inside a surrogate pair produces invalid UTF-8 on the wire.</p>
 */
public final class TextFragmentation extends Fragmentation<String>
{
    /**
     * @throws IllegalArgumentException if {@code fragments} is null or holds a null element
     */
    public TextFragmentation(List<String> fragments, FrameEncoder encoder)
    {
        super(OpCode.TEXT, fragments, encoder);
    }

    @Override
    protected byte[] toBytes(String fragment)
    {
        return fragment.getBytes(StandardCharsets.UTF_8);
    }
}
