package com.questrail.sockets.websocket.framing;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Fragmentation
 * -----------------------------------------------------------------------------
 * One logical message, pre-split by the caller, exposed as the ordered frames
 * that carry it.
 *
 * <p>The first fragment is framed with the message's data opcode and every
 * later fragment with {@link OpCode#CONTINUATION}. Only the last frame is
 * marked final. Frames are encoded lazily, one per {@code next()}, and every
 * call to {@link #iterator()} starts over from the first fragment.</p>
 *
 * @param <F> fragment type
 */
public abstract class Fragmentation<F> implements Iterable<byte[]>
{
    private final OpCode firstOpCode;
    private final List<F> fragments;
    private final FrameEncoder encoder;

    protected Fragmentation(OpCode firstOpCode, List<F> fragments, FrameEncoder encoder)
    {
        if (fragments == null) {
            throw new IllegalArgumentException("fragments must not be null");
        }
        for (F fragment : fragments) {
            if (fragment == null) {
                throw new IllegalArgumentException("fragments must not contain null elements");
            }
        }
        this.firstOpCode = Objects.requireNonNull(firstOpCode, "firstOpCode");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.fragments = List.copyOf(fragments);
    }

    /**
     * Payload bytes carried by one fragment.
     */
    protected abstract byte[] toBytes(F fragment);

    public int size()
    {
        return fragments.size();
    }

    public List<F> fragments()
    {
        return fragments;
    }

    /**
     * Opcode of the frame at {@code index}.
     */
    public OpCode opCodeAt(int index)
    {
        Objects.checkIndex(index, fragments.size());
        return (index == 0) ? firstOpCode : OpCode.CONTINUATION;
    }

    @Override
    public Iterator<byte[]> iterator()
    {
        return new Iterator<>()
        {
            private int next;

            @Override
            public boolean hasNext()
            {
                return next < fragments.size();
            }

            @Override
            public byte[] next()
            {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int index = next++;
                byte[] payload = toBytes(fragments.get(index));
                boolean fin = (index == fragments.size() - 1);
                return encoder.encode(opCodeAt(index), payload, 0, payload.length, fin);
            }
        };
    }
}
