package com.questrail.sockets.buffer;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * GrowingByteBufferManager
 * -----------------------------------------------------------------------------
 * {@link BufferManager} that preallocates a fixed number of equally sized
 * buffers and allocates a new one whenever a borrow finds the pool empty.
 *
 * <p>The pool never shrinks: every buffer that is returned stays available
 * for reuse.</p>
 */
public final class GrowingByteBufferManager implements BufferManager
{
    private final int bufferSize;
    private final Queue<byte[]> available = new ConcurrentLinkedQueue<>();
    private final AtomicInteger allocated = new AtomicInteger();

    public GrowingByteBufferManager(int initialBufferCount, int bufferSize)
    {
        if (initialBufferCount < 0) {
            throw new IllegalArgumentException("initialBufferCount must be >= 0");
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be > 0");
        }
        this.bufferSize = bufferSize;

        for (int i = 0; i < initialBufferCount; i++) {
            available.add(allocate());
        }
    }

    @Override
    public byte[] borrowBuffer()
    {
        byte[] buffer = available.poll();
        return (buffer != null) ? buffer : allocate();
    }

    @Override
    public void returnBuffer(byte[] buffer)
    {
        Objects.requireNonNull(buffer, "buffer");
        if (buffer.length != bufferSize) {
            throw new IllegalArgumentException(
                    "Buffer of " + buffer.length + " bytes does not belong to a pool of " + bufferSize + "-byte buffers");
        }
        available.add(buffer);
    }

    @Override
    public int bufferSize()
    {
        return bufferSize;
    }

    /**
     * Number of buffers currently sitting in the pool.
     */
    public int availableBuffers()
    {
        return available.size();
    }

    /**
     * Number of buffers this pool has ever allocated.
     */
    public int totalBuffers()
    {
        return allocated.get();
    }

    private byte[] allocate()
    {
        allocated.incrementAndGet();
        return new byte[bufferSize];
    }
}
