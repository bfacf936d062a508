package com.questrail.sockets.buffer;

/**
 * BufferManager
 * -----------------------------------------------------------------------------
 * Pool of reusable receive buffers shared by every session of a server.
 *
 * <p>Implementations must be safe for concurrent borrow/return from any
 * number of I/O threads. Sizing and growth are entirely the pool's concern;
 * callers only rely on {@link #bufferSize()} to know how many bytes a single
 * borrowed buffer can hold.</p>
 */
public interface BufferManager
{
    /**
     * Borrow a buffer of {@link #bufferSize()} bytes. Never blocks; a pool
     * that has run dry allocates.
     */
    byte[] borrowBuffer();

    /**
     * Give a previously borrowed buffer back to the pool.
     *
     * <p>The caller must not touch the buffer afterwards.</p>
     *
     * @throws IllegalArgumentException if the buffer was not produced by this pool
     */
    void returnBuffer(byte[] buffer);

    /**
     * Size in bytes of every buffer handed out by this pool.
     */
    int bufferSize();
}
