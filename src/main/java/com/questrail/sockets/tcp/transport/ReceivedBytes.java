package com.questrail.sockets.tcp.transport;

/**
 * ReceivedBytes
 * -----------------------------------------------------------------------------
 * Read-once view over a chunk of inbound bytes.
 *
 * <p>Transport buffers never leave the transport package; listeners copy
 * what they need into their own arrays.</p>
 */
public interface ReceivedBytes
{
    /**
     * Bytes not yet consumed.
     */
    int readableBytes();

    /**
     * Consume {@code length} bytes into {@code destination} at {@code offset}.
     *
     * @throws IndexOutOfBoundsException if fewer than {@code length} bytes
     *         remain or the destination range is invalid
     */
    void readBytes(byte[] destination, int offset, int length);
}
