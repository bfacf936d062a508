package com.questrail.sockets.tcp.transport.netty;

import com.questrail.sockets.tcp.transport.ReceivedBytes;
import com.questrail.sockets.tcp.transport.StreamConnection;
import com.questrail.sockets.tcp.transport.StreamConnectionListener;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.ReferenceCountUtil;

import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyStreamConnection
 * -----------------------------------------------------------------------------
 * {@link StreamConnection} over one accepted Netty {@link Channel}.
 *
 * <p>Inbound {@link ByteBuf}s are exposed through {@link ReceivedBytes} for the
 * duration of the listener callback and released afterwards.</p>
 *
 * <p>Netty queues each {@code writeAndFlush} as a single message on the
 * channel's outbound buffer, which gives the no-interleaving guarantee of the
 * port.</p>
 */
final class NettyStreamConnection implements StreamConnection
{
    private final Channel channel;
    private final Duration receiveTimeout;

    private volatile StreamConnectionListener listener;
    private volatile Throwable failure;

    NettyStreamConnection(Channel channel, Duration receiveTimeout)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.receiveTimeout = receiveTimeout;

        if (!receiveTimeout.isZero()) {
            channel.pipeline().addLast(new ReadTimeoutHandler(receiveTimeout.toMillis(), TimeUnit.MILLISECONDS));
        }
        channel.pipeline().addLast(new InboundHandler());
    }

    @Override
    public void startReading(StreamConnectionListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        synchronized (this) {
            if (this.listener != null) {
                throw new IllegalStateException("Reading has already been started");
            }
            this.listener = listener;
        }

        // Fires immediately when the channel is already closed.
        channel.closeFuture().addListener(f -> listener.onClosed(failure));
        channel.config().setAutoRead(true);
    }

    @Override
    public CompletableFuture<Void> write(byte[] data, int offset, int count)
    {
        Objects.checkFromIndexSize(offset, count, data.length);

        CompletableFuture<Void> result = new CompletableFuture<>();
        ByteBuf buf = Unpooled.copiedBuffer(data, offset, count);
        channel.writeAndFlush(buf).addListener((ChannelFutureListener) f -> bridge(f, result));
        return result;
    }

    @Override
    public CompletableFuture<Void> close()
    {
        CompletableFuture<Void> result = new CompletableFuture<>();
        channel.close().addListener((ChannelFutureListener) f -> bridge(f, result));
        return result;
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public SocketAddress localAddress()
    {
        return channel.localAddress();
    }

    @Override
    public String toString()
    {
        return "NettyStreamConnection[" + channel.remoteAddress() + " -> " + channel.localAddress() + ']';
    }

    private static void bridge(ChannelFuture future, CompletableFuture<Void> result)
    {
        if (future.isSuccess()) {
            result.complete(null);
        } else {
            result.completeExceptionally(future.cause());
        }
    }

    private Throwable translate(Throwable cause)
    {
        if (cause instanceof ReadTimeoutException) {
            return new TimeoutException("No data received for " + receiveTimeout.toMillis() + " ms");
        }
        if (cause instanceof IOException) {
            return cause;
        }
        return new IOException(cause.getMessage(), cause);
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards inbound buffers to the installed listener and records the first
     * failure so that it can be reported on close.
     */
    private final class InboundHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            StreamConnectionListener l = listener;
            try {
                if (l != null && msg instanceof ByteBuf) {
                    l.onReceived(new ByteBufReceivedBytes((ByteBuf) msg));
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (failure == null) {
                failure = translate(cause);
            }
            ctx.close();
        }
    }

    private static final class ByteBufReceivedBytes implements ReceivedBytes
    {
        private final ByteBuf buf;

        private ByteBufReceivedBytes(ByteBuf buf)
        {
            this.buf = buf;
        }

        @Override
        public int readableBytes()
        {
            return buf.readableBytes();
        }

        @Override
        public void readBytes(byte[] destination, int offset, int length)
        {
            buf.readBytes(destination, offset, length);
        }
    }
}
