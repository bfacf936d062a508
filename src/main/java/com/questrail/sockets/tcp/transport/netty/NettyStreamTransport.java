package com.questrail.sockets.tcp.transport.netty;

import com.questrail.sockets.tcp.transport.ConnectionOptions;
import com.questrail.sockets.tcp.transport.ListenerOptions;
import com.questrail.sockets.tcp.transport.StreamListener;
import com.questrail.sockets.tcp.transport.StreamTransport;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyStreamTransport
 * =============================================================================
 * Netty-backed implementation of the {@link StreamTransport} port.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Threading</h2>
 * One boss event loop accepts sockets; a worker group (Netty's default size)
 * runs all connection I/O. Both groups live until {@link #shutdown()}.
 *
 * <h2>Accept hand-off</h2>
 * Accepted channels start with {@code AUTO_READ} disabled and are parked in the
 * listener's pending queue. Reading starts only when the claimer installs its
 * listener, so no byte is read before somebody is ready to receive it.
 */
public final class NettyStreamTransport implements StreamTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyStreamTransport.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ConnectionOptions connectionOptions;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public NettyStreamTransport(ConnectionOptions connectionOptions)
    {
        this.connectionOptions = Objects.requireNonNull(connectionOptions, "connectionOptions");
        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("sockets-accept", true));
        this.workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("sockets-io", true));
    }

    @Override
    public StreamListener listen(InetSocketAddress endPoint, ListenerOptions options) throws IOException
    {
        Objects.requireNonNull(endPoint, "endPoint");
        Objects.requireNonNull(options, "options");

        if (shutdown.get()) {
            throw new IOException("Transport has been shut down");
        }

        if (options.allowNatTraversal()) {
            // The JVM exposes no socket option for this; accepted for compatibility.
            log.debug("NAT traversal requested for {}; no platform socket option applies", endPoint);
        }

        NettyStreamListener listener = new NettyStreamListener();

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, options.backlog())
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.TCP_NODELAY, connectionOptions.noDelay())
                .childOption(ChannelOption.SO_KEEPALIVE, connectionOptions.keepAlive())
                .childOption(ChannelOption.RCVBUF_ALLOCATOR,
                        new FixedRecvByteBufAllocator(connectionOptions.receiveBufferSize()))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        listener.offer(new NettyStreamConnection(ch, connectionOptions.receiveTimeout()));
                    }
                });

        ChannelFuture bound = bootstrap.bind(endPoint).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            Throwable cause = bound.cause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Failed to bind " + endPoint, cause);
        }

        listener.bound(bound.channel());
        return listener;
    }

    @Override
    public void shutdown()
    {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }

        bossGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .awaitUninterruptibly(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .awaitUninterruptibly(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
}
