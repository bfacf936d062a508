package com.questrail.sockets.tcp.transport.netty;

import com.questrail.sockets.tcp.transport.PendingConnectionQueue;
import com.questrail.sockets.tcp.transport.StreamConnection;
import com.questrail.sockets.tcp.transport.StreamListener;

import io.netty.channel.Channel;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * Listening endpoint backed by a bound Netty server channel.
 */
final class NettyStreamListener implements StreamListener
{
    private final PendingConnectionQueue<NettyStreamConnection> pending = new PendingConnectionQueue<>();

    private volatile Channel serverChannel;

    void bound(Channel serverChannel)
    {
        this.serverChannel = serverChannel;
    }

    /**
     * Called on the child event loop for every accepted channel.
     */
    void offer(NettyStreamConnection connection)
    {
        pending.offer(connection);
    }

    @Override
    public CompletableFuture<StreamConnection> accept()
    {
        return pending.claim();
    }

    @Override
    public boolean pending()
    {
        return pending.hasPending();
    }

    @Override
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return (ch == null) ? null : (InetSocketAddress) ch.localAddress();
    }

    @Override
    public void close()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        pending.close();
    }
}
