package lodestore.network;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import lodestore.server.RequestProcessor;
import lodestore.utils.Log;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP front end. Accepts any number of connections and gives each its own decoder,
 * encoder and {@link ClientHandler}.
 */
public class LodestoreServer {
    private final RequestProcessor processor;
    private final long maxBulkLength;
    private final AtomicInteger activeConnections = new AtomicInteger(0);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public LodestoreServer(RequestProcessor processor, long maxBulkLength) {
        this.processor = processor;
        this.maxBulkLength = maxBulkLength;
    }

    ChannelInitializer<SocketChannel> initializer() {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            public void initChannel(SocketChannel ch) {
                ch.pipeline().addLast(new NettyRespDecoder(maxBulkLength));
                ch.pipeline().addLast(new NettyRespEncoder());
                ch.pipeline().addLast(new ClientHandler(processor, activeConnections));
            }
        };
    }

    /**
     * Binds and starts accepting. Port 0 picks a free port.
     *
     * @return the bound port
     */
    public int start(int port) throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childHandler(initializer());

            serverChannel = b.bind(port).sync().channel();
        } catch (Exception e) {
            // sync() rethrows bind failures such as BindException undeclared; the event loops must not outlive them
            Log.error("Failed to bind port " + port + ": " + e);
            stop();
            throw e;
        }
        int boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        Log.info("Ready on port " + boundPort);
        return boundPort;
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    boolean isStopped() {
        return bossGroup == null || (bossGroup.isTerminated() && workerGroup.isTerminated());
    }

    public void stop() {
        Log.info("Closing listener (" + activeConnections.get() + " connections open)");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) bossGroup.shutdownGracefully().syncUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully().syncUninterruptibly();
    }
}
