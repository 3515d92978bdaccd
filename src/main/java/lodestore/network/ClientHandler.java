package lodestore.network;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import lodestore.protocol.ProtocolException;
import lodestore.protocol.RespValue;
import lodestore.server.RequestProcessor;
import lodestore.utils.Log;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One per connection. Requests arrive in order on the channel's event loop and each reply is
 * written before the next request is read off the pipeline.
 */
public class ClientHandler extends SimpleChannelInboundHandler<RespValue> {
    private final RequestProcessor processor;
    private final AtomicInteger activeConnections;

    public ClientHandler(RequestProcessor processor, AtomicInteger activeConnections) {
        this.processor = processor;
        this.activeConnections = activeConnections;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int active = activeConnections.incrementAndGet();
        Log.debug("Client connected " + ctx.channel().remoteAddress() + " (" + active + " active)");
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int active = activeConnections.decrementAndGet();
        Log.debug("Client disconnected " + ctx.channel().remoteAddress() + " (" + active + " active)");
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RespValue request) {
        ctx.writeAndFlush(processor.process(request));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        if (root instanceof ProtocolException) {
            Log.debug("Closing " + ctx.channel().remoteAddress() + ": " + root.getMessage());
            String message = root.getMessage().startsWith("Protocol error") ? root.getMessage() : "Protocol error: " + root.getMessage();
            ctx.writeAndFlush(RespValue.error("ERR " + message)).addListener(ChannelFutureListener.CLOSE);
        } else if (root instanceof IOException) {
            // connection reset and friends
            Log.debug("Connection error " + ctx.channel().remoteAddress() + ": " + root.getMessage());
            ctx.close();
        } else {
            Log.error("Unexpected error on " + ctx.channel().remoteAddress(), root);
            ctx.close();
        }
    }
}
