package lodestore.network;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lodestore.protocol.Resp;
import lodestore.protocol.RespValue;

/**
 * Encodes reply values into RESP.
 */
public class NettyRespEncoder extends MessageToByteEncoder<RespValue> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RespValue msg, ByteBuf out) throws Exception {
        out.writeBytes(Resp.encode(msg));
    }
}
