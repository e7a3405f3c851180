package redislite.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import redislite.protocol.Message;
import redislite.protocol.RespSerializer;

/**
 * Encodes {@link Message}s into RESP format.
 */
public class RespMessageEncoder extends MessageToByteEncoder<Message> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Message msg, ByteBuf out) throws Exception {
        new RespSerializer(new ByteBufOutputStream(out)).serialize(msg);
    }
}
