package org.muma.xredis.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.util.concurrent.Future;
import org.muma.xredis.command.CommandDispatcher;
import org.muma.xredis.common.RedisError;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.protocol.RespCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每次读到的字节当作一个完整请求交给分发器，回复原样写回。
 * 不在 I/O 线程上等待引擎：回复在 Future 完成后由监听器写出。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 所有连接共享
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        // SimpleChannelInboundHandler 会释放 msg，先拷出来
        byte[] request = ByteBufUtil.getBytes(msg);

        Future<RedisMessage> reply = dispatcher.dispatch(request);
        reply.addListener(f -> {
            RedisMessage response;
            if (f.isSuccess()) {
                response = reply.getNow();
            } else {
                log.error("Request failed on {}", ctx.channel().remoteAddress(), f.cause());
                response = RedisError.INTERNAL.toMessage();
            }
            ctx.writeAndFlush(Unpooled.wrappedBuffer(RespCodec.encode(response)));
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Connection error on {}, closing", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    static int connectedClients() {
        return connectedClients.get();
    }
}
