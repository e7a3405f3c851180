package redislite.network;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.util.ReferenceCountUtil;
import redislite.commands.CommandRegistry;
import redislite.db.Store;
import redislite.protocol.Message;
import redislite.protocol.RespException;
import redislite.utils.Log;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request/response loop of one connection. Sits behind RespFrameDecoder and
 * RespMessageEncoder; one instance per channel.
 *
 * <p>The loop is half-duplex: auto-read is off from the moment a response is handed to
 * the encoder until it has been written, so the socket is not read for the next
 * request while a reply is in flight. Frames the decoder had already buffered (pipelined
 * requests) are queued and dispatched one by one as each write completes.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {

    public enum State {
        READING,
        DISPATCHING,
        WRITING,
        CLOSED
    }

    private static final AtomicLong ids = new AtomicLong(0);

    private final long id = ids.incrementAndGet();
    private final CommandRegistry commands;
    private final Store store;
    private final ConnectionRegistry connections;
    private volatile State state = State.READING;
    private ChannelHandlerContext ctx;
    private long requestCount = 0;
    // Only touched on the channel's event loop
    private final ArrayDeque<Message> queued = new ArrayDeque<>();

    public ClientHandler(CommandRegistry commands, Store store, ConnectionRegistry connections) {
        this.commands = commands;
        this.store = store;
        this.connections = connections;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.ctx = ctx;
        if (connections != null && !connections.register(ctx.channel(), this)) {
            Log.debug("Rejecting client " + getRemoteAddress() + ": server is stopping");
            ctx.close();
            return;
        }
        Log.debug("Client #" + id + " connected: " + getRemoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        state = State.CLOSED;
        queued.clear();
        if (connections != null) connections.deregister(ctx.channel());
        Log.debug("Client #" + id + " disconnected: " + getRemoteAddress() + " after " + requestCount + " requests");
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof Message)) {
            ReferenceCountUtil.release(msg);
            return;
        }
        if (state == State.CLOSED) return;
        if (state == State.WRITING) {
            queued.add((Message) msg);
            return;
        }
        handle(ctx, (Message) msg);
    }

    private void handle(ChannelHandlerContext ctx, Message request) {
        state = State.DISPATCHING;
        requestCount++;
        Message response;
        try {
            response = processCommand(request);
        } catch (RuntimeException e) {
            Log.error("Command failed on client #" + id + ", closing connection", e);
            closeNow(ctx);
            return;
        }

        state = State.WRITING;
        ctx.channel().config().setAutoRead(false);
        ctx.writeAndFlush(response).addListener((ChannelFuture f) -> {
            if (!f.isSuccess()) {
                Log.warn("Write to client #" + id + " failed: " + describe(f.cause()));
                closeNow(ctx);
                return;
            }
            if (state != State.WRITING) return;
            Message next = queued.poll();
            if (next != null) {
                handle(ctx, next);
            } else {
                state = State.READING;
                f.channel().config().setAutoRead(true);
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        if (root instanceof RespException) {
            Log.warn("Malformed request from client #" + id + " (" + getRemoteAddress() + "): " + root.getMessage());
        } else if (root instanceof java.io.IOException) {
            Log.debug("I/O error on client #" + id + ": " + root.getMessage());
        } else {
            Log.error("Unexpected failure on client #" + id + ", closing connection", root);
        }
        closeNow(ctx);
    }

    /**
     * Validates the request shape and dispatches it. Never throws for a protocol problem;
     * those come back as error replies.
     */
    public Message processCommand(Message request) {
        if (request.getType() != Message.Type.ARRAY) {
            return Message.error("ERR Protocol error: expected array");
        }
        if (request.isNull()) {
            return Message.error("ERR Protocol error: null array");
        }

        List<Message> parts = request.asArray();
        if (parts.isEmpty()) {
            return Message.error("ERR Protocol error: empty array");
        }

        Message nameMsg = parts.get(0);
        if (nameMsg.getType() != Message.Type.BULK_STRING && nameMsg.getType() != Message.Type.SIMPLE_STRING) {
            return Message.error("ERR Protocol error: command name must be a string");
        }
        if (nameMsg.isNull()) {
            return Message.error("ERR Protocol error: null command name");
        }

        String cmd = nameMsg.asString().toUpperCase(Locale.ROOT);
        List<Message> args = parts.subList(1, parts.size());

        if (Log.isDebugEnabled()) {
            Log.debug("Client #" + id + " -> " + cmd + " (" + args.size() + " args)");
        }
        return commands.dispatch(cmd, args, store);
    }

    public long getId() {
        return id;
    }

    public State getState() {
        return state;
    }

    public String getRemoteAddress() {
        if (ctx != null && ctx.channel().remoteAddress() != null) {
            return ctx.channel().remoteAddress().toString();
        }
        return "0.0.0.0:0";
    }

    public void close() {
        if (ctx != null) ctx.close();
    }

    private void closeNow(ChannelHandlerContext ctx) {
        state = State.CLOSED;
        queued.clear();
        ctx.close();
    }

    private static String describe(Throwable t) {
        Throwable root = t.getCause() != null ? t.getCause() : t;
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
