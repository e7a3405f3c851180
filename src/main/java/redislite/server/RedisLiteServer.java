package redislite.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import redislite.Config;
import redislite.commands.CommandRegistry;
import redislite.db.MemoryStore;
import redislite.db.Store;
import redislite.network.ClientHandler;
import redislite.network.ConnectionRegistry;
import redislite.protocol.netty.RespFrameDecoder;
import redislite.protocol.netty.RespMessageEncoder;
import redislite.utils.Log;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Listening server. STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED.
 *
 * <p>Every accepted channel gets its own {@link ClientHandler}, tracked in a
 * {@link ConnectionRegistry}. {@link #stop()} force-closes them all; it does not drain.
 */
public class RedisLiteServer {

    private static final long CLOSE_WAIT_MS = 2000;

    private final Config config;
    private final CommandRegistry commands;
    private final Store store;

    private volatile ServerState state = ServerState.STOPPED;
    private ConnectionRegistry connections = new ConnectionRegistry();
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private CountDownLatch terminated = new CountDownLatch(0);

    public RedisLiteServer(Config config, CommandRegistry commands, Store store) {
        this.config = config;
        this.commands = commands;
        this.store = store;
    }

    public RedisLiteServer(Config config) {
        this(config, CommandRegistry.withDefaults(), new MemoryStore());
    }

    public RedisLiteServer(String host, int port) {
        this(new Config(host, port));
    }

    /**
     * Binds the configured address and starts accepting. Returns once the socket is bound.
     */
    public synchronized void start() throws ServerStartException {
        if (state != ServerState.STOPPED) {
            throw new IllegalStateException("Server is " + state);
        }
        state = ServerState.STARTING;

        final ConnectionRegistry registry = new ConnectionRegistry();
        EventLoopGroup boss = new NioEventLoopGroup(1);
        EventLoopGroup workers = new NioEventLoopGroup(config.workerThreads);

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, workers)
         .channel(NioServerSocketChannel.class)
         .childOption(ChannelOption.TCP_NODELAY, true)
         .childHandler(new ChannelInitializer<SocketChannel>() {
             @Override
             public void initChannel(SocketChannel ch) throws Exception {
                 ch.pipeline().addLast("decoder", new RespFrameDecoder());
                 ch.pipeline().addLast("encoder", new RespMessageEncoder());
                 ch.pipeline().addLast("handler", new ClientHandler(commands, store, registry));
             }
         });

        ChannelFuture f;
        try {
            f = b.bind(config.host, config.port).awaitUninterruptibly();
        } catch (RuntimeException e) {
            // e.g. an unresolvable host rejected before the bind is attempted
            shutdownGroups(boss, workers);
            state = ServerState.STOPPED;
            throw new ServerStartException("Failed to bind " + config.host + ":" + config.port + ": " + e.getMessage(), e);
        }
        if (!f.isSuccess()) {
            shutdownGroups(boss, workers);
            state = ServerState.STOPPED;
            Throwable cause = f.cause();
            throw new ServerStartException("Failed to bind " + config.host + ":" + config.port + ": " + cause.getMessage(), cause);
        }

        this.connections = registry;
        this.bossGroup = boss;
        this.workerGroup = workers;
        this.serverChannel = f.channel();
        this.terminated = new CountDownLatch(1);
        state = ServerState.RUNNING;
        Log.info("Ready on " + config.host + ":" + getPort() + " (" + commands.size() + " commands)");
    }

    /**
     * Force-closes every tracked connection, then the listening socket. No-op unless RUNNING.
     */
    public synchronized void stop() {
        if (state != ServerState.RUNNING) {
            return;
        }
        state = ServerState.STOPPING;
        Log.info("Shutting down, closing " + connections.size() + " connections...");

        List<ChannelFuture> closing = connections.closeAll();
        for (ChannelFuture cf : closing) {
            if (!cf.awaitUninterruptibly(CLOSE_WAIT_MS)) {
                Log.warn("Connection " + cf.channel().remoteAddress() + " did not close in time");
            }
        }

        if (!serverChannel.close().awaitUninterruptibly(CLOSE_WAIT_MS)) {
            Log.warn("Listening socket did not close in time");
        }
        shutdownGroups(bossGroup, workerGroup);

        serverChannel = null;
        bossGroup = null;
        workerGroup = null;
        state = ServerState.STOPPED;
        terminated.countDown();
        Log.info("Server stopped");
    }

    /**
     * Blocks until {@link #stop()} has completed. Returns immediately if not running.
     */
    public void awaitTermination() throws InterruptedException {
        CountDownLatch latch;
        synchronized (this) {
            latch = terminated;
        }
        latch.await();
    }

    public ServerState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == ServerState.RUNNING;
    }

    /**
     * Bound port while running (useful when configured with port 0), else the configured port.
     */
    public synchronized int getPort() {
        if (serverChannel != null && serverChannel.localAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }
        return config.port;
    }

    public String getHost() {
        return config.host;
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public Store getStore() {
        return store;
    }

    public CommandRegistry getCommandRegistry() {
        return commands;
    }

    private static void shutdownGroups(EventLoopGroup boss, EventLoopGroup workers) {
        // Zero quiet period: this is a forced shutdown
        if (boss != null) boss.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(CLOSE_WAIT_MS * 2);
        if (workers != null) workers.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(CLOSE_WAIT_MS * 2);
    }
}
