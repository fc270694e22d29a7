package runbroker.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import runbroker.coordinator.config.CoordinatorConfig;
import runbroker.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Boots the HTTP server: one boss thread, Netty's default worker loop, and a
 * separate executor group for the router so blocking long polls never stall
 * socket I/O.
 */
public final class CoordinatorNettyServer {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorNettyServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static EventExecutorGroup handlerGroup;
    private static Dependencies dependencies;

    private CoordinatorNettyServer() {
    }

    /** HTTP pipeline for the coordinator API */
    static ChannelHandler pipelineInitializer(RouterHandler router, EventExecutorGroup group) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(120, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(1024 * 1024));
                p.addLast(group, "router", router);
            }
        };
    }

    /**
     * Start the server with a fresh set of dependencies and the background
     * scheduler.
     *
     * @return true if the server is running after the call
     */
    public static synchronized boolean start(int port, CoordinatorConfig config) {
        if (running) return true;
        try {
            dependencies = Dependencies.create(config);
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();
            handlerGroup = new DefaultEventExecutorGroup(config.pollWorkerThreads());

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(dependencies.routerHandler(), handlerGroup));

            serverChannel = b.bind(config.serverHost(), port).syncUninterruptibly().channel();
            running = true;
            dependencies.startScheduler();
            log.info("Coordinator started on {}:{}", config.serverHost(), port);
            return true;
        } catch (Throwable t) {
            log.error("Start error: {}", t.getMessage(), t);
            releaseResources();
            return false;
        }
    }

    public static synchronized boolean start(CoordinatorConfig config) {
        return start(config.serverPort(), config);
    }

    public static synchronized void stop() {
        if (!running) return;
        releaseResources();
        log.info("Coordinator stopped");
    }

    private static void releaseResources() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (handlerGroup != null) { handlerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS); handlerGroup = null; }
            if (workerGroup != null) { workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS); workerGroup = null; }
            if (bossGroup != null) { bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS); bossGroup = null; }
            if (dependencies != null) { dependencies.close(); dependencies = null; }
            running = false;
        }
    }

    public static boolean isRunning() { return running; }

    /**
     * Dependencies of the running server, or null when stopped.
     */
    public static Dependencies dependencies() { return dependencies; }
}
