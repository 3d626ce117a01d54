package org.muma.xredis;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.xredis.command.CommandDispatcher;
import org.muma.xredis.config.XRedisConfig;
import org.muma.xredis.protocol.ErrorMessage;
import org.muma.xredis.protocol.RedisMessage;
import org.muma.xredis.rdb.FileSnapshotGateway;
import org.muma.xredis.server.KeyspaceEngine;
import org.muma.xredis.server.RedisCommandHandler;
import org.muma.xredis.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public class XRedisServer {

    private static final Logger log = LoggerFactory.getLogger(XRedisServer.class);

    private static final String BANNER = """

                             _ _
             __ ___ _ ___ __| (_)___
             \\ \\ / '_/ -_) _| | (_-<
             /_\\_\\_| \\___\\__,_|_/__/

            """;

    private final XRedisConfig config;

    public XRedisServer(XRedisConfig config) {
        this.config = config;
    }

    /**
     * @throws IllegalStateException 快照存在但读取失败
     */
    public void start() throws InterruptedException {
        // 1. 初始化存储和引擎
        FileSnapshotGateway gateway = new FileSnapshotGateway(config.snapshotFile());
        KeyspaceEngine engine = new KeyspaceEngine(new MemoryStorageEngine(), gateway,
                Clock.systemUTC(), config.getSlowlogThresholdMillis());

        // 2. 【关键】加载快照，必须在 Netty 启动前完成
        // 读不出来就不启动，否则下一次 SAVE 会用空库覆盖掉它
        log.info("Loading snapshot from {}", gateway.getFile());
        RedisMessage loaded = engine.load().syncUninterruptibly().getNow();
        if (loaded instanceof ErrorMessage error) {
            engine.shutdown();
            throw new IllegalStateException("Could not load snapshot " + gateway.getFile() + ": " + error.content());
        }

        CommandDispatcher dispatcher = new CommandDispatcher(engine);

        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down xRedis...");
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            engine.shutdown();
        }, "XRedis-Shutdown"));

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new RedisCommandHandler(dispatcher));
                        }
                    });

            log.info("Starting xRedis on port {}", config.getPort());
            ChannelFuture future = bootstrap.bind(config.getPort()).sync();

            log.info("Ready to receive connections");
            future.channel().closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }

    public static void main(String[] args) throws InterruptedException {
        System.out.print(BANNER);

        // 1. 初始化配置并解析参数
        XRedisConfig config = XRedisConfig.getInstance();
        try {
            config.load(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid startup arguments: {}", e.getMessage());
            System.exit(1);
        }
        new XRedisServer(config).start();
    }
}
