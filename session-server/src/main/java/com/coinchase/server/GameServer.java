package com.coinchase.server;

import com.coinchase.config.ServerConfig;
import com.coinchase.handler.LoginRequestHandler;
import com.coinchase.protocol.PacketCodec;
import com.coinchase.state.GameMap;
import com.coinchase.state.InMemoryScoreboard;
import com.coinchase.state.InMemoryUserStatuses;
import com.coinchase.task.BroadcastClock;
import com.coinchase.task.EventProcessor;
import com.coinchase.task.LivenessMonitor;
import com.coinchase.worker.ClientSenderFactory;
import com.coinchase.worker.ProtocolReceiver;
import com.coinchase.worker.WorkerPool;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Session server: HTTP login front plus a fixed pool of worker slots.
 *
 * Threading Model:
 * - Boss Group: 1 thread accepting HTTP and slot connections
 * - Worker Group: N threads (CPU cores) for all socket I/O, including
 *   snapshot senders and the broadcast tick
 * - event-processor threads: one per slot, applying decoded events
 * - liveness-monitor thread: periodic probes, allowed to block briefly
 */
public class GameServer {

    private static final Logger logger = LoggerFactory.getLogger(GameServer.class);

    private final ServerConfig config;
    private final PacketCodec codec = new PacketCodec();
    private final InMemoryUserStatuses userStatuses = new InMemoryUserStatuses();
    private final InMemoryScoreboard scoreboard = new InMemoryScoreboard();
    private final GameMap gameMap;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ScheduledExecutorService monitorScheduler;
    private EventProcessor processor;
    private WorkerPool pool;
    private BroadcastClock clock;
    private LivenessMonitor monitor;
    private Channel serverChannel;

    public GameServer(ServerConfig config) {
        this(config, new Random());
    }

    public GameServer(ServerConfig config, Random random) {
        this.config = config;
        this.gameMap = new GameMap(config.getMapSize(), userStatuses, scoreboard);
        gameMap.placeCoins(config.getCoinCount(), random);
        gameMap.placeItems(config.getItemCount(), random);
    }

    /**
     * Starts the server.
     * This method blocks until the server is shut down.
     */
    public void start() throws InterruptedException {
        try {
            bind();
            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    /**
     * Binds every worker slot and the HTTP port, then returns.
     *
     * @throws IllegalStateException if the pool does not come up at full capacity
     */
    public void bind() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        monitorScheduler = Executors.newSingleThreadScheduledExecutor(
                new DefaultThreadFactory("liveness-monitor", true));

        processor = new EventProcessor(gameMap, config.getEventQueueCapacity());
        pool = WorkerPool.create(config.getWorkerCount(),
                id -> new ProtocolReceiver(id, config.workerPort(id), bossGroup, workerGroup,
                        codec, processor::submit, config.getReadIdleSeconds()),
                processor);
        pool.start().join();
        LivenessMonitor.verifyInitialCapacity(pool, config.getWorkerCount());
        logger.info("{} worker slots listening", pool.getCapacity());

        clock = new BroadcastClock(workerGroup.next(), config.getBroadcastIntervalMillis());
        pool.setSendRoutine(new ClientSenderFactory(workerGroup, codec, gameMap, userStatuses, scoreboard,
                clock, config.getFaultTolerance(), config.getDialTimeoutSeconds() * 1000));
        clock.start();

        monitor = new LivenessMonitor(pool, monitorScheduler,
                config.getLivenessIntervalMillis(), config.getLivenessTimeoutMillis());
        monitor.start();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(65536));
                        pipeline.addLast(new LoginRequestHandler(
                                pool, gameMap, userStatuses, scoreboard, codec.getObjectMapper()));
                    }
                });

        serverChannel = bootstrap.bind(config.getHttpPort()).sync().channel();
        logger.info("Server started successfully!");
        logger.info("Login endpoint: http://localhost:{}/get-worker-port/<userId>/<clientPort>", getHttpPort());
    }

    /**
     * Gracefully shuts down the server.
     * - Stops accepting logins and liveness checks
     * - Terminates every session
     * - Releases all threads
     */
    public synchronized void shutdown() {
        if (bossGroup == null) {
            return;
        }
        logger.info("Shutting down server...");

        if (serverChannel != null) {
            serverChannel.close();
        }
        if (monitor != null) {
            monitor.stop();
        }
        monitorScheduler.shutdownNow();
        if (clock != null) {
            clock.stop();
        }
        if (pool != null) {
            pool.shutdown();
        }
        if (processor != null) {
            processor.shutdown();
        }

        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        bossGroup = null;

        logger.info("Server shutdown complete.");
    }

    public int getHttpPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public WorkerPool getPool() {
        return pool;
    }

    public GameMap getGameMap() {
        return gameMap;
    }

    public InMemoryScoreboard getScoreboard() {
        return scoreboard;
    }

    public InMemoryUserStatuses getUserStatuses() {
        return userStatuses;
    }

    public LivenessMonitor getMonitor() {
        return monitor;
    }
}
