package com.coinchase.worker;

import com.coinchase.handler.ClientReceiveHandler;
import com.coinchase.protocol.InboundEvent;
import com.coinchase.protocol.InboundFrameDecoder;
import com.coinchase.protocol.PacketCodec;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Netty receiver for one worker slot.
 *
 * The listener is bound once and kept for the slot's whole life. Each
 * session is opened on it in turn, and a client is only accepted once its
 * session has been admitted; before that, and after the session ends,
 * connections are closed on arrival. One client at a time. Accepted
 * connections get:
 * - IdleStateHandler: the session ends after the read idle timeout, and
 *   every read pushes the deadline out again
 * - DelimiterBasedFrameDecoder: '$' separated frames, partial frames are
 *   held across reads, a frame reaching the read chunk size without a
 *   delimiter is rejected
 * - InboundFrameDecoder + ClientReceiveHandler: decode and forward
 *
 * Ending a session closes its connection only.
 */
public class ProtocolReceiver implements SessionReceiver {

    private static final Logger logger = LoggerFactory.getLogger(ProtocolReceiver.class);

    public static final int READ_BUFFER_SIZE = 4096;

    private final int workerId;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup childGroup;
    private final PacketCodec codec;
    private final Consumer<InboundEvent> eventSink;
    private final int readIdleSeconds;
    private final int requestedPort;

    private volatile int boundPort;
    private volatile Channel serverChannel;
    private volatile SessionTermination current;
    private volatile SessionTermination admitted;
    private volatile boolean closed;
    private final AtomicReference<Channel> connection = new AtomicReference<>();

    // Guarded by this
    private CompletableFuture<Integer> listening;

    public ProtocolReceiver(int workerId, int port, EventLoopGroup bossGroup, EventLoopGroup childGroup,
                            PacketCodec codec, Consumer<InboundEvent> eventSink, int readIdleSeconds) {
        this.workerId = workerId;
        this.requestedPort = port;
        this.bossGroup = bossGroup;
        this.childGroup = childGroup;
        this.codec = codec;
        this.eventSink = eventSink;
        this.readIdleSeconds = readIdleSeconds;
    }

    /**
     * Installs the inbound handlers on a freshly accepted channel.
     */
    public static void configurePipeline(ChannelPipeline pipeline, PacketCodec codec,
                                         Consumer<InboundEvent> eventSink,
                                         SessionTermination termination, int readIdleSeconds) {
        pipeline.addLast("idle", new IdleStateHandler(readIdleSeconds, 0, 0, TimeUnit.SECONDS));
        pipeline.addLast("framer", new DelimiterBasedFrameDecoder(
                READ_BUFFER_SIZE - 1, true, true, Unpooled.wrappedBuffer(new byte[]{PacketCodec.DELIMITER})));
        pipeline.addLast("decoder", new InboundFrameDecoder(codec));
        pipeline.addLast("receiver", new ClientReceiveHandler(eventSink, termination));
    }

    @Override
    public CompletableFuture<Integer> open(SessionTermination termination) {
        admitted = null;
        current = termination;
        Channel stale = connection.getAndSet(null);
        if (stale != null) {
            stale.close();
        }

        CompletableFuture<Integer> bound;
        synchronized (this) {
            if (closed) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("receiver of worker " + workerId + " is closed"));
            }
            if (listening == null || listening.isCompletedExceptionally()
                    || (listening.isDone() && !isListening())) {
                listening = bind();
            }
            bound = listening;
        }
        return bound.whenComplete((port, error) -> {
            if (error != null) {
                termination.terminate("failed to bind port " + port(), error);
            }
        });
    }

    @Override
    public void admit(SessionTermination termination) {
        if (termination == current && !termination.isTerminated()) {
            admitted = termination;
        }
    }

    private CompletableFuture<Integer> bind() {
        CompletableFuture<Integer> bound = new CompletableFuture<>();
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, childGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                // A clean end of stream must not close the channel
                .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(READ_BUFFER_SIZE))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        accept(ch);
                    }
                });

        int port = port();
        bootstrap.bind(port).addListener((ChannelFuture future) -> {
            if (!future.isSuccess()) {
                logger.error("Worker {} failed to bind port {}", workerId, port, future.cause());
                bound.completeExceptionally(future.cause());
                return;
            }

            Channel listener = future.channel();
            serverChannel = listener;
            boundPort = ((InetSocketAddress) listener.localAddress()).getPort();
            logger.debug("Worker {} listening on port {}", workerId, boundPort);
            bound.complete(boundPort);
        });
        return bound;
    }

    private void accept(SocketChannel ch) {
        SessionTermination session = admitted;
        if (session == null || session.isTerminated() || !connection.compareAndSet(null, ch)) {
            logger.warn("Worker {} refused connection from {}", workerId, ch.remoteAddress());
            ch.close();
            return;
        }
        ch.closeFuture().addListener(done -> connection.compareAndSet(ch, null));
        session.onTermination(ch::close);
        configurePipeline(ch.pipeline(), codec, eventSink, session, readIdleSeconds);
        logger.info("Worker {} accepted connection from {}", workerId, ch.remoteAddress());
    }

    /**
     * Runs the probe on the connection's event loop, or the listener's when
     * no client is connected. Fails at once if the listener is gone.
     */
    @Override
    public CompletableFuture<Void> ping() {
        Channel listener = serverChannel;
        if (listener == null || !listener.isOpen()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("worker " + workerId + " is not listening"));
        }

        Channel accepted = connection.get();
        Channel probed = accepted != null ? accepted : listener;
        CompletableFuture<Void> echo = new CompletableFuture<>();
        try {
            probed.eventLoop().execute(() -> echo.complete(null));
        } catch (RejectedExecutionException e) {
            echo.completeExceptionally(e);
        }
        return echo;
    }

    @Override
    public void close() {
        synchronized (this) {
            closed = true;
        }
        admitted = null;
        Channel accepted = connection.getAndSet(null);
        if (accepted != null) {
            accepted.close();
        }
        Channel listener = serverChannel;
        if (listener != null) {
            listener.close();
        }
    }

    @Override
    public int port() {
        return boundPort != 0 ? boundPort : requestedPort;
    }

    private boolean isListening() {
        Channel listener = serverChannel;
        return listener != null && listener.isOpen();
    }
}
