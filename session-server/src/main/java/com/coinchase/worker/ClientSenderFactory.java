package com.coinchase.worker;

import com.coinchase.protocol.PacketCodec;
import com.coinchase.protocol.SnapshotAssembler;
import com.coinchase.protocol.SnapshotEncoder;
import com.coinchase.state.GameState;
import com.coinchase.state.Scoreboard;
import com.coinchase.state.UserStatuses;
import com.coinchase.task.BroadcastClock;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Send routine registered on every slot: dials back to the address the
 * client declared at login and starts a {@link ClientSender} on it.
 *
 * The server dials because the client's listening port is only known from
 * the login request. A failed dial terminates the session.
 */
public class ClientSenderFactory implements SendRoutine {

    private static final Logger logger = LoggerFactory.getLogger(ClientSenderFactory.class);

    private final Bootstrap bootstrap;
    private final SnapshotAssembler assembler;
    private final GameState gameState;
    private final UserStatuses userStatuses;
    private final Scoreboard scoreboard;
    private final BroadcastClock clock;
    private final int faultTolerance;

    public ClientSenderFactory(EventLoopGroup group, PacketCodec codec, GameState gameState,
                               UserStatuses userStatuses, Scoreboard scoreboard, BroadcastClock clock,
                               int faultTolerance, int dialTimeoutMillis) {
        this.assembler = new SnapshotAssembler(gameState, scoreboard);
        this.gameState = gameState;
        this.userStatuses = userStatuses;
        this.scoreboard = scoreboard;
        this.clock = clock;
        this.faultTolerance = faultTolerance;
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, dialTimeoutMillis)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast("snapshotEncoder", new SnapshotEncoder(codec));
                    }
                });
    }

    @Override
    public SessionSender start(String userId, InetSocketAddress clientAddress, SessionTermination termination) {
        ClientSender sender = new ClientSender(userId, assembler, gameState, userStatuses, scoreboard,
                termination, new FaultBudget(faultTolerance), clock);

        bootstrap.connect(clientAddress).addListener((ChannelFuture future) -> {
            if (future.isSuccess()) {
                logger.info("Connected to {} for {}", clientAddress, userId);
                sender.attach(future.channel());
            } else {
                logger.warn("Dial to {} for {} failed: {}", clientAddress, userId, String.valueOf(future.cause()));
                termination.terminate("dial to " + clientAddress + " failed", future.cause());
            }
        });
        return sender;
    }
}
