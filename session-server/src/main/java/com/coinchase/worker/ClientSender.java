package com.coinchase.worker;

import com.coinchase.protocol.RelatedPositionsMessage;
import com.coinchase.protocol.SnapshotAssembler;
import com.coinchase.state.GameState;
import com.coinchase.state.Scoreboard;
import com.coinchase.state.UserStatus;
import com.coinchase.state.UserStatuses;
import com.coinchase.task.BroadcastClock;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pushes a fresh snapshot to one client on every broadcast tick.
 *
 * Write failures, and ticks skipped because the client stopped reading,
 * count against a {@link FaultBudget}. Once the budget is
 * exhausted the user is removed from the game state, the user statuses and
 * the scoreboard, exactly once, and the session is terminated. Failures
 * below the limit are only logged.
 */
public class ClientSender implements SessionSender {

    private static final Logger logger = LoggerFactory.getLogger(ClientSender.class);

    private final String userId;
    private final SnapshotAssembler assembler;
    private final GameState gameState;
    private final UserStatuses userStatuses;
    private final Scoreboard scoreboard;
    private final SessionTermination termination;
    private final FaultBudget faultBudget;
    private final BroadcastClock clock;
    private final Runnable tickSubscriber = this::onTick;
    private final AtomicBoolean deregistered = new AtomicBoolean();

    private volatile Channel channel;
    private volatile boolean stopped;

    public ClientSender(String userId, SnapshotAssembler assembler, GameState gameState,
                        UserStatuses userStatuses, Scoreboard scoreboard,
                        SessionTermination termination, FaultBudget faultBudget, BroadcastClock clock) {
        this.userId = userId;
        this.assembler = assembler;
        this.gameState = gameState;
        this.userStatuses = userStatuses;
        this.scoreboard = scoreboard;
        this.termination = termination;
        this.faultBudget = faultBudget;
        this.clock = clock;
    }

    /**
     * Starts sending over a connected channel.
     */
    public void attach(Channel connected) {
        this.channel = connected;
        if (stopped) {
            connected.close();
            return;
        }
        clock.subscribe(tickSubscriber);
    }

    /**
     * Sends the user's latest state. Skipped when the user is no longer on
     * the map; a backed-up channel is skipped as a failure.
     */
    public void onTick() {
        Channel ch = channel;
        if (stopped || ch == null) {
            return;
        }

        UserStatus userStatus = userStatuses.getUserStatus(userId);
        if (userStatus == null) {
            return;
        }
        if (ch.isActive() && !ch.isWritable()) {
            recordFailure(new IllegalStateException("channel to " + userId + " not writable"));
            return;
        }

        RelatedPositionsMessage snapshot = assembler.assemble(userStatus);
        ch.writeAndFlush(snapshot).addListener((ChannelFutureListener) this::onWriteComplete);
    }

    private void onWriteComplete(ChannelFuture future) {
        if (future.isSuccess()) {
            faultBudget.reset();
            return;
        }
        recordFailure(future.cause());
    }

    private void recordFailure(Throwable cause) {
        int remaining = faultBudget.recordFailure();
        logger.debug("Snapshot to {} not delivered, fault tolerance remain: {} ({})",
                userId, remaining, String.valueOf(cause));

        if (remaining < 0 && deregistered.compareAndSet(false, true)) {
            logger.warn("Fault tolerance exhausted for {}, removing user", userId);
            gameState.removeUser(userId);
            userStatuses.removeUser(userId);
            scoreboard.removeUser(userId);
            termination.terminate("fault tolerance exhausted for " + userId, cause);
        }
    }

    @Override
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        clock.unsubscribe(tickSubscriber);
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        logger.info("Sender for {} stopped", userId);
    }

    public boolean isStopped() {
        return stopped;
    }

    public boolean isDeregistered() {
        return deregistered.get();
    }

    public int getRemainingFaultTolerance() {
        return faultBudget.getRemaining();
    }
}
