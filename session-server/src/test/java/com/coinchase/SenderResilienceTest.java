package com.coinchase;

import com.coinchase.protocol.PacketCodec;
import com.coinchase.protocol.RelatedPositionsMessage;
import com.coinchase.protocol.SnapshotAssembler;
import com.coinchase.protocol.SnapshotEncoder;
import com.coinchase.protocol.StatusEvent;
import com.coinchase.state.GameMap;
import com.coinchase.state.InMemoryScoreboard;
import com.coinchase.state.InMemoryUserStatuses;
import com.coinchase.state.Position;
import com.coinchase.task.BroadcastClock;
import com.coinchase.worker.ClientSender;
import com.coinchase.worker.FaultBudget;
import com.coinchase.worker.SessionTermination;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.compression.Snappy;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for outbound delivery:
 * - Compressed, delimited snapshots
 * - Fault tolerance budget and one-time deregistration
 */
@DisplayName("Sender Resilience Tests")
class SenderResilienceTest {

    private static final String USER = "runner";
    private static final int FAULT_TOLERANCE = 100;

    private final PacketCodec codec = new PacketCodec();
    private InMemoryUserStatuses userStatuses;
    private InMemoryScoreboard scoreboard;
    private GameMap gameMap;
    private ScheduledExecutorService scheduler;
    private BroadcastClock clock;
    private SessionTermination termination;

    @BeforeEach
    void setUp() {
        userStatuses = new InMemoryUserStatuses();
        scoreboard = new InMemoryScoreboard();
        gameMap = new GameMap(30, userStatuses, scoreboard);
        scoreboard.register(USER);
        gameMap.updateUserPosition(new StatusEvent(USER, new Position(10, 10)));

        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = new BroadcastClock(scheduler, 100);
        termination = new SessionTermination("worker-test");
    }

    @AfterEach
    void tearDown() {
        clock.stop();
        scheduler.shutdownNow();
    }

    private ClientSender newSender() {
        return new ClientSender(USER, new SnapshotAssembler(gameMap, scoreboard), gameMap, userStatuses,
                scoreboard, termination, new FaultBudget(FAULT_TOLERANCE), clock);
    }

    /**
     * Fails every write, or only while {@code failing} is set.
     */
    private static final class FailingWrites extends ChannelOutboundHandlerAdapter {

        private final AtomicBoolean failing;
        private final AtomicInteger attempts = new AtomicInteger();

        FailingWrites(AtomicBoolean failing) {
            this.failing = failing;
        }

        @Override
        public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) throws Exception {
            attempts.incrementAndGet();
            if (failing.get()) {
                ReferenceCountUtil.release(msg);
                promise.setFailure(new IOException("broken pipe"));
                return;
            }
            super.write(ctx, msg, promise);
        }
    }

    // ==========================================
    // Test: Snapshot Encoding
    // ==========================================

    @Test
    @DisplayName("Snapshots go out as one Snappy block of JSON plus delimiter")
    void testSnapshotOnTheWire() throws Exception {
        EmbeddedChannel channel = new EmbeddedChannel(new SnapshotEncoder(codec));
        ClientSender sender = newSender();
        sender.attach(channel);

        clock.tick();

        ByteBuf compressed = channel.readOutbound();
        assertNotNull(compressed, "A tick should write one snapshot");
        ByteBuf decompressed = Unpooled.buffer();
        try {
            new Snappy().decode(compressed, decompressed);
            byte[] framed = ByteBufUtil.getBytes(decompressed);
            assertEquals(PacketCodec.DELIMITER, framed[framed.length - 1]);

            RelatedPositionsMessage snapshot = codec.decodeSnapshot(framed);
            assertEquals(new Position(10, 10), snapshot.getUserPosition());
            int side = 2 * GameMap.BASE_VISIBILITY + 1;
            assertEquals(side * side, snapshot.getRelatedPositions().size());
            assertEquals(0, snapshot.getScoreboard().get(USER));
            assertTrue(snapshot.getRelatedPositions().stream()
                    .anyMatch(view -> view.getCell().isOccupied() && USER.equals(view.getCell().getOwner())));
        } finally {
            compressed.release();
            decompressed.release();
            channel.finishAndReleaseAll();
        }
        System.out.println("✓ Snapshot decompressed and decoded");
    }

    @Test
    @DisplayName("Nothing is sent once the user has left the map")
    void testSkipsAbsentUser() {
        EmbeddedChannel channel = new EmbeddedChannel(new SnapshotEncoder(codec));
        newSender().attach(channel);
        gameMap.removeUser(USER);

        clock.tick();

        assertNull(channel.readOutbound());
        channel.finishAndReleaseAll();
    }

    // ==========================================
    // Test: Fault Tolerance
    // ==========================================

    @Test
    @DisplayName("More than 100 failed writes deregister the user once and terminate")
    void testFaultToleranceExhaustion() {
        AtomicBoolean failing = new AtomicBoolean(true);
        FailingWrites writes = new FailingWrites(failing);
        EmbeddedChannel channel = new EmbeddedChannel(writes);
        ClientSender sender = newSender();
        sender.attach(channel);

        for (int i = 0; i < FAULT_TOLERANCE; i++) {
            clock.tick();
        }
        assertFalse(sender.isDeregistered(), "100 failures are still within tolerance");
        assertFalse(termination.isTerminated());
        assertNotNull(userStatuses.getUserStatus(USER));

        clock.tick();

        assertTrue(sender.isDeregistered());
        assertTrue(termination.isTerminated());
        assertNull(userStatuses.getUserStatus(USER));
        assertFalse(scoreboard.getCopiedBoard().containsKey(USER));
        assertFalse(gameMap.getCell(new Position(10, 10)).isOccupied());

        // Further ticks find the user gone and write nothing
        int attemptsAtExhaustion = writes.attempts.get();
        clock.tick();
        clock.tick();
        assertEquals(attemptsAtExhaustion, writes.attempts.get());

        channel.finishAndReleaseAll();
        System.out.println("✓ Exhausted after " + attemptsAtExhaustion + " failed writes");
    }

    @Test
    @DisplayName("A successful write restores the full budget")
    void testSuccessResetsBudget() {
        AtomicBoolean failing = new AtomicBoolean(true);
        EmbeddedChannel channel = new EmbeddedChannel(new FailingWrites(failing), new SnapshotEncoder(codec));
        ClientSender sender = newSender();
        sender.attach(channel);

        for (int i = 0; i < 60; i++) {
            clock.tick();
        }
        assertEquals(FAULT_TOLERANCE - 60, sender.getRemainingFaultTolerance());

        failing.set(false);
        clock.tick();
        assertEquals(FAULT_TOLERANCE, sender.getRemainingFaultTolerance());

        failing.set(true);
        for (int i = 0; i < 60; i++) {
            clock.tick();
        }
        assertFalse(sender.isDeregistered(), "Only consecutive failures count");
        assertFalse(termination.isTerminated());

        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("A client that stops reading uses up the budget without any write attempt")
    void testUnwritableChannelExhaustsBudget() {
        EmbeddedChannel channel = new EmbeddedChannel(new SnapshotEncoder(codec));
        channel.config().setWriteBufferWaterMark(new WriteBufferWaterMark(1, 2));
        // Queued but never flushed: the channel stays backed up
        channel.write(Unpooled.wrappedBuffer(new byte[64]));
        assertFalse(channel.isWritable());

        ClientSender sender = newSender();
        sender.attach(channel);

        for (int i = 0; i < FAULT_TOLERANCE; i++) {
            clock.tick();
        }
        assertEquals(0, sender.getRemainingFaultTolerance());
        assertFalse(sender.isDeregistered());

        clock.tick();

        assertTrue(sender.isDeregistered());
        assertTrue(termination.isTerminated());
        assertNull(userStatuses.getUserStatus(USER));
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("Stopping the sender closes the channel and leaves the clock")
    void testStop() {
        EmbeddedChannel channel = new EmbeddedChannel(new SnapshotEncoder(codec));
        ClientSender sender = newSender();
        sender.attach(channel);
        assertEquals(1, clock.getSubscriberCount());

        sender.stop();
        sender.stop();

        assertTrue(sender.isStopped());
        assertEquals(0, clock.getSubscriberCount());
        assertFalse(channel.isOpen());
        assertFalse(termination.isTerminated(), "Stopping the sender alone does not end the session");
    }

    @Test
    @DisplayName("A sender stopped before its dial completes closes the late channel")
    void testStopBeforeAttach() {
        ClientSender sender = newSender();
        sender.stop();

        EmbeddedChannel channel = new EmbeddedChannel(new SnapshotEncoder(codec));
        sender.attach(channel);

        assertFalse(channel.isOpen());
        assertEquals(0, clock.getSubscriberCount());
    }
}
