package com.coinchase;

import com.coinchase.protocol.AttackEvent;
import com.coinchase.protocol.StatusEvent;
import com.coinchase.state.GameState;
import com.coinchase.state.Position;
import com.coinchase.state.RelatedPosition;
import com.coinchase.task.EventProcessor;
import com.coinchase.task.LivenessMonitor;
import com.coinchase.worker.SessionTermination;
import com.coinchase.worker.Worker;
import com.coinchase.worker.WorkerPool;
import com.coinchase.worker.WorkerStatus;
import org.junit.jupiter.api.*;

import java.net.InetAddress;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for liveness checks and revival:
 * - Unresponsive receivers and stuck processors are reclaimed
 * - TERMINATED slots go back to the pool with a fresh session
 * - Startup capacity check
 */
@DisplayName("Liveness Monitor Tests")
class LivenessMonitorTest {

    private static final InetAddress LOCALHOST = InetAddress.getLoopbackAddress();
    private static final long PROBE_TIMEOUT_MILLIS = 300;

    private final BlockingGameState gameState = new BlockingGameState();
    private EventProcessor processor;
    private StubSessionReceiver receiver;
    private WorkerPool pool;
    private ScheduledExecutorService scheduler;
    private LivenessMonitor monitor;

    @BeforeEach
    void setUp() {
        processor = new EventProcessor(gameState, 16);
        receiver = new StubSessionReceiver(42000);
        pool = WorkerPool.create(1, id -> receiver, processor);
        pool.start().join();
        pool.setSendRoutine((userId, address, termination) -> () -> { });
        scheduler = Executors.newSingleThreadScheduledExecutor();
        monitor = new LivenessMonitor(pool, scheduler, 200, PROBE_TIMEOUT_MILLIS);
    }

    @AfterEach
    void tearDown() {
        gameState.release();
        monitor.stop();
        scheduler.shutdownNow();
        pool.shutdown();
        processor.shutdown();
    }

    private Worker login(String userId) {
        Worker worker = pool.pull();
        worker.setClientInformation(userId, LOCALHOST, 9000);
        worker.startSendUserRelatedDataToClient();
        return worker;
    }

    /**
     * Game state whose position updates block until released.
     */
    private static final class BlockingGameState implements GameState {

        private final CountDownLatch released = new CountDownLatch(1);
        private final CountDownLatch entered = new CountDownLatch(1);

        @Override
        public void updateUserPosition(StatusEvent status) {
            entered.countDown();
            try {
                released.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public void applyAttack(AttackEvent attack) {
        }

        @Override
        public List<RelatedPosition> getRelatedPositions(Position position, int visibilityModifier) {
            return Collections.emptyList();
        }

        @Override
        public void removeUser(String userId) {
        }

        @Override
        public int getCoinCount() {
            return 0;
        }

        @Override
        public int getItemCount() {
            return 0;
        }

        boolean awaitEntered() throws InterruptedException {
            return entered.await(2, TimeUnit.SECONDS);
        }

        void release() {
            released.countDown();
        }
    }

    // ==========================================
    // Test: Healthy Slots
    // ==========================================

    @Test
    @DisplayName("Healthy and AVAILABLE slots are left alone")
    void testHealthySlotUntouched() {
        assertEquals(0, monitor.checkAndRevive(), "AVAILABLE slots are not probed");

        Worker worker = login("alice");
        SessionTermination session = worker.getTermination();

        assertEquals(0, monitor.checkAndRevive());
        assertEquals(WorkerStatus.WORKING, worker.getStatus());
        assertSame(session, worker.getTermination());
    }

    // ==========================================
    // Test: Revival
    // ==========================================

    @Test
    @DisplayName("An unresponsive receiver gets its slot reclaimed")
    void testUnresponsiveReceiverRevived() {
        Worker worker = login("bob");
        SessionTermination session = worker.getTermination();
        receiver.setResponsive(false);

        long start = System.currentTimeMillis();
        assertEquals(1, monitor.checkAndRevive());
        long elapsed = System.currentTimeMillis() - start;

        assertTrue(session.isForced());
        assertEquals(WorkerStatus.AVAILABLE, worker.getStatus());
        assertEquals("", worker.getOwnerUserId());
        assertNull(worker.getClientAddress());
        assertFalse(pool.isConnected("bob"));
        assertEquals(2, receiver.getOpenCount(), "Revival opens a fresh session on the receiver");
        assertTrue(elapsed < PROBE_TIMEOUT_MILLIS + 1000, "Check took " + elapsed + "ms");

        System.out.println("✓ Unresponsive slot reclaimed in " + elapsed + "ms");
    }

    @Test
    @DisplayName("A processor stuck on an event gets its slot reclaimed")
    void testStuckProcessorRevived() throws Exception {
        Worker worker = login("carol");
        processor.submit(new StatusEvent("carol", new Position(1, 1)));
        assertTrue(gameState.awaitEntered(), "Processor should pick up the event");

        assertEquals(1, monitor.checkAndRevive());

        assertEquals(WorkerStatus.AVAILABLE, worker.getStatus());
        assertEquals(1, pool.getAvailableWorkerCount());

        // The fresh processor answers pings again
        login("dave");
        worker.ping().get(2, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("A TERMINATED slot is returned with a fresh session")
    void testTerminatedSlotRevived() throws Exception {
        Worker worker = login("erin");
        SessionTermination session = worker.getTermination();
        session.terminate("client went away");
        WorkerPoolTest.waitForStatus(worker, WorkerStatus.TERMINATED);

        assertEquals(1, monitor.checkAndRevive());

        assertEquals(WorkerStatus.AVAILABLE, worker.getStatus());
        assertNotSame(session, worker.getTermination());
        assertFalse(worker.getTermination().isTerminated());
        assertEquals(0, monitor.checkAndRevive(), "A second check finds nothing to do");
    }

    @Test
    @DisplayName("The scheduled monitor reclaims a dead slot within one interval")
    void testScheduledRevival() throws Exception {
        Worker worker = login("frank");
        monitor.start();
        receiver.setResponsive(false);

        long deadline = System.currentTimeMillis() + 200 + PROBE_TIMEOUT_MILLIS + 1500;
        while (worker.getStatus() != WorkerStatus.AVAILABLE && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(WorkerStatus.AVAILABLE, worker.getStatus());
        assertEquals("", worker.getOwnerUserId());
    }

    // ==========================================
    // Test: Startup Check
    // ==========================================

    @Test
    @DisplayName("Startup check passes only for a full pool of AVAILABLE slots")
    void testVerifyInitialCapacity() {
        LivenessMonitor.verifyInitialCapacity(pool, 1);

        IllegalStateException mismatch = assertThrows(IllegalStateException.class,
                () -> LivenessMonitor.verifyInitialCapacity(pool, 2));
        assertTrue(mismatch.getMessage().contains("worker pool initialization failed"));

        pool.pull();
        assertThrows(IllegalStateException.class, () -> LivenessMonitor.verifyInitialCapacity(pool, 1));
    }
}
