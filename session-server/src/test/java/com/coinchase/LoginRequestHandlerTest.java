package com.coinchase;

import com.coinchase.handler.LoginRequestHandler;
import com.coinchase.protocol.PacketCodec;
import com.coinchase.state.GameMap;
import com.coinchase.state.InMemoryScoreboard;
import com.coinchase.state.InMemoryUserStatuses;
import com.coinchase.task.EventProcessor;
import com.coinchase.worker.Worker;
import com.coinchase.worker.WorkerPool;
import com.coinchase.worker.WorkerStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.*;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the HTTP login front:
 * - Slot hand-out and rejection statuses
 * - Disconnect and server state
 */
@DisplayName("Login Request Handler Tests")
class LoginRequestHandlerTest {

    private static final InetSocketAddress CLIENT = new InetSocketAddress("127.0.0.1", 51000);

    private final ObjectMapper objectMapper = new PacketCodec().getObjectMapper();
    private final List<InetSocketAddress> dialed = new CopyOnWriteArrayList<>();
    private InMemoryUserStatuses userStatuses;
    private InMemoryScoreboard scoreboard;
    private GameMap gameMap;
    private EventProcessor processor;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        userStatuses = new InMemoryUserStatuses();
        scoreboard = new InMemoryScoreboard();
        gameMap = new GameMap(50, userStatuses, scoreboard);
        gameMap.placeCoins(30, new Random(1));
        gameMap.placeItems(5, new Random(2));
        processor = new EventProcessor(gameMap, 64);
        pool = WorkerPool.create(2, id -> new StubSessionReceiver(43000 + id), processor);
        pool.start().join();
        pool.setSendRoutine((userId, address, termination) -> {
            dialed.add(address);
            return () -> { };
        });
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
        processor.shutdown();
    }

    private EmbeddedChannel newChannel() {
        LoginRequestHandler handler = new LoginRequestHandler(pool, gameMap, userStatuses, scoreboard, objectMapper);
        return new EmbeddedChannel(handler) {
            @Override
            protected SocketAddress remoteAddress0() {
                return CLIENT;
            }
        };
    }

    private FullHttpResponse request(HttpMethod method, String uri) {
        EmbeddedChannel channel = newChannel();
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri));
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "Handler should answer " + method + " " + uri);
        channel.finishAndReleaseAll();
        return response;
    }

    private static String body(FullHttpResponse response) {
        try {
            return response.content().toString(StandardCharsets.UTF_8);
        } finally {
            response.release();
        }
    }

    // ==========================================
    // Test: Login
    // ==========================================

    @Test
    @DisplayName("Login hands out a slot port and starts sending to the client")
    void testLogin() {
        FullHttpResponse response = request(HttpMethod.GET, "/get-worker-port/alice/5000");

        assertEquals(HttpResponseStatus.OK, response.status());
        int port = Integer.parseInt(body(response));
        assertTrue(port == 43000 || port == 43001, "port " + port);

        Worker worker = pool.getByUserId("alice");
        assertEquals(port, worker.getPort());
        assertEquals(WorkerStatus.WORKING, worker.getStatus());
        assertEquals(List.of(new InetSocketAddress(CLIENT.getAddress(), 5000)), dialed);
        assertTrue(scoreboard.getCopiedBoard().containsKey("alice"));
    }

    @Test
    @DisplayName("Logging in twice is a conflict")
    void testAlreadyConnected() {
        body(request(HttpMethod.GET, "/get-worker-port/bob/5000"));

        FullHttpResponse response = request(HttpMethod.GET, "/get-worker-port/bob/5001");

        assertEquals(HttpResponseStatus.CONFLICT, response.status());
        assertEquals("user already connected", body(response));
        assertEquals(1, pool.getAvailableWorkerCount());
    }

    @Test
    @DisplayName("A full pool rejects the login with a conflict")
    void testCapacityExhausted() {
        body(request(HttpMethod.GET, "/get-worker-port/u1/5000"));
        body(request(HttpMethod.GET, "/get-worker-port/u2/5000"));

        FullHttpResponse response = request(HttpMethod.GET, "/get-worker-port/u3/5000");

        assertEquals(HttpResponseStatus.CONFLICT, response.status());
        assertEquals("worker currently not available", body(response));
        assertFalse(pool.isConnected("u3"));
    }

    @Test
    @DisplayName("Malformed client information is a bad request")
    void testInvalidClientInformation() {
        assertEquals(HttpResponseStatus.BAD_REQUEST, request(HttpMethod.GET, "/get-worker-port/carol/abc").status());
        assertEquals(HttpResponseStatus.BAD_REQUEST, request(HttpMethod.GET, "/get-worker-port/carol/0").status());
        assertEquals(HttpResponseStatus.BAD_REQUEST, request(HttpMethod.GET, "/get-worker-port/carol/70000").status());
        assertEquals(HttpResponseStatus.BAD_REQUEST, request(HttpMethod.GET, "/get-worker-port/carol").status());
        assertEquals(HttpResponseStatus.BAD_REQUEST, request(HttpMethod.GET, "/get-worker-port//5000").status());
        assertEquals(2, pool.getAvailableWorkerCount(), "No slot is taken by a rejected login");
    }

    @Test
    @DisplayName("A login failing after pull gives the slot back")
    void testFailedLoginReturnsSlot() {
        pool.setSendRoutine(null);

        FullHttpResponse response = request(HttpMethod.GET, "/get-worker-port/dave/5000");

        assertEquals(HttpResponseStatus.CONFLICT, response.status());
        response.release();
        assertEquals(2, pool.getAvailableWorkerCount());
        assertFalse(pool.isConnected("dave"));
    }

    // ==========================================
    // Test: Disconnect
    // ==========================================

    @Test
    @DisplayName("Disconnect returns the slot and forgets the user")
    void testDisconnect() {
        body(request(HttpMethod.GET, "/get-worker-port/erin/5000"));
        assertEquals(1, pool.getAvailableWorkerCount());

        FullHttpResponse response = request(HttpMethod.PATCH, "/disconnect/erin");

        assertEquals(HttpResponseStatus.OK, response.status());
        response.release();
        assertEquals(2, pool.getAvailableWorkerCount());
        assertFalse(pool.isConnected("erin"));
        assertFalse(scoreboard.getCopiedBoard().containsKey("erin"));
    }

    @Test
    @DisplayName("Disconnecting an unknown user is not found")
    void testDisconnectUnknown() {
        FullHttpResponse response = request(HttpMethod.PATCH, "/disconnect/ghost");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("worker not found", body(response));
    }

    // ==========================================
    // Test: Routing
    // ==========================================

    @Test
    @DisplayName("Server state reports free slots, coins and items")
    void testServerState() throws Exception {
        body(request(HttpMethod.GET, "/get-worker-port/frank/5000"));

        FullHttpResponse response = request(HttpMethod.GET, "/server-state");

        assertEquals(HttpResponseStatus.OK, response.status());
        JsonNode state = objectMapper.readTree(body(response));
        assertEquals(1, state.get("workerCount").asInt());
        assertEquals(gameMap.getCoinCount(), state.get("coinCount").asInt());
        assertEquals(5, state.get("itemCount").asInt());
    }

    @Test
    @DisplayName("Unknown paths and wrong methods are rejected")
    void testRouting() {
        assertEquals(HttpResponseStatus.NOT_FOUND, request(HttpMethod.GET, "/nowhere").status());
        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED,
                request(HttpMethod.POST, "/get-worker-port/alice/5000").status());
        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, request(HttpMethod.GET, "/disconnect/alice").status());
        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, request(HttpMethod.DELETE, "/server-state").status());
    }
}
