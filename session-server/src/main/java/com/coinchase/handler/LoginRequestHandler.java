package com.coinchase.handler;

import com.coinchase.state.GameState;
import com.coinchase.state.Scoreboard;
import com.coinchase.state.UserStatuses;
import com.coinchase.worker.Worker;
import com.coinchase.worker.WorkerCapacityException;
import com.coinchase.worker.WorkerNotFoundException;
import com.coinchase.worker.WorkerPool;
import com.coinchase.worker.WorkerPoolException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * HTTP front door of the session server.
 *
 * - GET /get-worker-port/{userId}/{clientPort}: hands the user a worker slot
 *   and answers with the slot's port. clientPort is where the client listens
 *   for snapshots; its IP is taken from the request.
 * - PATCH /disconnect/{userId}: returns the user's slot to the pool
 * - GET /server-state: pool and map counters as JSON
 */
public class LoginRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger logger = LoggerFactory.getLogger(LoginRequestHandler.class);

    private static final String LOGIN_PATH = "get-worker-port";
    private static final String DISCONNECT_PATH = "disconnect";
    private static final String STATE_PATH = "server-state";

    private final WorkerPool pool;
    private final GameState gameState;
    private final UserStatuses userStatuses;
    private final Scoreboard scoreboard;
    private final ObjectMapper objectMapper;

    public LoginRequestHandler(WorkerPool pool, GameState gameState, UserStatuses userStatuses,
                               Scoreboard scoreboard, ObjectMapper objectMapper) {
        this.pool = pool;
        this.gameState = gameState;
        this.userStatuses = userStatuses;
        this.scoreboard = scoreboard;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        String[] segments = path.startsWith("/") ? path.substring(1).split("/", -1) : path.split("/", -1);
        HttpMethod method = request.method();

        switch (segments[0]) {
            case LOGIN_PATH -> {
                if (!HttpMethod.GET.equals(method)) {
                    respond(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, "method not allowed");
                } else if (segments.length != 3) {
                    respond(ctx, request, HttpResponseStatus.BAD_REQUEST, "client information invalid");
                } else {
                    handleLogin(ctx, request, segments[1], segments[2]);
                }
            }
            case DISCONNECT_PATH -> {
                if (!HttpMethod.PATCH.equals(method)) {
                    respond(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, "method not allowed");
                } else if (segments.length != 2 || segments[1].isEmpty()) {
                    respond(ctx, request, HttpResponseStatus.NOT_FOUND, "worker not found");
                } else {
                    handleDisconnect(ctx, request, segments[1]);
                }
            }
            case STATE_PATH -> {
                if (!HttpMethod.GET.equals(method)) {
                    respond(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, "method not allowed");
                } else {
                    handleServerState(ctx, request);
                }
            }
            default -> respond(ctx, request, HttpResponseStatus.NOT_FOUND, "not found");
        }
    }

    private void handleLogin(ChannelHandlerContext ctx, FullHttpRequest request, String userId, String portText) {
        InetAddress clientIp = remoteIp(ctx.channel().remoteAddress());
        int clientPort = parsePort(portText);
        logger.info("client information: userId={}, clientPort={}", userId, portText);

        if (clientIp == null || clientPort < 0 || userId.isEmpty()) {
            respond(ctx, request, HttpResponseStatus.BAD_REQUEST, "client information invalid");
            return;
        }
        if (pool.isConnected(userId)) {
            respond(ctx, request, HttpResponseStatus.CONFLICT, "user already connected");
            return;
        }

        Worker worker;
        try {
            worker = pool.pull();
        } catch (WorkerCapacityException e) {
            respond(ctx, request, HttpResponseStatus.CONFLICT, "worker currently not available");
            return;
        }

        try {
            worker.setClientInformation(userId, clientIp, clientPort);
            worker.startSendUserRelatedDataToClient();
        } catch (WorkerPoolException e) {
            logger.warn("Login of {} failed on worker {}: {}", userId, worker.getId(), e.getMessage());
            pool.put(worker.getId(), worker);
            respond(ctx, request, HttpResponseStatus.CONFLICT, e.getMessage());
            return;
        }

        scoreboard.register(userId);
        respond(ctx, request, HttpResponseStatus.OK, Integer.toString(worker.getPort()));
    }

    private void handleDisconnect(ChannelHandlerContext ctx, FullHttpRequest request, String userId) {
        Worker worker;
        try {
            worker = pool.getByUserId(userId);
        } catch (WorkerNotFoundException e) {
            respond(ctx, request, HttpResponseStatus.NOT_FOUND, "worker not found");
            return;
        }

        pool.put(worker.getId(), worker);
        scoreboard.removeUser(userId);
        gameState.removeUser(userId);
        userStatuses.removeUser(userId);
        logger.info("User {} disconnected, worker {} returned", userId, worker.getId());

        respond(ctx, request, HttpResponseStatus.OK, "worker successfully returned to pool");
    }

    private void handleServerState(ChannelHandlerContext ctx, FullHttpRequest request) {
        ObjectNode state = objectMapper.createObjectNode();
        state.put("workerCount", pool.getAvailableWorkerCount());
        state.put("coinCount", gameState.getCoinCount());
        state.put("itemCount", gameState.getItemCount());

        try {
            respond(ctx, request, HttpResponseStatus.OK, objectMapper.writeValueAsString(state),
                    HttpHeaderValues.APPLICATION_JSON.toString());
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize server state", e);
            respond(ctx, request, HttpResponseStatus.INTERNAL_SERVER_ERROR, "server state unavailable");
        }
    }

    private void respond(ChannelHandlerContext ctx, FullHttpRequest request,
                         HttpResponseStatus status, String body) {
        respond(ctx, request, status, body, HttpHeaderValues.TEXT_PLAIN.toString());
    }

    private void respond(ChannelHandlerContext ctx, FullHttpRequest request,
                         HttpResponseStatus status, String body, String contentType) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status, Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        HttpUtil.setContentLength(response, response.content().readableBytes());

        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    private static InetAddress remoteIp(SocketAddress remote) {
        if (remote instanceof InetSocketAddress) {
            return ((InetSocketAddress) remote).getAddress();
        }
        return null;
    }

    private static int parsePort(String text) {
        try {
            int port = Integer.parseInt(text);
            return port > 0 && port <= 65535 ? port : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("HTTP error", cause);
        ctx.close();
    }
}
