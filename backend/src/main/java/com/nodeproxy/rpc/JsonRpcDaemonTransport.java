package com.nodeproxy.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Blocking JSON-RPC transport to a single daemon. Each call waits for a local limiter permit, then blocks
 * on the reactive client for at most {@code rpcTimeout}. Every failure (HTTP error, timeout, limiter refusal,
 * unparsable body) is logged and reported as {@link RpcResponse#unreachable()}.
 */
@Slf4j
public class JsonRpcDaemonTransport implements DaemonTransport {

    static final String JSON_RPC_PATH = "/json_rpc";

    private final DaemonRpcClient rpcClient;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final String endpointUrl;
    private final Duration rpcTimeout;
    private final long limiterLogThresholdMs;

    public JsonRpcDaemonTransport(
            DaemonRpcClient rpcClient,
            RateLimiter rateLimiter,
            ObjectMapper objectMapper,
            String daemonUrl,
            Duration rpcTimeout,
            long limiterLogThresholdMs
    ) {
        if (daemonUrl == null || daemonUrl.isBlank()) {
            throw new IllegalArgumentException("daemonUrl is required");
        }
        this.rpcClient = rpcClient;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.endpointUrl = toEndpointUrl(daemonUrl);
        this.rpcTimeout = rpcTimeout;
        this.limiterLogThresholdMs = limiterLogThresholdMs;
    }

    @Override
    public RpcResponse invoke(String method, Object params) {
        try {
            String json = callRpc(method, params);
            return parse(method, json);
        } catch (Exception e) {
            log.warn("Daemon RPC {} on {} failed: {}", method, endpointUrl, messageOf(e));
            return RpcResponse.unreachable();
        }
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    private String callRpc(String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpointUrl);
        }
        if (waitedMs >= Math.max(1L, limiterLogThresholdMs)) {
            log.info("Local daemon RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpointUrl);
        }
        String json = rpcClient.call(endpointUrl, method, params).block(rpcTimeout);
        if (json == null) {
            throw new RpcException(method + " returned null");
        }
        return json;
    }

    RpcResponse parse(String method, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        // the daemon may send an error object with code 0 alongside a result
        JsonNode error = root.path("error");
        if (error.path("code").asLong() != 0) {
            String message = error.path("message").asText("");
            String status = message.isEmpty() ? "error " + error.path("code").asText() : message;
            return RpcResponse.of(status, MissingNode.getInstance());
        }
        JsonNode result = root.path("result");
        return RpcResponse.of(result.path("status").asText(""), result);
    }

    private static String toEndpointUrl(String daemonUrl) {
        String base = daemonUrl.endsWith("/") ? daemonUrl.substring(0, daemonUrl.length() - 1) : daemonUrl;
        return base.endsWith(JSON_RPC_PATH) ? base : base + JSON_RPC_PATH;
    }

    private static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
