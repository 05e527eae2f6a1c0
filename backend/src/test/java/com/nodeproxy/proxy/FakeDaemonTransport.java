package com.nodeproxy.proxy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodeproxy.rpc.DaemonTransport;
import com.nodeproxy.rpc.RpcResponse;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted daemon: per-method default response plus one-shot responses consumed first. Records every call.
 */
class FakeDaemonTransport implements DaemonTransport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    record Call(String method, Object params) {
    }

    private final Map<String, RpcResponse> defaults = new ConcurrentHashMap<>();
    private final Map<String, Deque<RpcResponse>> oneShots = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile long delayMs;

    static RpcResponse ok(String resultFieldsJson) {
        return RpcResponse.of("OK", json("{\"status\":\"OK\"," + resultFieldsJson + "}"));
    }

    static RpcResponse status(String status) {
        return RpcResponse.of(status, json("{\"status\":\"" + status + "\"}"));
    }

    static JsonNode json(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    void respond(String method, RpcResponse response) {
        defaults.put(method, response);
    }

    void respondOnce(String method, RpcResponse response) {
        oneShots.computeIfAbsent(method, m -> new ArrayDeque<>()).add(response);
    }

    void setDelayMs(long delayMs) {
        this.delayMs = delayMs;
    }

    @Override
    public RpcResponse invoke(String method, Object params) {
        calls.add(new Call(method, params));
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        Deque<RpcResponse> queue = oneShots.get(method);
        if (queue != null) {
            synchronized (queue) {
                RpcResponse next = queue.poll();
                if (next != null) {
                    return next;
                }
            }
        }
        return defaults.getOrDefault(method, RpcResponse.unreachable());
    }

    int callCount(String method) {
        return (int) calls.stream().filter(c -> c.method().equals(method)).count();
    }

    int totalCalls() {
        return calls.size();
    }

    Object lastParams(String method) {
        Object params = null;
        for (Call call : calls) {
            if (call.method().equals(method)) {
                params = call.params();
            }
        }
        return params;
    }
}
