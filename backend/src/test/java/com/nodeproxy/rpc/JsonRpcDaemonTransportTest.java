package com.nodeproxy.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JsonRpcDaemonTransportTest {

    private static final String DAEMON = "http://daemon.test:22023";
    private static final String ENDPOINT = DAEMON + "/json_rpc";

    @Mock
    private DaemonRpcClient rpcClient;

    private JsonRpcDaemonTransport transport;

    @BeforeEach
    void setUp() {
        transport = new JsonRpcDaemonTransport(rpcClient, limiter(1_000, Duration.ofSeconds(1)), new ObjectMapper(),
                DAEMON, Duration.ofMillis(500), 100);
    }

    private static RateLimiter limiter(int perSecond, Duration timeout) {
        return RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(perSecond)
                .timeoutDuration(timeout)
                .build());
    }

    @Test
    @DisplayName("OK response exposes status and result object")
    void okResponse() {
        when(rpcClient.call(ENDPOINT, "get_info", Map.of()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":\"0\",\"result\":{\"status\":\"OK\",\"height\":1234}}"));

        RpcResponse response = transport.invoke("get_info", Map.of());

        assertThat(response.ok()).isTrue();
        assertThat(response.status()).isEqualTo(RpcStatus.OK);
        assertThat(response.isStatusOk()).isTrue();
        assertThat(response.result().path("height").asLong()).isEqualTo(1234L);
    }

    @Test
    @DisplayName("BUSY status is passed through")
    void busyResponse() {
        when(rpcClient.call(eq(ENDPOINT), eq("get_fee_estimate"), any()))
                .thenReturn(Mono.just("{\"result\":{\"status\":\"BUSY\"}}"));

        RpcResponse response = transport.invoke("get_fee_estimate", Map.of("grace_blocks", 10L));

        assertThat(response.ok()).isTrue();
        assertThat(response.status()).isEqualTo(RpcStatus.BUSY);
    }

    @Test
    @DisplayName("JSON-RPC error object becomes a named non-OK status")
    void jsonRpcError() {
        when(rpcClient.call(eq(ENDPOINT), eq("hard_fork_info"), any()))
                .thenReturn(Mono.just("{\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}"));

        RpcResponse response = transport.invoke("hard_fork_info", Map.of("version", 7));

        assertThat(response.ok()).isTrue();
        assertThat(response.status()).isEqualTo("Method not found");
        assertThat(response.result().isMissingNode()).isTrue();
    }

    @Test
    @DisplayName("error object with code 0 is not an error")
    void zeroCodeErrorIgnored() {
        when(rpcClient.call(eq(ENDPOINT), eq("get_info"), any()))
                .thenReturn(Mono.just("{\"error\":{\"code\":0,\"message\":\"\"},\"result\":{\"status\":\"OK\",\"height\":9}}"));

        RpcResponse response = transport.invoke("get_info", Map.of());

        assertThat(response.isStatusOk()).isTrue();
        assertThat(response.result().path("height").asLong()).isEqualTo(9L);
    }

    @Test
    @DisplayName("missing result yields an empty status")
    void missingResult() {
        when(rpcClient.call(anyString(), anyString(), any())).thenReturn(Mono.just("{\"jsonrpc\":\"2.0\"}"));

        RpcResponse response = transport.invoke("get_version", Map.of());

        assertThat(response.ok()).isTrue();
        assertThat(response.status()).isEmpty();
    }

    @Test
    @DisplayName("HTTP failure is reported as unreachable")
    void httpFailure() {
        when(rpcClient.call(anyString(), anyString(), any())).thenReturn(Mono.error(new RpcException("503 Service Unavailable")));

        RpcResponse response = transport.invoke("get_info", Map.of());

        assertThat(response.ok()).isFalse();
    }

    @Test
    @DisplayName("timeout is reported as unreachable")
    void timeout() {
        when(rpcClient.call(anyString(), anyString(), any())).thenReturn(Mono.never());

        RpcResponse response = transport.invoke("get_info", Map.of());

        assertThat(response.ok()).isFalse();
    }

    @Test
    @DisplayName("malformed body is reported as unreachable")
    void malformedBody() {
        when(rpcClient.call(anyString(), anyString(), any())).thenReturn(Mono.just("not json"));

        assertThat(transport.invoke("get_info", Map.of()).ok()).isFalse();
    }

    @Test
    @DisplayName("limiter refusal is reported as unreachable without calling the daemon")
    void limiterRefusal() {
        JsonRpcDaemonTransport throttled = new JsonRpcDaemonTransport(rpcClient, limiter(1, Duration.ZERO),
                new ObjectMapper(), DAEMON, Duration.ofMillis(500), 100);
        when(rpcClient.call(anyString(), anyString(), any())).thenReturn(Mono.just("{\"result\":{\"status\":\"OK\"}}"));

        assertThat(throttled.invoke("get_info", Map.of()).ok()).isTrue();
        assertThat(throttled.invoke("get_version", Map.of()).ok()).isFalse();
        verify(rpcClient, never()).call(anyString(), eq("get_version"), any());
    }

    @Test
    @DisplayName("endpoint URL gets /json_rpc appended exactly once")
    void endpointUrl() {
        ObjectMapper mapper = new ObjectMapper();
        RateLimiter rl = limiter(10, Duration.ZERO);
        assertThat(new JsonRpcDaemonTransport(rpcClient, rl, mapper, DAEMON + "/", Duration.ofSeconds(1), 100).getEndpointUrl())
                .isEqualTo(ENDPOINT);
        assertThat(new JsonRpcDaemonTransport(rpcClient, rl, mapper, ENDPOINT, Duration.ofSeconds(1), 100).getEndpointUrl())
                .isEqualTo(ENDPOINT);
        assertThatThrownBy(() -> new JsonRpcDaemonTransport(rpcClient, rl, mapper, " ", Duration.ofSeconds(1), 100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
