package com.nodeproxy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodeproxy.common.ExclusiveAccessGuard;
import com.nodeproxy.common.ReentrantExclusiveAccessGuard;
import com.nodeproxy.proxy.NodeRpcProxy;
import com.nodeproxy.rpc.DaemonRpcClient;
import com.nodeproxy.rpc.DaemonTransport;
import com.nodeproxy.rpc.JsonRpcDaemonTransport;
import com.nodeproxy.rpc.WebClientDaemonRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the daemon transport, the shared access guard and the caching proxy from nodeproxy.daemon.* settings.
 */
@Configuration
@EnableConfigurationProperties(NodeProxyProperties.class)
public class NodeProxyConfig {

    public static final String DAEMON_RPC_RATE_LIMITER = "daemonRpcRateLimiter";

    @Bean
    public Clock daemonProxyClock() {
        return Clock.systemUTC();
    }

    @Bean(name = DAEMON_RPC_RATE_LIMITER)
    public RateLimiter daemonRpcRateLimiter(NodeProxyProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("daemon-rpc", config);
    }

    @Bean
    public DaemonRpcClient daemonRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientDaemonRpcClient(webClientBuilder);
    }

    @Bean
    public DaemonTransport daemonTransport(
            DaemonRpcClient daemonRpcClient,
            @Qualifier(DAEMON_RPC_RATE_LIMITER) RateLimiter rateLimiter,
            ObjectMapper objectMapper,
            NodeProxyProperties properties
    ) {
        return new JsonRpcDaemonTransport(
                daemonRpcClient,
                rateLimiter,
                objectMapper,
                properties.getUrl(),
                Duration.ofMillis(properties.getRpcTimeoutMs()),
                properties.getLocalLimiterLogThresholdMs());
    }

    /** One guard per daemon connection, shared by every accessor of the proxy. */
    @Bean
    public ExclusiveAccessGuard daemonAccessGuard() {
        return new ReentrantExclusiveAccessGuard();
    }

    @Bean
    public NodeRpcProxy nodeRpcProxy(
            DaemonTransport daemonTransport,
            ExclusiveAccessGuard daemonAccessGuard,
            Clock daemonProxyClock,
            NodeProxyProperties properties
    ) {
        return new NodeRpcProxy(
                daemonTransport,
                daemonAccessGuard,
                properties.isOffline(),
                daemonProxyClock,
                Duration.ofMillis(properties.getInfoRefreshIntervalMs()));
    }
}
