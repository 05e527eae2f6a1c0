package com.nodeproxy.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Daemon connection, cache refresh and local throttling settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "nodeproxy.daemon")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class NodeProxyProperties {

    /** Daemon base URL; /json_rpc is appended. */
    @NotBlank
    private String url = "http://127.0.0.1:22023";

    /** When true every network-touching query fails with "offline" and the daemon is never contacted. */
    private boolean offline = false;

    /** Upper bound for one daemon call (3 min 30 s). A timeout counts as an unreachable daemon. */
    @Positive
    private long rpcTimeoutMs = 210_000;

    /** How long get_info results (height, target height, block weight limit) are reused. */
    @Positive
    private long infoRefreshIntervalMs = 30_000;

    /** Local daemon RPC budget (requests per second) for this process. */
    @Positive
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a local limiter permit before it is reported as unreachable. */
    private long localLimiterTimeoutMs = 2_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;
}
