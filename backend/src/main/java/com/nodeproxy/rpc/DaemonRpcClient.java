package com.nodeproxy.rpc;

import reactor.core.publisher.Mono;

/**
 * Daemon JSON-RPC client abstraction for testing. Blocking, timeouts and throttling are handled by
 * {@link JsonRpcDaemonTransport}.
 */
public interface DaemonRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl full JSON-RPC URL, e.g. http://127.0.0.1:22023/json_rpc
     * @param method      e.g. "get_info"
     * @param params      method params object
     * @return response body as string (JSON); errors on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
