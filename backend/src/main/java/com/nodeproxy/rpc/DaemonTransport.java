package com.nodeproxy.rpc;

/**
 * Blocking request/response call against the daemon's JSON-RPC interface.
 * Implementations never throw for transport problems; they report them as {@link RpcResponse#unreachable()}.
 */
public interface DaemonTransport {

    /**
     * @param method JSON-RPC method, e.g. "get_info"
     * @param params request object; empty map for parameterless calls
     */
    RpcResponse invoke(String method, Object params);
}
