package com.nodeproxy.rpc;

/**
 * Thrown when a daemon RPC call fails (HTTP, timeout, local limiter or malformed JSON-RPC body).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
