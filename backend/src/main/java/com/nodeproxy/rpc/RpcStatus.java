package com.nodeproxy.rpc;

/**
 * Reserved values of the {@code status} field in daemon RPC responses.
 */
public final class RpcStatus {

    public static final String OK = "OK";
    public static final String BUSY = "BUSY";

    private RpcStatus() {
    }
}
