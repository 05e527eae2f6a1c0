package com.nodeproxy.proxy;

/**
 * Human-readable failure of a daemon query.
 *
 * @param method daemon method that failed, null for {@link FailureKind#OFFLINE}
 */
public record RpcFailure(FailureKind kind, String method, String description) {

    public static final String OFFLINE_DESCRIPTION = "offline";

    private static final RpcFailure OFFLINE = new RpcFailure(FailureKind.OFFLINE, null, OFFLINE_DESCRIPTION);

    public static RpcFailure offline() {
        return OFFLINE;
    }

    public static RpcFailure unreachable(String method) {
        return new RpcFailure(FailureKind.UNREACHABLE, method, "Failed to connect to daemon during " + method);
    }

    public static RpcFailure noConnection(String method) {
        return new RpcFailure(FailureKind.NO_CONNECTION, method, "No connection to daemon during " + method);
    }

    public static RpcFailure busy(String method) {
        return new RpcFailure(FailureKind.BUSY, method, "Daemon busy during " + method);
    }

    public static RpcFailure errorStatus(String method, String status) {
        return new RpcFailure(FailureKind.ERROR_STATUS, method, "Error calling " + method + " daemon RPC: " + status);
    }

    @Override
    public String toString() {
        return description;
    }
}
