package com.nodeproxy.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Outcome of one blocking daemon call.
 *
 * @param ok     false when the daemon could not be reached at all (no response, timeout)
 * @param status the response {@code status}; empty means no usable connection
 * @param result the JSON-RPC {@code result} object, {@link MissingNode} when absent
 */
public record RpcResponse(boolean ok, String status, JsonNode result) {

    public RpcResponse {
        status = status != null ? status : "";
        result = result != null ? result : MissingNode.getInstance();
    }

    public static RpcResponse unreachable() {
        return new RpcResponse(false, "", MissingNode.getInstance());
    }

    public static RpcResponse of(String status, JsonNode result) {
        return new RpcResponse(true, status, result);
    }

    public boolean isStatusOk() {
        return ok && RpcStatus.OK.equals(status);
    }
}
