package com.nodeproxy.proxy;

import com.nodeproxy.rpc.RpcResponse;
import com.nodeproxy.rpc.RpcStatus;

import java.util.Optional;

/**
 * Classifies a transport response: unreachable, empty status, busy, non-OK, or usable.
 */
public final class DaemonResponseValidator {

    private DaemonResponseValidator() {
    }

    /**
     * @return the failure, or empty when the response status is OK
     */
    public static Optional<RpcFailure> validate(String method, RpcResponse response) {
        if (response == null || !response.ok()) {
            return Optional.of(RpcFailure.unreachable(method));
        }
        String status = response.status();
        if (status.isEmpty()) {
            return Optional.of(RpcFailure.noConnection(method));
        }
        if (RpcStatus.BUSY.equals(status)) {
            return Optional.of(RpcFailure.busy(method));
        }
        if (!response.isStatusOk()) {
            return Optional.of(RpcFailure.errorStatus(method, status));
        }
        return Optional.empty();
    }
}
