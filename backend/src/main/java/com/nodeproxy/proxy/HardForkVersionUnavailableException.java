package com.nodeproxy.proxy;

import com.nodeproxy.rpc.RpcException;

/**
 * The daemon's current hard fork version could not be read. Fatal to the calling operation.
 */
public class HardForkVersionUnavailableException extends RpcException {

    public HardForkVersionUnavailableException(String message) {
        super(message);
    }
}
