package com.nodeproxy.proxy;

/**
 * Why a cached daemon query could not produce a value.
 */
public enum FailureKind {
    /** Proxy constructed offline; no transport attempted. */
    OFFLINE,
    /** Transport call itself failed: no response or timeout. */
    UNREACHABLE,
    /** Response received with an empty status. */
    NO_CONNECTION,
    /** Daemon reported it is busy. */
    BUSY,
    /** Daemon processed the request but reported an application-level error. */
    ERROR_STATUS
}
