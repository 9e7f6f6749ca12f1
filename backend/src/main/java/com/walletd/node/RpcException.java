package com.walletd.node;

/**
 * Node request failed (transport error, RPC error payload, unparseable response). Transient from the
 * wallet's point of view: the caller retries on its next trigger.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
