package com.example.chainstream.rpc;

/**
 * A transient failure reading chain state from the upstream node: network error, timeout,
 * unexpected HTTP status, JSON-RPC error object or a malformed result. The message is prefixed
 * with the JSON-RPC method whose call failed.
 */
public class UpstreamException extends Exception {

    public UpstreamException(String method, String message) {
        super(method + ": " + message);
    }

    public UpstreamException(String method, String message, Throwable cause) {
        super(method + ": " + message, cause);
    }
}
