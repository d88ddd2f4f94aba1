package com.chaincustody.node;

/**
 * Thrown when a node RPC call fails. TRANSIENT failures (connectivity, timeout, 5xx without an RPC error body)
 * are retryable; FATAL ones (JSON-RPC error object, authentication) are not.
 */
public class RpcException extends RuntimeException {

    public enum Kind {
        TRANSIENT,
        FATAL
    }

    private final Kind kind;
    private final Integer code;

    public RpcException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public RpcException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public RpcException(Kind kind, String message, Integer code, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public static RpcException transientFailure(String message, Throwable cause) {
        return new RpcException(Kind.TRANSIENT, message, cause);
    }

    public static RpcException fatal(String message, Integer code) {
        return new RpcException(Kind.FATAL, message, code, null);
    }

    public Kind getKind() {
        return kind;
    }

    /** JSON-RPC error code when the node returned one. */
    public Integer getCode() {
        return code;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }
}
