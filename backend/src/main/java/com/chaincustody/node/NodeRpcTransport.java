package com.chaincustody.node;

import reactor.core.publisher.Mono;

/**
 * JSON-RPC 1.0 transport to a full node. Retries and result parsing are handled by {@link NodeClient}.
 */
public interface NodeRpcTransport {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param url    node URL, or the wallet-scoped URL {@code <node>/wallet/<name>}
     * @param method e.g. "listtransactions"
     * @param params positional params
     * @return response body (JSON), including bodies that carry an {@code error} object;
     * errors with {@link RpcException} when no RPC response could be obtained
     */
    Mono<String> call(String url, String method, Object params);
}
