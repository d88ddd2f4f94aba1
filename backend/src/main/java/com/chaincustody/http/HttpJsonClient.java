package com.chaincustody.http;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Outbound JSON-over-HTTP calls to explorers and third-party chain APIs. Errors with {@link UpstreamException}.
 */
public interface HttpJsonClient {

    Mono<String> get(String url, Map<String, String> headers);

    Mono<String> post(String url, Object body, Map<String, String> headers);

    default Mono<String> get(String url) {
        return get(url, Map.of());
    }
}
