package com.chaincustody.node;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Node JSON-RPC transport over WebClient with Basic auth. Bitcoin Core answers RPC errors with HTTP 4xx/5xx and a
 * JSON body, so such bodies are passed through for {@link NodeClient} to classify.
 */
public class WebClientNodeRpcTransport implements NodeRpcTransport {

    private final WebClient webClient;
    private final String username;
    private final String password;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientNodeRpcTransport(WebClient.Builder builder, String username, String password, Duration timeout) {
        this.webClient = builder.build();
        this.username = username;
        this.password = password;
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String url, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "1.0",
                "id", requestIds.incrementAndGet(),
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> h.setBasicAuth(username, password))
                .bodyValue(body)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(text -> {
                            int status = response.statusCode().value();
                            if (response.statusCode().is2xxSuccessful() || text.contains("\"error\"")) {
                                return Mono.just(text);
                            }
                            if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
                                return Mono.error(RpcException.fatal("Node rejected credentials (HTTP " + status + ")", null));
                            }
                            return Mono.error(RpcException.transientFailure("HTTP " + status + " from node", null));
                        }))
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof RpcException),
                        e -> RpcException.transientFailure(method + " failed: " + messageOf(e), e));
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
