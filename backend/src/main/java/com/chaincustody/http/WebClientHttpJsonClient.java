package com.chaincustody.http;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpJsonClient} over WebClient. URLs are used as-is, without template expansion.
 */
public class WebClientHttpJsonClient implements HttpJsonClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientHttpJsonClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> get(String url, Map<String, String> headers) {
        return webClient.get()
                .uri(URI.create(url))
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> headers.forEach(h::set))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(e -> new UpstreamException("GET " + hostOf(url) + " failed: " + describe(e), e));
    }

    @Override
    public Mono<String> post(String url, Object body, Map<String, String> headers) {
        return webClient.post()
                .uri(URI.create(url))
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> headers.forEach(h::set))
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(e -> new UpstreamException("POST " + hostOf(url) + " failed: " + describe(e), e));
    }

    // response exceptions carry the full URI, API key included
    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            return "HTTP " + response.getStatusCode().value();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return "invalid-url";
        }
    }
}
