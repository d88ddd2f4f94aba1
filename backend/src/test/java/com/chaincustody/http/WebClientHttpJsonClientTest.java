package com.chaincustody.http;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientHttpJsonClientTest {

    private static final String URL = "https://api.etherscan.io/v2/api?module=account&apikey=SECRET";

    private static WebClient.Builder respondingWith(HttpStatus status, String body, AtomicReference<ClientRequest> seen) {
        return WebClient.builder().exchangeFunction(request -> {
            seen.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
        });
    }

    @Test
    void get_returnsBodyAndSendsHeaders() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        HttpJsonClient client = new WebClientHttpJsonClient(respondingWith(HttpStatus.OK, "{\"status\":\"1\"}", seen),
                Duration.ofSeconds(2));

        StepVerifier.create(client.get(URL, Map.of("TRON-PRO-API-KEY", "k")))
                .expectNext("{\"status\":\"1\"}")
                .verifyComplete();
        assertThat(seen.get().url().toString()).isEqualTo(URL);
        assertThat(seen.get().headers().getFirst("TRON-PRO-API-KEY")).isEqualTo("k");
    }

    @Test
    void get_serverError_upstreamExceptionWithoutQueryString() {
        HttpJsonClient client = new WebClientHttpJsonClient(
                respondingWith(HttpStatus.BAD_GATEWAY, "oops", new AtomicReference<>()), Duration.ofSeconds(2));

        StepVerifier.create(client.get(URL))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamException.class);
                    assertThat(e.getMessage()).contains("api.etherscan.io").contains("502").doesNotContain("SECRET");
                })
                .verify();
    }

    @Test
    void post_timeout_upstreamException() {
        WebClient.Builder never = WebClient.builder().exchangeFunction(request -> Mono.never());
        HttpJsonClient client = new WebClientHttpJsonClient(never, Duration.ofMillis(50));

        StepVerifier.create(client.post("https://api.trongrid.io/wallet/getchainparameters", Map.of(), Map.of()))
                .expectError(UpstreamException.class)
                .verify(Duration.ofSeconds(5));
    }
}
