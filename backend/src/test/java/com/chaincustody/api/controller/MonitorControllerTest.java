package com.chaincustody.api.controller;

import com.chaincustody.chain.UnsupportedChainException;
import com.chaincustody.deposit.monitor.DepositMonitor;
import com.chaincustody.deposit.monitor.DepositMonitorSupervisor;
import com.chaincustody.deposit.monitor.MonitorNotFoundException;
import com.chaincustody.deposit.monitor.MonitorStatus;
import com.chaincustody.node.RpcException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = MonitorController.class)
class MonitorControllerTest {

    private static final String ADDRESS = "0x742d35Cc6634C0532925a3b844Bc454e4438f44e";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    DepositMonitorSupervisor supervisor;

    private static MonitorStatus status(DepositMonitor.RunState state) {
        return new MonitorStatus("w1", "ETH", ADDRESS, state, 0, null, 0, null);
    }

    @Test
    void register_created() {
        when(supervisor.register("w1", "ETH", ADDRESS)).thenReturn(status(DepositMonitor.RunState.RUNNING));

        webTestClient.post().uri("/api/v1/monitors")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"walletId\":\"w1\",\"chain\":\"ETH\",\"address\":\"" + ADDRESS + "\"}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.state").isEqualTo("RUNNING");
    }

    @Test
    void register_unknownChain_badRequest() {
        when(supervisor.register("w1", "XRP", "r1")).thenThrow(new UnsupportedChainException("XRP"));

        webTestClient.post().uri("/api/v1/monitors")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"walletId\":\"w1\",\"chain\":\"XRP\",\"address\":\"r1\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNSUPPORTED_CHAIN");
    }

    @Test
    void list_returnsStatuses() {
        when(supervisor.statuses()).thenReturn(List.of(status(DepositMonitor.RunState.FAILED)));

        webTestClient.get().uri("/api/v1/monitors")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].state").isEqualTo("FAILED")
                .jsonPath("$[0].chain").isEqualTo("ETH");
    }

    @Test
    void restart_unknownMonitor_notFound() {
        when(supervisor.restart("ETH", ADDRESS)).thenThrow(new MonitorNotFoundException("ETH", ADDRESS));

        webTestClient.post().uri("/api/v1/monitors/ETH/{address}/restart", ADDRESS)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("MONITOR_NOT_FOUND");
    }

    @Test
    void rescan_accepted() throws Exception {
        when(supervisor.rescan("BTC", 800000)).thenReturn(new ObjectMapper().readTree("{\"start_height\":800000,\"stop_height\":800100}"));

        webTestClient.post().uri("/api/v1/monitors/BTC/rescan?fromHeight=800000")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.stop_height").isEqualTo(800100);
    }

    @Test
    void rescan_nodeDown_badGateway() {
        when(supervisor.rescan("BTC", 0)).thenThrow(RpcException.transientFailure("connection refused", null));

        webTestClient.post().uri("/api/v1/monitors/BTC/rescan")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("UPSTREAM_UNAVAILABLE");
    }
}
