package com.chaincustody.api.controller;

import com.chaincustody.api.dto.RegisterAddressRequest;
import com.chaincustody.deposit.monitor.DepositMonitorSupervisor;
import com.chaincustody.deposit.monitor.MonitorStatus;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Operational surface of the deposit monitors. Calls that may reach a node run on boundedElastic.
 */
@RestController
@RequestMapping("/api/v1/monitors")
@RequiredArgsConstructor
public class MonitorController {

    private final DepositMonitorSupervisor supervisor;

    @GetMapping
    public ResponseEntity<List<MonitorStatus>> list() {
        return ResponseEntity.ok(supervisor.statuses());
    }

    @PostMapping
    public Mono<ResponseEntity<MonitorStatus>> register(@Valid @RequestBody RegisterAddressRequest request) {
        return Mono.fromCallable(() -> supervisor.register(request.walletId(), request.chain(), request.address().trim()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(status -> ResponseEntity.status(HttpStatus.CREATED).body(status));
    }

    @PostMapping("/{chain}/{address}/restart")
    public ResponseEntity<MonitorStatus> restart(@PathVariable String chain, @PathVariable String address) {
        return ResponseEntity.ok(supervisor.restart(chain, address));
    }

    @PostMapping("/{chain}/{address}/stop")
    public ResponseEntity<MonitorStatus> stop(@PathVariable String chain, @PathVariable String address) {
        return ResponseEntity.ok(supervisor.stop(chain, address));
    }

    /** Rescans the node wallet to pick up deposits made before addresses were imported. */
    @PostMapping("/{chain}/rescan")
    public Mono<ResponseEntity<JsonNode>> rescan(@PathVariable String chain,
                                                 @RequestParam(defaultValue = "0") long fromHeight) {
        return Mono.fromCallable(() -> supervisor.rescan(chain, fromHeight))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.accepted().body(result));
    }
}
