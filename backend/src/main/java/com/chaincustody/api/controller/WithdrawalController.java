package com.chaincustody.api.controller;

import com.chaincustody.api.dto.BroadcastReportRequest;
import com.chaincustody.api.dto.ErrorBody;
import com.chaincustody.api.dto.SignedTransactionRequest;
import com.chaincustody.api.dto.WithdrawalSubmitRequest;
import com.chaincustody.domain.WithdrawalOutcome;
import com.chaincustody.settlement.WithdrawalQueue;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Withdrawal settlement endpoints. A SETTLED outcome answers 202: the ledger is debited and the record is
 * PENDING until the broadcast confirms.
 */
@RestController
@RequestMapping("/api/v1/withdrawals")
@RequiredArgsConstructor
public class WithdrawalController {

    private final WithdrawalQueue withdrawalQueue;

    @PostMapping
    public Mono<ResponseEntity<?>> submit(@Valid @RequestBody WithdrawalSubmitRequest request) {
        return toResponse(withdrawalQueue.submit(request.toRequest()));
    }

    @PostMapping("/{transactionId}/redispatch")
    public Mono<ResponseEntity<?>> redispatch(@PathVariable String transactionId) {
        return toResponse(withdrawalQueue.redispatch(transactionId));
    }

    /** Signer callback with the signed payload, broadcast through the node. */
    @PostMapping("/{transactionId}/signed")
    public Mono<ResponseEntity<?>> signed(@PathVariable String transactionId,
                                          @Valid @RequestBody SignedTransactionRequest request) {
        return toResponse(withdrawalQueue.attachSignedTransaction(transactionId, request.signedTransaction()));
    }

    /** Signer callback after it broadcast the withdrawal itself. */
    @PostMapping("/{transactionId}/broadcast")
    public Mono<ResponseEntity<?>> broadcast(@PathVariable String transactionId,
                                             @Valid @RequestBody BroadcastReportRequest request) {
        return toResponse(withdrawalQueue.recordBroadcast(transactionId, request.hash()));
    }

    private static Mono<ResponseEntity<?>> toResponse(CompletableFuture<WithdrawalOutcome> future) {
        return Mono.fromFuture(future).<ResponseEntity<?>>map(outcome -> {
            if (outcome.isSettled()) {
                return ResponseEntity.accepted().body(outcome);
            }
            return ResponseEntity.status(ApiExceptionHandler.statusOf(outcome.errorCode()))
                    .body(ErrorBody.of(outcome.errorCode().name(), outcome.message()));
        });
    }
}
