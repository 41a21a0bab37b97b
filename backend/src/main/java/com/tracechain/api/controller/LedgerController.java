package com.tracechain.api.controller;

import com.tracechain.anchoring.AnchoringService;
import com.tracechain.domain.LedgerId;
import com.tracechain.ledger.LedgerClientRegistry;
import com.tracechain.ledger.TransactionStatusReport;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Set;

/**
 * Enabled ledgers and unified transaction status.
 */
@RestController
@RequestMapping("/api/v1/ledgers")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerClientRegistry ledgerClients;
    private final AnchoringService anchoringService;

    @GetMapping
    public Set<LedgerId> enabled() {
        return ledgerClients.enabledLedgers();
    }

    @GetMapping("/{ledger}/transactions/{txHandle}")
    public Mono<TransactionStatusReport> transactionStatus(@PathVariable String ledger, @PathVariable String txHandle) {
        LedgerId ledgerId = LedgerId.fromKey(ledger);
        return Mono.fromCallable(() -> anchoringService.transactionStatus(ledgerId, txHandle))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
