package com.tracechain.api.controller;

import com.tracechain.anchoring.AnchorOutcome;
import com.tracechain.anchoring.AnchoringService;
import com.tracechain.domain.AnchorRecord;
import com.tracechain.domain.EntityKind;
import com.tracechain.domain.LedgerId;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * POST /anchors/{entityKind}/{entityId} submits a record's hash; GET lists its anchors per ledger.
 */
@RestController
@RequestMapping("/api/v1/anchors")
@RequiredArgsConstructor
public class AnchorController {

    private final AnchoringService anchoringService;

    @PostMapping("/{entityKind}/{entityId}")
    public Mono<ResponseEntity<AnchorOutcome>> anchor(@PathVariable String entityKind,
                                                      @PathVariable String entityId,
                                                      @RequestParam(defaultValue = "ethereum") String ledger) {
        EntityKind kind = kind(entityKind);
        LedgerId ledgerId = LedgerId.fromKey(ledger);
        return Mono.fromCallable(() -> anchoringService.anchor(kind, entityId, ledgerId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(outcome -> ResponseEntity.status(HttpStatus.ACCEPTED).body(outcome));
    }

    @GetMapping("/{entityKind}/{entityId}")
    public List<AnchorRecord> anchors(@PathVariable String entityKind, @PathVariable String entityId) {
        return anchoringService.findAnchors(kind(entityKind), entityId);
    }

    private static EntityKind kind(String value) {
        EntityKind kind = EntityKind.fromKeyOrNull(value);
        if (kind == null) {
            throw new IllegalArgumentException("Unsupported entity kind: " + value);
        }
        return kind;
    }
}
