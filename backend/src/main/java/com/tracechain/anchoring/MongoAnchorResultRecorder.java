package com.tracechain.anchoring;

import com.tracechain.domain.AnchorRecord;
import com.tracechain.domain.EntityKind;
import com.tracechain.domain.LedgerId;
import com.tracechain.domain.UnifiedTransactionStatus;
import com.tracechain.ledger.TransactionStatusReport;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Upserts anchor_records keyed by (entityKind, entityId, ledger).
 */
@Component
@RequiredArgsConstructor
public class MongoAnchorResultRecorder implements AnchorResultRecorder {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public void record(EntityKind entityKind, String entityId, String txHandle, LedgerId ledger,
                       UnifiedTransactionStatus status) {
        Instant now = clock.instant();
        Update update = new Update()
                .set("txHandle", txHandle)
                .set("status", status)
                .unset("blockReference")
                .unset("confirmations")
                .unset("lastError")
                .set("submittedAt", now)
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);
        mongoTemplate.upsert(key(entityKind, entityId, ledger), update, AnchorRecord.class);
    }

    @Override
    public void recordStatus(EntityKind entityKind, String entityId, TransactionStatusReport report) {
        Update update = new Update()
                .set("status", report.status())
                .set("updatedAt", clock.instant());
        if (report.blockReference() != null) {
            update.set("blockReference", report.blockReference());
        }
        if (report.confirmations() != null) {
            update.set("confirmations", report.confirmations());
        }
        if (report.error() != null) {
            update.set("lastError", report.error());
        } else {
            update.unset("lastError");
        }
        Query query = key(entityKind, entityId, report.ledger()).addCriteria(Criteria.where("txHandle").is(report.txHandle()));
        mongoTemplate.updateFirst(query, update, AnchorRecord.class);
    }

    private static Query key(EntityKind entityKind, String entityId, LedgerId ledger) {
        return Query.query(Criteria.where("entityKind").is(entityKind)
                .and("entityId").is(entityId)
                .and("ledger").is(ledger));
    }
}
