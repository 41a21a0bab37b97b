package com.tracechain.anchoring;

import com.tracechain.anchoring.config.AnchoringProperties;
import com.tracechain.domain.AnchorRecord;
import com.tracechain.domain.AnchorRecordRepository;
import com.tracechain.domain.UnifiedTransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Periodically re-polls anchors that are not yet CONFIRMED or FAILED. One failing anchor does not stop the rest.
 * An anchor whose current transaction was submitted more than {@code status-poll-max-age-hours} ago is left as is;
 * status updates do not extend that horizon, re-anchoring does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnchorStatusPollJob {

    private final AnchorRecordRepository anchorRecordRepository;
    private final AnchoringService anchoringService;
    private final AnchoringProperties properties;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${tracechain.anchoring.status-poll-interval-ms:60000}",
            initialDelayString = "${tracechain.anchoring.status-poll-interval-ms:60000}")
    public void runScheduled() {
        pollOnce();
    }

    /** @return number of anchors polled */
    public int pollOnce() {
        EnumSet<UnifiedTransactionStatus> open = EnumSet.noneOf(UnifiedTransactionStatus.class);
        for (UnifiedTransactionStatus status : UnifiedTransactionStatus.values()) {
            if (!status.isTerminal()) {
                open.add(status);
            }
        }
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getStatusPollMaxAgeHours()));
        List<AnchorRecord> records = anchorRecordRepository.findByStatusIn(open);
        int polled = 0;
        for (AnchorRecord record : records) {
            Instant submittedAt = record.getSubmittedAt() != null ? record.getSubmittedAt() : record.getCreatedAt();
            if (submittedAt != null && submittedAt.isBefore(cutoff)) {
                continue;
            }
            try {
                if (anchoringService.refreshStatus(record) != null) {
                    polled++;
                }
            } catch (RuntimeException e) {
                log.warn("Status poll failed for {} {} on {}: {}", record.getEntityKind(), record.getEntityId(),
                        record.getLedger(), e.getMessage());
            }
        }
        if (polled > 0) {
            log.debug("Polled {} open anchor(s)", polled);
        }
        return polled;
    }
}
