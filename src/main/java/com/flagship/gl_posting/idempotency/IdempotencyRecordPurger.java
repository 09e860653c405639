package com.flagship.gl_posting.idempotency;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Deletes expired idempotency rows. Expired rows are already ignored by the
 * gate; this only keeps the table from growing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdempotencyRecordPurger {

    private final IdempotencyRecordRepository repository;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${idempotency.purge-interval-ms:3600000}")
    @Transactional
    public void purgeExpired() {
        int deleted = repository.deleteExpired(clock.instant());
        if (deleted > 0) {
            log.info("Purged {} expired idempotency records", deleted);
        }
    }
}
