package com.venueops.idempotency.scheduler;

import com.venueops.idempotency.repository.IdempotencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 만료된 멱등성 레코드 정리.
 *
 * <p>조회 시점에도 만료 레코드는 없는 것으로 취급되므로 이 작업은 테이블 크기 관리용이다.
 * ShedLock으로 여러 인스턴스 중 하나만 실행한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "venue-ops.idempotency.purge-enabled", havingValue = "true", matchIfMissing = true)
public class IdempotencyPurgeJob {

    private final IdempotencyRecordRepository repository;

    @Scheduled(fixedDelayString = "${venue-ops.idempotency.purge-interval-ms:900000}")
    @SchedulerLock(name = "idempotencyPurge", lockAtMostFor = "5m", lockAtLeastFor = "30s")
    @Transactional
    public void purgeExpired() {
        int deleted = repository.deleteAllExpired(LocalDateTime.now());
        if (deleted > 0) {
            log.info("Purged expired idempotency records: count={}", deleted);
        }
    }
}
