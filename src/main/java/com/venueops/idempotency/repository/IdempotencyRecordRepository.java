package com.venueops.idempotency.repository;

import com.venueops.idempotency.entity.IdempotencyRecord;
import com.venueops.idempotency.entity.IdempotencyState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 멱등성 레코드 저장소.
 *
 * <p>예약/완료/해제는 각각 REQUIRES_NEW 트랜잭션으로 즉시 커밋된다.
 * 감싸는 작업의 트랜잭션이 롤백되어도 예약 상태는 남는다.</p>
 */
public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecord, String> {

    /** 키가 이미 있으면 PK 제약 위반(DataIntegrityViolationException) */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Modifying
    @Query(value = "INSERT INTO idempotency_records " +
            "(idempotency_key, request_fingerprint, operation, state, created_at, expires_at) " +
            "VALUES (:key, :fingerprint, :operation, 'IN_PROGRESS', :now, :expiresAt)",
            nativeQuery = true)
    int reserve(@Param("key") String key,
                @Param("fingerprint") String fingerprint,
                @Param("operation") String operation,
                @Param("now") LocalDateTime now,
                @Param("expiresAt") LocalDateTime expiresAt);

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Modifying
    @Query("UPDATE IdempotencyRecord r SET r.state = :completed, r.storedResponse = :response, " +
            "r.storedStatus = :status, r.expiresAt = :expiresAt " +
            "WHERE r.idempotencyKey = :key AND r.state = :inProgress")
    int complete(@Param("key") String key,
                 @Param("response") String response,
                 @Param("status") int status,
                 @Param("expiresAt") LocalDateTime expiresAt,
                 @Param("completed") IdempotencyState completed,
                 @Param("inProgress") IdempotencyState inProgress);

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Modifying
    @Query("DELETE FROM IdempotencyRecord r WHERE r.idempotencyKey = :key AND r.state = :inProgress")
    int deleteReservation(@Param("key") String key,
                          @Param("inProgress") IdempotencyState inProgress);

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Modifying
    @Query("DELETE FROM IdempotencyRecord r WHERE r.idempotencyKey = :key AND r.expiresAt <= :now")
    int deleteIfExpired(@Param("key") String key, @Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM IdempotencyRecord r WHERE r.expiresAt <= :now")
    int deleteAllExpired(@Param("now") LocalDateTime now);
}
