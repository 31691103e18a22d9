package com.venueops.idempotency.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.idempotency.entity.IdempotencyRecord;
import com.venueops.idempotency.entity.IdempotencyState;
import com.venueops.idempotency.repository.IdempotencyRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 멱등성 저장소 (Idempotency Store)
 *
 * <p>외부에서 재시도되는 부수효과 작업을 "최대 한 번 적용"으로 만든다.
 * 같은 키의 두 번째 요청은 작업을 다시 실행하지 않고 첫 번째 응답을 그대로 돌려받는다.</p>
 *
 * <h3>처리 흐름</h3>
 * <pre>
 *   checkOrReserve(key, fingerprint)
 *     ├─ 레코드 없음 (또는 만료)   → INSERT IN_PROGRESS → PROCEED
 *     ├─ 지문 불일치               → IDEMPOTENCY_CONFLICT
 *     ├─ COMPLETED                → REPLAY (저장된 응답 + 상태 코드)
 *     └─ IN_PROGRESS              → DUPLICATE_REQUEST
 *   작업 성공 → commit (응답 저장, 보존 기간 연장)
 *   작업 실패 → release (예약 삭제, 같은 키로 재시도 가능)
 * </pre>
 *
 * <h3>동시 예약</h3>
 * <p>두 요청이 동시에 INSERT하면 PK 제약으로 하나만 성공한다.
 * 실패한 쪽은 레코드를 다시 읽어 위 규칙대로 판정한다.</p>
 *
 * <p>이 클래스 자체는 트랜잭션을 열지 않는다. 각 저장소 호출이 독립 트랜잭션으로 커밋되므로
 * 감싸진 작업의 트랜잭션과 섞이지 않는다.</p>
 */
@Slf4j
@Service
public class IdempotencyStore {

    private final IdempotencyRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Duration reservationLease;

    public IdempotencyStore(IdempotencyRecordRepository repository,
                            ObjectMapper objectMapper,
                            @Value("${venue-ops.idempotency.ttl:PT24H}") Duration ttl,
                            @Value("${venue-ops.idempotency.reservation-lease:PT5M}") Duration reservationLease) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.reservationLease = reservationLease;
    }

    /**
     * 키를 예약하거나 저장된 응답을 돌려준다.
     *
     * @throws BusinessException IDEMPOTENCY_CONFLICT (같은 키, 다른 요청) 또는 DUPLICATE_REQUEST (처리 중)
     */
    public IdempotencyDecision checkOrReserve(String key, String fingerprint, String operation) {
        LocalDateTime now = LocalDateTime.now();

        Optional<IdempotencyRecord> existing = repository.findById(key);
        if (existing.isPresent() && existing.get().isExpired(now)) {
            repository.deleteIfExpired(key, now);
            existing = Optional.empty();
        }

        if (existing.isEmpty()) {
            try {
                repository.reserve(key, fingerprint, operation, now, now.plus(reservationLease));
                log.debug("Idempotency key reserved: key={}, operation={}", key, operation);
                return IdempotencyDecision.proceed();
            } catch (DataIntegrityViolationException e) {
                log.info("Idempotency key reserved concurrently, re-reading: key={}", key);
                existing = repository.findById(key);
                if (existing.isEmpty()) {
                    // 경합한 예약이 그 사이 해제됨. 호출자가 재시도하면 된다.
                    throw new BusinessException(ErrorCode.DUPLICATE_REQUEST,
                            "Concurrent request with idempotency key " + key + " was just released; retry", e);
                }
            }
        }

        return decide(key, fingerprint, existing.get());
    }

    /** 작업 결과를 저장하고 보존 기간을 연장한다. */
    public void commit(String key, Object response, int statusCode) {
        int updated = repository.complete(key, toJson(response), statusCode,
                LocalDateTime.now().plus(ttl), IdempotencyState.COMPLETED, IdempotencyState.IN_PROGRESS);
        if (updated == 0) {
            // 예약 임대가 만료되어 다른 요청이 키를 가져갔을 수 있다
            log.warn("Idempotency reservation lost before commit: key={}", key);
        }
    }

    /** 작업이 실패했을 때 예약을 해제한다. */
    public void release(String key) {
        repository.deleteReservation(key, IdempotencyState.IN_PROGRESS);
        log.debug("Idempotency reservation released: key={}", key);
    }

    /**
     * reserve → (replay | run) → commit. 작업이 예외를 던지면 예약을 해제하고 예외를 그대로 전파한다.
     *
     * @param payload 지문 계산 대상 (의미상 요청을 구분하는 값만 담는다)
     */
    public <T> IdempotentResponse<T> execute(String key, String operation, Object payload,
                                             Class<T> responseType, int successStatus, Supplier<T> action) {
        IdempotencyDecision decision = checkOrReserve(key, RequestFingerprint.of(payload), operation);
        if (decision.isReplay()) {
            log.info("Idempotent replay: key={}, operation={}", key, operation);
            return new IdempotentResponse<>(fromJson(decision.storedResponse(), responseType),
                    decision.storedStatus(), true);
        }

        T result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            release(key);
            throw e;
        }
        commit(key, result, successStatus);
        return new IdempotentResponse<>(result, successStatus, false);
    }

    private IdempotencyDecision decide(String key, String fingerprint, IdempotencyRecord record) {
        if (!record.matches(fingerprint)) {
            log.warn("Idempotency key reused with a different request: key={}, operation={}",
                    key, record.getOperation());
            throw new BusinessException(ErrorCode.IDEMPOTENCY_CONFLICT,
                    "Idempotency key " + key + " was already used with a different request");
        }
        if (record.getState() == IdempotencyState.COMPLETED) {
            return IdempotencyDecision.replay(record.getStoredResponse(), record.getStoredStatus());
        }
        throw new BusinessException(ErrorCode.DUPLICATE_REQUEST,
                "Request with idempotency key " + key + " is still being processed");
    }

    private String toJson(Object response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Failed to serialize idempotent response", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Failed to read stored idempotent response", e);
        }
    }
}
