package com.venueops.idempotency.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 멱등성 레코드 - 외부에서 재시도되는 작업(주문 생성, 웹훅, 환불)의 처리 이력.
 *
 * <h3>생명주기</h3>
 * <pre>
 *   (없음) ──reserve──▶ IN_PROGRESS ──complete──▶ COMPLETED ──expiresAt 경과──▶ (없음)
 *                           │
 *                           └──release (작업 실패)──▶ (없음)
 * </pre>
 *
 * <p>IN_PROGRESS 상태의 expiresAt은 짧은 예약 임대 시간이다. 처리 도중 인스턴스가 죽어도
 * 임대가 끝나면 같은 키로 다시 시도할 수 있다. 완료되면 expiresAt이 보존 기간(기본 24시간)으로 연장된다.</p>
 *
 * <p>행 생성은 네이티브 INSERT로만 이루어진다 (PK 충돌 = 동시 예약 감지).</p>
 */
@Entity
@Table(name = "idempotency_records", indexes = {
        @Index(name = "idx_idempotency_expires_at", columnList = "expires_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IdempotencyRecord {

    @Id
    @Column(name = "idempotency_key", length = 255)
    private String idempotencyKey;

    // 요청 본문의 SHA-256 (정렬된 JSON 기준)
    @Column(name = "request_fingerprint", nullable = false, length = 64)
    private String requestFingerprint;

    @Column(nullable = false, length = 64)
    private String operation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private IdempotencyState state;

    @Column(name = "stored_response", columnDefinition = "TEXT")
    private String storedResponse;

    @Column(name = "stored_status")
    private Integer storedStatus;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public boolean matches(String fingerprint) {
        return requestFingerprint.equals(fingerprint);
    }
}
