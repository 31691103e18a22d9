package com.venueops.venue.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * 매장 (Venue) - 주문과 테이블의 소유 단위.
 *
 * <p>결제 방식 호환성 검사에 쓰이는 매장별 설정 플래그를 가진다.</p>
 */
@Entity
@Table(name = "venues")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Venue {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    private String name;

    private boolean active;

    // TABLE_COLLECTION QR에서 카운터 결제(PAY_AT_TILL) 허용 여부
    private boolean allowPayAtTillForTableCollection;

    // 카운터 픽업 주문의 후불(PAY_LATER) 허용 여부
    private boolean allowCounterPayLater;

    @Builder
    public Venue(String id, String name, Boolean active,
                 boolean allowPayAtTillForTableCollection, boolean allowCounterPayLater) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.name = name;
        this.active = active == null || active;
        this.allowPayAtTillForTableCollection = allowPayAtTillForTableCollection;
        this.allowCounterPayLater = allowCounterPayLater;
    }
}
