package com.venueops.table.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * 매장 테이블. 처음 보는 라벨로 테이블 주문이 들어오면 자동 생성된다.
 */
@Entity
@Table(name = "dining_tables",
        uniqueConstraints = @UniqueConstraint(name = "uk_dining_table_label", columnNames = {"venue_id", "label"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class DiningTable {

    public static final int DEFAULT_SEAT_COUNT = 4;

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "dining_table_seq")
    @SequenceGenerator(name = "dining_table_seq", sequenceName = "dining_table_seq", allocationSize = 50)
    private Long id;

    @Column(name = "venue_id", nullable = false, length = 64)
    private String venueId;

    @Column(nullable = false)
    private String label;

    private int seatCount;

    private boolean active;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public DiningTable(String venueId, String label, Integer seatCount) {
        this.venueId = venueId;
        this.label = label;
        this.seatCount = seatCount != null ? seatCount : DEFAULT_SEAT_COUNT;
        this.active = true;
    }
}
