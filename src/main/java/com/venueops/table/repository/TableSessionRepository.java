package com.venueops.table.repository;

import com.venueops.table.entity.TableSession;
import com.venueops.table.entity.TableSessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 테이블 세션 저장소.
 *
 * <p>모든 상태 변경은 조건부 UPDATE로 수행되며, 반환값(변경된 행 수)이 0이면
 * 다른 요청이 먼저 상태를 바꿨다는 뜻이다.</p>
 */
public interface TableSessionRepository extends JpaRepository<TableSession, String> {

    Optional<TableSession> findByOpenKey(String openKey);

    Optional<TableSession> findByVenueIdAndBoundOrderIdAndClosedAtIsNull(String venueId, String boundOrderId);

    /** 열린 미바인딩 세션에 주문을 바인딩 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TableSession s SET s.boundOrderId = :orderId, s.status = :occupied " +
            "WHERE s.id = :sessionId AND s.boundOrderId IS NULL AND s.closedAt IS NULL")
    int bindOrder(@Param("sessionId") String sessionId,
                  @Param("orderId") String orderId,
                  @Param("occupied") TableSessionStatus occupied);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TableSession s SET s.status = :free, s.closedAt = :now, s.openKey = NULL, s.boundOrderId = NULL " +
            "WHERE s.openKey = :openKey")
    int closeByOpenKey(@Param("openKey") String openKey,
                       @Param("free") TableSessionStatus free,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TableSession s SET s.status = :free, s.closedAt = :now, s.openKey = NULL, s.boundOrderId = NULL " +
            "WHERE s.venueId = :venueId AND s.boundOrderId = :orderId AND s.closedAt IS NULL")
    int closeForOrder(@Param("venueId") String venueId,
                      @Param("orderId") String orderId,
                      @Param("free") TableSessionStatus free,
                      @Param("now") LocalDateTime now);
}
