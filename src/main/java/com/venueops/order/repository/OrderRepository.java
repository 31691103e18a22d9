package com.venueops.order.repository;

import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 주문 저장소 - 상태 전이는 전부 조건부 UPDATE.
 *
 * <h3>조건부 UPDATE 패턴</h3>
 * <pre>
 *   UPDATE orders SET order_status = 'READY'
 *    WHERE id = ? AND venue_id = ? AND order_status = 'IN_PREP'
 * </pre>
 * <p>WHERE 절에 "기대하는 현재 상태"를 넣어 읽기-판단-쓰기를 한 문장으로 만든다.
 * 두 요청이 같은 전이를 동시에 시도하면 DB가 한쪽만 1행을 반환하고 다른 쪽은 0행을 받는다.
 * 0행이면 서비스 계층이 주문을 다시 읽어 ORDER_NOT_FOUND / INVALID_TRANSITION을 구분한다.</p>
 */
public interface OrderRepository extends JpaRepository<Order, String> {

    @EntityGraph(attributePaths = {"items"})
    Optional<Order> findByIdAndVenueId(String id, String venueId);

    List<Order> findByExternalSessionRef(String externalSessionRef);

    Optional<Order> findFirstByExternalPaymentRef(String externalPaymentRef);

    @EntityGraph(attributePaths = {"items"})
    @Query("SELECT o FROM Order o WHERE o.venueId = :venueId " +
            "AND (:orderStatus IS NULL OR o.orderStatus = :orderStatus) " +
            "AND (:paymentStatus IS NULL OR o.paymentStatus = :paymentStatus) " +
            "ORDER BY o.createdAt DESC")
    List<Order> search(@Param("venueId") String venueId,
                       @Param("orderStatus") OrderStatus orderStatus,
                       @Param("paymentStatus") PaymentStatus paymentStatus);

    /**
     * 상관관계 메타데이터가 없는 결제 이벤트의 후보 주문.
     * 미결제, 결제 세션 미연결, 취소되지 않은 최근 주문만 대상.
     */
    @Query("SELECT o FROM Order o WHERE o.venueId = :venueId " +
            "AND o.paymentStatus = :unpaid AND o.externalSessionRef IS NULL " +
            "AND o.orderStatus <> :cancelled AND o.createdAt >= :since " +
            "ORDER BY o.createdAt DESC")
    List<Order> findFallbackCandidates(@Param("venueId") String venueId,
                                       @Param("since") LocalDateTime since,
                                       @Param("unpaid") PaymentStatus unpaid,
                                       @Param("cancelled") OrderStatus cancelled);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.orderStatus = :next, o.updatedAt = :now " +
            "WHERE o.id = :id AND o.venueId = :venueId AND o.orderStatus = :expected")
    int transitionStatus(@Param("id") String id,
                         @Param("venueId") String venueId,
                         @Param("expected") OrderStatus expected,
                         @Param("next") OrderStatus next,
                         @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.orderStatus = :completed, o.completedAt = :now, o.updatedAt = :now, " +
            "o.forcedCompletion = :forced, o.forcedBy = :forcedBy, o.forcedReason = :forcedReason " +
            "WHERE o.id = :id AND o.venueId = :venueId AND o.orderStatus IN :allowedFrom")
    int markCompleted(@Param("id") String id,
                      @Param("venueId") String venueId,
                      @Param("allowedFrom") Collection<OrderStatus> allowedFrom,
                      @Param("completed") OrderStatus completed,
                      @Param("forced") boolean forced,
                      @Param("forcedBy") String forcedBy,
                      @Param("forcedReason") String forcedReason,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.orderStatus = :cancelled, o.cancelReason = :reason, " +
            "o.cancelledAt = :now, o.updatedAt = :now " +
            "WHERE o.id = :id AND o.venueId = :venueId AND o.orderStatus IN :allowedFrom")
    int markCancelled(@Param("id") String id,
                      @Param("venueId") String venueId,
                      @Param("allowedFrom") Collection<OrderStatus> allowedFrom,
                      @Param("cancelled") OrderStatus cancelled,
                      @Param("reason") String reason,
                      @Param("now") LocalDateTime now);

    /** 결제 세션을 미리 연결 (체크아웃 세션 생성 시) */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.externalSessionRef = :sessionRef, o.updatedAt = :now " +
            "WHERE o.id = :id AND o.venueId = :venueId AND o.paymentStatus = :unpaid " +
            "AND (o.externalSessionRef IS NULL OR o.externalSessionRef = :sessionRef)")
    int bindSessionRef(@Param("id") String id,
                       @Param("venueId") String venueId,
                       @Param("sessionRef") String sessionRef,
                       @Param("unpaid") PaymentStatus unpaid,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.paymentStatus = :paid, o.paidAt = :now, o.updatedAt = :now, " +
            "o.externalSessionRef = COALESCE(:sessionRef, o.externalSessionRef), " +
            "o.externalPaymentRef = COALESCE(:paymentRef, o.externalPaymentRef) " +
            "WHERE o.id = :id AND o.venueId = :venueId AND o.paymentStatus = :unpaid")
    int markPaid(@Param("id") String id,
                 @Param("venueId") String venueId,
                 @Param("sessionRef") String sessionRef,
                 @Param("paymentRef") String paymentRef,
                 @Param("unpaid") PaymentStatus unpaid,
                 @Param("paid") PaymentStatus paid,
                 @Param("now") LocalDateTime now);

    /**
     * 누적 환불액 갱신. 직전에 읽은 refundAmount가 그대로일 때만 성공하므로
     * 동시 환불 두 건이 모두 잔액 검사를 통과해도 하나만 반영된다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.refundAmount = :newRefundAmount, o.paymentStatus = :nextStatus, " +
            "o.refundRef = COALESCE(:refundRef, o.refundRef), " +
            "o.refundReason = COALESCE(:reason, o.refundReason), " +
            "o.refundedAt = :now, o.updatedAt = :now " +
            "WHERE o.id = :id AND o.venueId = :venueId AND o.refundAmount = :expectedRefundAmount " +
            "AND o.paymentStatus IN :refundable")
    int applyRefund(@Param("id") String id,
                    @Param("venueId") String venueId,
                    @Param("expectedRefundAmount") long expectedRefundAmount,
                    @Param("newRefundAmount") long newRefundAmount,
                    @Param("nextStatus") PaymentStatus nextStatus,
                    @Param("refundRef") String refundRef,
                    @Param("reason") String reason,
                    @Param("refundable") Collection<PaymentStatus> refundable,
                    @Param("now") LocalDateTime now);
}
