package com.venueops.order.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Redis Pub/Sub 주문 상태 발행자 - 주방/홀 화면 실시간 갱신용.
 *
 * <h3>발행 시점</h3>
 * <p>{@code AFTER_COMMIT}: 상태 변경이 커밋된 뒤에만 발행한다. 롤백된 전이는 알리지 않는다.</p>
 *
 * <h3>fire-and-forget</h3>
 * <p>Redis 장애로 발행이 실패해도 로그만 남긴다. 이미 커밋된 주문 전이는 영향을 받지 않는다.
 * 구독자가 없으면 메시지는 버려진다.</p>
 *
 * Channel: "venue:{venueId}:orders"
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStatusPublisher {

    private static final String CHANNEL_FORMAT = "venue:%s:orders";

    private final RedisTemplate<String, Object> redisTemplate;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onStatusChanged(OrderStatusChangedEvent event) {
        try {
            redisTemplate.convertAndSend(String.format(CHANNEL_FORMAT, event.venueId()), event);
            log.debug("Order status published: orderId={}, orderStatus={}, paymentStatus={}",
                    event.orderId(), event.orderStatus(), event.paymentStatus());
        } catch (RuntimeException e) {
            log.warn("Order status broadcast failed (ignored): orderId={}, cause={}",
                    event.orderId(), e.getMessage());
        }
    }
}
