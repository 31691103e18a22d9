package com.venueops.common.config;

import io.github.resilience4j.micrometer.tagged.TaggedRateLimiterMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j 메트릭 등록 (Prometheus).
 *
 * <ul>
 *   <li>Retry: 결제 대행사 호출 재시도 횟수 ({@code resilience4j_retry_calls_total{name="paymentProcessor"}})</li>
 *   <li>Rate Limiter: 주문/환불 API 허용·거부 수</li>
 * </ul>
 *
 * Metrics available at: /actuator/prometheus
 */
@Configuration
public class ResilienceMetricsConfig {

    public ResilienceMetricsConfig(MeterRegistry meterRegistry,
                                   RetryRegistry retryRegistry,
                                   RateLimiterRegistry rateLimiterRegistry) {
        TaggedRetryMetrics.ofRetryRegistry(retryRegistry).bindTo(meterRegistry);
        TaggedRateLimiterMetrics.ofRateLimiterRegistry(rateLimiterRegistry).bindTo(meterRegistry);
    }
}
