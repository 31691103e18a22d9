package com.venueops.common.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.redis.spring.RedisLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * ShedLock 설정 - 다중 인스턴스 환경에서 스케줄 작업 단일 실행 보장.
 *
 * <p>멱등성 레코드 정리(IdempotencyPurgeJob)가 모든 인스턴스에서
 * 동시에 돌지 않도록 Redis 락을 건다.</p>
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "30s")
public class ShedLockConfig {

    @Bean
    public LockProvider lockProvider(RedisConnectionFactory connectionFactory) {
        // "venue-ops": 락 키 네임스페이스
        return new RedisLockProvider(connectionFactory, "venue-ops");
    }
}
