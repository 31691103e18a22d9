package com.venueops.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 활성화 - {@code @CreatedDate}, {@code @LastModifiedDate} 자동 기록.
 *
 * <p>조건부 UPDATE 쿼리(@Modifying)는 엔티티 리스너를 거치지 않으므로
 * 해당 쿼리들은 updatedAt을 직접 설정한다.</p>
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
