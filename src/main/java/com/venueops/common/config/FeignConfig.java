package com.venueops.common.config;

import com.venueops.payment.client.PaymentProcessorErrorDecoder;
import feign.Request;
import feign.codec.ErrorDecoder;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Feign 클라이언트 설정 - 결제 대행사 HTTP 호출.
 *
 * <p>{@code @EnableFeignClients}는 애플리케이션 클래스가 아닌 이 설정에 둔다.
 * {@code @DataJpaTest} 슬라이스에는 Feign 빈이 등록되지 않는다.</p>
 */
@Configuration
@EnableFeignClients(basePackages = "com.venueops.payment.client")
public class FeignConfig {

    /**
     * connectTimeout 3초, readTimeout 5초.
     * 재시도는 Feign이 아니라 Resilience4j Retry가 담당한다.
     */
    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                3, TimeUnit.SECONDS,
                5, TimeUnit.SECONDS,
                true
        );
    }

    @Bean
    public ErrorDecoder paymentProcessorErrorDecoder() {
        return new PaymentProcessorErrorDecoder();
    }
}
