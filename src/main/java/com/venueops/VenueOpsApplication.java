package com.venueops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Venue Ops - 매장 주문 라이프사이클 및 결제 정산 엔진
 *
 * <p>테이블/카운터 주문 생성, 주문 상태 머신, 테이블 세션 관리,
 * 결제 대행사 웹훅 정산, 환불을 하나의 서비스에서 처리한다.</p>
 *
 * <p>모든 상태 변경은 DB 조건부 UPDATE로 이루어지므로
 * 인스턴스를 여러 개 띄워도 프로세스 내 락이 필요 없다.</p>
 */
@SpringBootApplication
@EnableScheduling
public class VenueOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(VenueOpsApplication.class, args);
    }
}
