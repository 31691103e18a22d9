package com.venueops.venue.service;

import java.util.Optional;

/**
 * 매장 설정 조회 경계.
 *
 * <p>주문 서비스는 매장 저장소 구현을 모르고 이 인터페이스만 사용한다.
 * 비활성 매장은 존재하지 않는 것으로 취급한다.</p>
 */
public interface VenueDirectory {

    Optional<VenuePolicy> findPolicy(String venueId);
}
