package com.venueops.venue.service;

/**
 * 결제 방식 호환성 검사에 필요한 매장 설정 스냅샷.
 */
public record VenuePolicy(
        String venueId,
        boolean allowPayAtTillForTableCollection,
        boolean allowCounterPayLater
) {
}
