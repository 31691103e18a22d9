package com.venueops.payment.repository;

import com.venueops.payment.entity.UnresolvedPaymentEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UnresolvedPaymentEventRepository extends JpaRepository<UnresolvedPaymentEvent, Long> {

    List<UnresolvedPaymentEvent> findByVenueIdAndResolvedFalseOrderByReceivedAtDesc(String venueId);
}
