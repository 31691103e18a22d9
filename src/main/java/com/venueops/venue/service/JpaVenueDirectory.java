package com.venueops.venue.service;

import com.venueops.venue.repository.VenueRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaVenueDirectory implements VenueDirectory {

    private final VenueRepository venueRepository;

    @Override
    public Optional<VenuePolicy> findPolicy(String venueId) {
        return venueRepository.findByIdAndActiveTrue(venueId)
                .map(venue -> new VenuePolicy(
                        venue.getId(),
                        venue.isAllowPayAtTillForTableCollection(),
                        venue.isAllowCounterPayLater()));
    }
}
