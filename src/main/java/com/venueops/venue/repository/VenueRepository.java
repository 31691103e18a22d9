package com.venueops.venue.repository;

import com.venueops.venue.entity.Venue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface VenueRepository extends JpaRepository<Venue, String> {

    Optional<Venue> findByIdAndActiveTrue(String id);
}
