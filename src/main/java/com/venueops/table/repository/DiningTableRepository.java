package com.venueops.table.repository;

import com.venueops.table.entity.DiningTable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DiningTableRepository extends JpaRepository<DiningTable, Long> {

    Optional<DiningTable> findByVenueIdAndLabel(String venueId, String label);
}
