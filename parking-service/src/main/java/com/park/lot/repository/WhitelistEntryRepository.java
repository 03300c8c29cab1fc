package com.park.lot.repository;

import com.park.lot.entity.WhitelistEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WhitelistEntryRepository extends JpaRepository<WhitelistEntry, Long> {
    boolean existsByPlateNumber(String plateNumber);

    long deleteByPlateNumber(String plateNumber);

    List<WhitelistEntry> findAllByOrderByCreatedAtDescIdDesc();
}
