package com.park.lot.repository;

import com.park.lot.entity.OccupancyRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface OccupancyRecordRepository extends JpaRepository<OccupancyRecord, Long> {
    Optional<OccupancyRecord> findByPlateNumberAndExitTimeIsNull(String plateNumber);

    boolean existsByPlateNumberAndExitTimeIsNull(String plateNumber);

    long countByExitTimeIsNull();

    @Query("select r from OccupancyRecord r join fetch r.space where r.exitTime is null order by r.entryTime asc, r.id asc")
    List<OccupancyRecord> findActiveWithSpace();
}
