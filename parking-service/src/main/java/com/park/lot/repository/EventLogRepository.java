package com.park.lot.repository;

import com.park.lot.entity.EventLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface EventLogRepository extends JpaRepository<EventLogEntry, Long> {
    List<EventLogEntry> findAllByOrderByTimestampDescIdDesc(Pageable pageable);

    @Query("select sum(e.amount) from EventLogEntry e")
    Double sumAmount();
}
