package com.park.lot.service;

import com.park.common.model.ParkingAction;
import com.park.lot.entity.EventLogEntry;
import com.park.lot.repository.EventLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class EventLog {

    static final int MAX_WINDOW = 500;

    private final EventLogRepository logRepo;

    @Transactional
    public EventLogEntry append(String plate, ParkingAction action, Instant timestamp, double amount, long halfDays) {
        EventLogEntry entry = EventLogEntry.builder()
                .plateNumber(plate)
                .action(action)
                .timestamp(timestamp)
                .amount(amount)
                .durationHalfDays(halfDays)
                .build();
        return logRepo.save(entry);
    }

    /** Newest first; limit is clamped to [1, 500]. */
    @Transactional(readOnly = true)
    public List<EventLogEntry> recent(int limit) {
        int window = Math.max(1, Math.min(limit, MAX_WINDOW));
        return logRepo.findAllByOrderByTimestampDescIdDesc(PageRequest.of(0, window));
    }

    // TODO: maintain a running revenue counter on append instead of summing the whole log

    @Transactional(readOnly = true)
    public double totalRevenue() {
        Double sum = logRepo.sumAmount();
        return sum != null ? sum : 0.0;
    }
}
