package com.park.lot.service;

import com.park.lot.entity.OccupancyRecord;
import com.park.lot.entity.Space;
import com.park.lot.exception.AlreadyParkedException;
import com.park.lot.exception.NotParkedException;
import com.park.lot.repository.OccupancyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Who is parked where. A plate has at most one active record; closed records are kept as history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OccupancyLedger {

    private final OccupancyRecordRepository recordRepo;

    @Transactional
    public OccupancyRecord openRecord(String plate, boolean hasPackage, Space space, Instant entryTime) {
        if (recordRepo.existsByPlateNumberAndExitTimeIsNull(plate)) {
            log.warn("Entry rejected, {} is already parked", plate);
            throw new AlreadyParkedException(plate);
        }

        OccupancyRecord record = OccupancyRecord.builder()
                .plateNumber(plate)
                .activePlate(plate)
                .hasPackage(hasPackage)
                .entryTime(entryTime)
                .space(space)
                .build();
        return recordRepo.save(record);
    }

    @Transactional
    public OccupancyRecord closeActiveRecord(String plate, Instant exitTime) {
        OccupancyRecord record = recordRepo.findByPlateNumberAndExitTimeIsNull(plate)
                .orElseThrow(() -> {
                    log.warn("Exit rejected, no active record for {}", plate);
                    return new NotParkedException(plate);
                });

        record.setExitTime(exitTime);
        record.setActivePlate(null);
        return recordRepo.save(record);
    }

    @Transactional(readOnly = true)
    public List<OccupancyRecord> activeRecords() {
        return recordRepo.findActiveWithSpace();
    }

    @Transactional(readOnly = true)
    public long countActive() {
        return recordRepo.countByExitTimeIsNull();
    }
}
