package com.park.lot.service;

import com.park.lot.entity.WhitelistEntry;
import com.park.lot.exception.DuplicatePlateException;
import com.park.lot.repository.WhitelistEntryRepository;
import com.park.lot.util.PlateNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Plates entitled to package treatment (priority package spaces, no fee).
 * Operator-maintained; the engine only reads it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WhitelistRegistry {

    private final WhitelistEntryRepository whitelistRepo;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean isWhitelisted(String plate) {
        return whitelistRepo.existsByPlateNumber(PlateNumbers.normalize(plate));
    }

    @Transactional
    public WhitelistEntry add(String plate, String notes) {
        String normalized = PlateNumbers.normalize(plate);
        if (whitelistRepo.existsByPlateNumber(normalized)) {
            log.warn("Whitelist add rejected, {} already registered", normalized);
            throw new DuplicatePlateException(normalized);
        }

        WhitelistEntry entry = WhitelistEntry.builder()
                .plateNumber(normalized)
                .notes(notes)
                .createdAt(Instant.now(clock))
                .build();
        try {
            whitelistRepo.saveAndFlush(entry);
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent add of the same plate
            throw new DuplicatePlateException(normalized);
        }

        log.info("Plate {} added to package whitelist", normalized);
        return entry;
    }

    @Transactional
    public void remove(String plate) {
        String normalized = PlateNumbers.normalize(plate);
        long removed = whitelistRepo.deleteByPlateNumber(normalized);
        if (removed > 0) {
            log.info("Plate {} removed from package whitelist", normalized);
        } else {
            log.debug("Plate {} was not on the whitelist, nothing removed", normalized);
        }
    }

    @Transactional(readOnly = true)
    public List<WhitelistEntry> list() {
        return whitelistRepo.findAllByOrderByCreatedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public long count() {
        return whitelistRepo.count();
    }
}
