package com.park.lot.service;

import com.park.common.model.SpaceStatus;
import com.park.common.model.SpaceType;
import com.park.lot.entity.Space;
import com.park.lot.exception.InvalidTransitionException;
import com.park.lot.exception.SpaceNotFoundException;
import com.park.lot.exception.SpaceStateException;
import com.park.lot.repository.SpaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Fixed pool of spaces. Callers that mutate it are expected to hold the lot lock
 * (see {@link LotLock}) so that selection and marking happen in one critical section.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpaceInventory {

    private final SpaceRepository spaceRepo;

    /**
     * Lowest-id available space of the preferred type, falling back to the
     * lowest-id available space of any type. Reserved spaces are never returned.
     *
     * @param preferType type to try first, or null for no preference
     */
    @Transactional(readOnly = true)
    public Optional<Space> findAvailable(SpaceType preferType) {
        if (preferType != null) {
            Optional<Space> preferred = spaceRepo.findFirstByStatusAndTypeOrderByIdAsc(SpaceStatus.AVAILABLE, preferType);
            if (preferred.isPresent()) {
                return preferred;
            }
            log.debug("No available {} space, falling back to any type", preferType);
        }
        return spaceRepo.findFirstByStatusOrderByIdAsc(SpaceStatus.AVAILABLE);
    }

    @Transactional
    public void markOccupied(Space space) {
        transition(space, SpaceStatus.AVAILABLE, SpaceStatus.OCCUPIED);
    }

    @Transactional
    public void markAvailable(Space space) {
        transition(space, SpaceStatus.OCCUPIED, SpaceStatus.AVAILABLE);
    }

    /**
     * Operator toggle between AVAILABLE and RESERVED. Occupied spaces are left to the entry/exit flow.
     */
    @Transactional
    public Space setReservation(Long spaceId, SpaceStatus target) {
        Space space = spaceRepo.findById(spaceId)
                .orElseThrow(() -> new SpaceNotFoundException(spaceId));

        if (target == SpaceStatus.OCCUPIED || space.getStatus() == SpaceStatus.OCCUPIED) {
            log.warn("Reservation toggle rejected for space {}: {} -> {}", space.getCode(), space.getStatus(), target);
            throw new InvalidTransitionException(spaceId, space.getStatus(), target);
        }
        if (space.getStatus() == target) {
            return space;
        }

        space.setStatus(target);
        spaceRepo.save(space);
        log.info("Space {} set to {} by operator", space.getCode(), target);
        return space;
    }

    @Transactional(readOnly = true)
    public List<Space> list() {
        return spaceRepo.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public long countByStatus(SpaceStatus status) {
        return spaceRepo.countByStatus(status);
    }

    @Transactional(readOnly = true)
    public long count() {
        return spaceRepo.count();
    }

    private void transition(Space space, SpaceStatus expected, SpaceStatus next) {
        if (space.getStatus() != expected) {
            log.error("Space {} is {} but occupancy flow expected {}", space.getCode(), space.getStatus(), expected);
            throw new SpaceStateException(space.getCode(), expected, space.getStatus());
        }
        space.setStatus(next);
        spaceRepo.save(space);
    }
}
