package com.park.lot.service;

import com.park.common.model.EntryResult;
import com.park.common.model.ExitResult;
import com.park.common.model.ParkingAction;
import com.park.common.model.ParkingEvent;
import com.park.common.model.SpaceStatus;
import com.park.common.model.SpaceType;
import com.park.lot.entity.OccupancyRecord;
import com.park.lot.entity.Space;
import com.park.lot.exception.LotFullException;
import com.park.lot.kafka.ParkingEventPublisher;
import com.park.lot.util.PlateNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Entry and exit of vehicles. Each operation runs as one transaction under the
 * {@link LotLock}: the space chosen for an entry cannot be handed to anyone else
 * before the entry has committed, and a failed step leaves nothing behind.
 */
@Slf4j
@Service
public class ParkingEngine {

    private final WhitelistRegistry whitelist;
    private final SpaceInventory inventory;
    private final OccupancyLedger ledger;
    private final EventLog eventLog;
    private final TariffService tariff;
    private final LotLock lotLock;
    private final ParkingEventPublisher eventPublisher;
    private final TransactionTemplate tx;
    private final Clock clock;

    public ParkingEngine(WhitelistRegistry whitelist,
                         SpaceInventory inventory,
                         OccupancyLedger ledger,
                         EventLog eventLog,
                         TariffService tariff,
                         LotLock lotLock,
                         ParkingEventPublisher eventPublisher,
                         PlatformTransactionManager transactionManager,
                         Clock clock) {
        this.whitelist = whitelist;
        this.inventory = inventory;
        this.ledger = ledger;
        this.eventLog = eventLog;
        this.tariff = tariff;
        this.lotLock = lotLock;
        this.eventPublisher = eventPublisher;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public EntryResult enter(String plateNumber) {
        String plate = PlateNumbers.normalize(plateNumber);
        return lotLock.withLock(plate, () -> tx.execute(status -> doEnter(plate)));
    }

    public ExitResult exit(String plateNumber) {
        String plate = PlateNumbers.normalize(plateNumber);
        return lotLock.withLock(plate, () -> tx.execute(status -> doExit(plate)));
    }

    /**
     * Operator reserve/release of a free space, serialized with entry and exit so a
     * space cannot be reserved while it is being assigned.
     */
    public Space setReservation(Long spaceId, SpaceStatus target) {
        return lotLock.withLock(null, () -> tx.execute(status -> inventory.setReservation(spaceId, target)));
    }

    private EntryResult doEnter(String plate) {
        Instant now = now();
        boolean hasPackage = whitelist.isWhitelisted(plate);

        Space space = inventory.findAvailable(hasPackage ? SpaceType.PACKAGE : null)
                .orElseThrow(() -> {
                    log.warn("Entry rejected for {}: lot full", plate);
                    return new LotFullException(plate);
                });

        ledger.openRecord(plate, hasPackage, space, now);
        inventory.markOccupied(space);
        eventLog.append(plate, ParkingAction.ENTRY, now, 0.0, 0);

        publishAfterCommit(ParkingEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .plateNumber(plate)
                .action(ParkingAction.ENTRY)
                .spaceId(space.getId())
                .spaceCode(space.getCode())
                .hasPackage(hasPackage)
                .amount(0.0)
                .halfDays(0)
                .timestamp(now)
                .build());

        log.info("Vehicle {} entered, space={} package={}", plate, space.getCode(), hasPackage);
        return EntryResult.builder()
                .spaceId(space.getId())
                .spaceCode(space.getCode())
                .hasPackage(hasPackage)
                .entryTime(now)
                .build();
    }

    private ExitResult doExit(String plate) {
        Instant now = now();
        OccupancyRecord record = ledger.closeActiveRecord(plate, now);

        // billed on the flag captured at entry, not on the current whitelist
        boolean hasPackage = record.isHasPackage();
        long halfDays = tariff.halfDays(record.getEntryTime(), now);
        double amount = tariff.fee(halfDays, hasPackage);
        if (now.isBefore(record.getEntryTime())) {
            log.warn("Exit time {} of {} is before its entry time {}, billing zero half-days",
                    now, plate, record.getEntryTime());
        }

        Space space = record.getSpace();
        inventory.markAvailable(space);
        eventLog.append(plate, ParkingAction.EXIT, now, amount, halfDays);

        publishAfterCommit(ParkingEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .plateNumber(plate)
                .action(ParkingAction.EXIT)
                .spaceId(space.getId())
                .spaceCode(space.getCode())
                .hasPackage(hasPackage)
                .amount(amount)
                .halfDays(halfDays)
                .timestamp(now)
                .build());

        log.info("Vehicle {} left space {}: halfDays={} amount={} package={}",
                plate, space.getCode(), halfDays, amount, hasPackage);
        return ExitResult.builder()
                .amount(amount)
                .durationHalfDays(halfDays)
                .hasPackage(hasPackage)
                .entryTime(record.getEntryTime())
                .exitTime(now)
                .spaceId(space.getId())
                .spaceCode(space.getCode())
                .build();
    }

    private void publishAfterCommit(ParkingEvent event) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                eventPublisher.publish(event);
            }
        });
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
