package com.park.lot.service;

import com.park.common.model.ParkingAction;
import com.park.common.model.SpaceStatus;
import com.park.common.model.SpaceType;
import com.park.lot.entity.Space;
import com.park.lot.repository.SpaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Creates the fixed space pool on first start. Optionally loads the demo data set:
 * a few package plates, vehicles already in the lot and some past visits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LotBootstrap implements ApplicationRunner {

    private final SpaceRepository spaceRepo;
    private final WhitelistRegistry whitelist;
    private final OccupancyLedger ledger;
    private final SpaceInventory inventory;
    private final EventLog eventLog;
    private final Clock clock;

    @Value("${parking.bootstrap.space-count:50}")
    private int spaceCount;

    @Value("${parking.bootstrap.package-spaces:15}")
    private int packageSpaces;

    @Value("${parking.bootstrap.demo-data:false}")
    private boolean demoData;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (spaceRepo.count() > 0) {
            log.info("Space pool already present ({} spaces), skipping bootstrap", spaceRepo.count());
            return;
        }

        for (int i = 1; i <= spaceCount; i++) {
            spaceRepo.save(Space.builder()
                    .code(String.format("A-%03d", i))
                    .type(i <= packageSpaces ? SpaceType.PACKAGE : SpaceType.NORMAL)
                    .status(SpaceStatus.AVAILABLE)
                    .build());
        }
        log.info("Seeded {} spaces ({} package)", spaceCount, Math.min(packageSpaces, spaceCount));

        if (demoData) {
            seedDemoData();
        }
    }

    private void seedDemoData() {
        whitelist.add("粤B88888", "VIP visitor - Mr. Zhang");
        whitelist.add("京A00001", "Long-term travel agency partner");
        whitelist.add("沪C66666", "Scenic area partner");
        whitelist.add("浙A12345", "Family package - Ms. Li");

        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        park("粤B88888", true, "A-001", now.minus(Duration.ofHours(2)));
        park("京A00001", true, "A-002", now.minus(Duration.ofHours(5)));
        park("苏E99999", false, "A-016", now.minus(Duration.ofHours(1)));
        park("川A77777", false, "A-017", now.minus(Duration.ofHours(8)));

        visit("粤B12345", now.minus(Duration.ofHours(24)), now.minus(Duration.ofHours(12)), 1, 20.0);
        visit("京A88888", now.minus(Duration.ofHours(48)), now.minus(Duration.ofHours(30)), 2, 40.0);
        visit("沪A66666", now.minus(Duration.ofHours(10)), now.minus(Duration.ofHours(2)), 1, 20.0);

        log.info("Demo data loaded: 4 whitelist plates, 4 parked vehicles, 3 past visits");
    }

    private void park(String plate, boolean hasPackage, String spaceCode, Instant entryTime) {
        spaceRepo.findByCode(spaceCode).ifPresentOrElse(space -> {
            ledger.openRecord(plate, hasPackage, space, entryTime);
            inventory.markOccupied(space);
            eventLog.append(plate, ParkingAction.ENTRY, entryTime, 0.0, 0);
        }, () -> log.warn("Demo space {} not in pool, skipping vehicle {}", spaceCode, plate));
    }

    // log rows only, these visits have no ledger record
    private void visit(String plate, Instant entry, Instant exit, long halfDays, double amount) {
        eventLog.append(plate, ParkingAction.ENTRY, entry, 0.0, 0);
        eventLog.append(plate, ParkingAction.EXIT, exit, amount, halfDays);
    }
}
