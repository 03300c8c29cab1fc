package com.park.lot.service;

import com.park.common.model.EntryResult;
import com.park.common.model.ExitResult;
import com.park.common.model.LotStats;
import com.park.common.model.ParkingAction;
import com.park.common.model.SpaceStatus;
import com.park.common.model.SpaceType;
import com.park.lot.entity.EventLogEntry;
import com.park.lot.entity.Space;
import com.park.lot.exception.AlreadyParkedException;
import com.park.lot.exception.InvalidTransitionException;
import com.park.lot.exception.LotFullException;
import com.park.lot.exception.NotParkedException;
import com.park.lot.support.AbstractLotIntegrationTest;
import com.park.lot.support.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParkingEngineTest extends AbstractLotIntegrationTest {

    @Autowired
    private ParkingEngine engine;

    @Autowired
    private WhitelistRegistry whitelist;

    @Autowired
    private LotQueryService queryService;

    @Test
    void entryTakesLowestAvailableSpaceAndLogsIt() {
        EntryResult result = engine.enter("苏E99999");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSpaceCode()).isEqualTo("A-001");
        assertThat(result.isHasPackage()).isFalse();
        assertThat(result.getEntryTime()).isEqualTo(TestClockConfig.T0);
        assertThat(space("A-001").getStatus()).isEqualTo(SpaceStatus.OCCUPIED);

        List<EventLogEntry> logs = logsFor("苏E99999");
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getAction()).isEqualTo(ParkingAction.ENTRY);
        assertThat(logs.get(0).getAmount()).isZero();
        assertThat(logs.get(0).getDurationHalfDays()).isZero();
        assertOccupancyConsistent();
    }

    @Test
    void whitelistedPlateGetsPackageSpace() {
        whitelist.add("粤B88888", "VIP");

        EntryResult result = engine.enter("粤B88888");

        assertThat(result.isHasPackage()).isTrue();
        assertThat(spaceRepo.findById(result.getSpaceId()).orElseThrow().getType()).isEqualTo(SpaceType.PACKAGE);
    }

    @Test
    void whitelistedPlateFallsBackToNormalSpaceWhenPackageSpacesAreGone() {
        for (int i = 1; i <= 15; i++) {
            engine.setReservation(space(String.format("A-%03d", i)).getId(), SpaceStatus.RESERVED);
        }
        whitelist.add("京A00001", "partner");

        EntryResult result = engine.enter("京A00001");

        assertThat(result.getSpaceCode()).isEqualTo("A-016");
        assertThat(result.isHasPackage()).isTrue();
        assertOccupancyConsistent();
    }

    @Test
    void normalVehicleBilledPerStartedHalfDay() {
        engine.enter("川A77777");
        clock.advance(Duration.ofHours(13));

        ExitResult result = engine.exit("川A77777");

        assertThat(result.getDurationHalfDays()).isEqualTo(2);
        assertThat(result.getAmount()).isEqualTo(40.0);
        assertThat(result.isHasPackage()).isFalse();
        assertThat(result.getEntryTime()).isEqualTo(TestClockConfig.T0);
        assertThat(result.getExitTime()).isEqualTo(TestClockConfig.T0.plus(Duration.ofHours(13)));
        assertThat(space(result.getSpaceCode()).getStatus()).isEqualTo(SpaceStatus.AVAILABLE);

        EventLogEntry exitLog = logsFor("川A77777").get(1);
        assertThat(exitLog.getAction()).isEqualTo(ParkingAction.EXIT);
        assertThat(exitLog.getAmount()).isEqualTo(40.0);
        assertThat(exitLog.getDurationHalfDays()).isEqualTo(2);
        assertOccupancyConsistent();
    }

    @Test
    void packageVehicleNeverPays() {
        whitelist.add("沪C66666", "partner");
        engine.enter("沪C66666");
        clock.advance(Duration.ofHours(13));

        ExitResult result = engine.exit("沪C66666");

        assertThat(result.getDurationHalfDays()).isEqualTo(2);
        assertThat(result.getAmount()).isZero();
        assertThat(result.isHasPackage()).isTrue();
    }

    @Test
    void packageFlagIsTakenAtEntry() {
        engine.enter("浙A12345");
        whitelist.add("浙A12345", "registered mid-stay");
        clock.advance(Duration.ofHours(5));

        assertThat(engine.exit("浙A12345").getAmount()).isEqualTo(20.0);

        engine.enter("浙A12345");
        whitelist.remove("浙A12345");
        clock.advance(Duration.ofHours(30));

        ExitResult second = engine.exit("浙A12345");
        assertThat(second.isHasPackage()).isTrue();
        assertThat(second.getAmount()).isZero();
    }

    @Test
    void clockMovedBackwardsBillsZero() {
        engine.enter("粤B12345");
        clock.set(TestClockConfig.T0.minus(Duration.ofHours(1)));

        ExitResult result = engine.exit("粤B12345");

        assertThat(result.getDurationHalfDays()).isZero();
        assertThat(result.getAmount()).isZero();
    }

    @Test
    void fullLotRejectsEntryWithoutSideEffects() {
        for (int i = 0; i < 50; i++) {
            engine.enter("CAR" + i);
        }
        long logsBefore = logRepo.count();

        assertThatThrownBy(() -> engine.enter("CAR50")).isInstanceOf(LotFullException.class);

        assertThat(spaceRepo.countByStatus(SpaceStatus.OCCUPIED)).isEqualTo(50);
        assertThat(recordRepo.countByExitTimeIsNull()).isEqualTo(50);
        assertThat(recordRepo.existsByPlateNumberAndExitTimeIsNull("CAR50")).isFalse();
        assertThat(logRepo.count()).isEqualTo(logsBefore);
    }

    @Test
    void exitOfAbsentPlateIsRejectedAndNotLogged() {
        assertThatThrownBy(() -> engine.exit("NOPE001")).isInstanceOf(NotParkedException.class);

        assertThat(logRepo.count()).isZero();
        assertOccupancyConsistent();
    }

    @Test
    void secondExitOfSameVisitIsRejected() {
        engine.enter("粤B12345");
        clock.advance(Duration.ofHours(1));
        engine.exit("粤B12345");

        assertThatThrownBy(() -> engine.exit("粤B12345")).isInstanceOf(NotParkedException.class);
        assertThat(logsFor("粤B12345")).hasSize(2);
    }

    @Test
    void doubleEntryLeavesNoHalfAppliedSpace() {
        engine.enter("京A88888");

        assertThatThrownBy(() -> engine.enter("京A88888")).isInstanceOf(AlreadyParkedException.class);

        assertThat(space("A-002").getStatus()).isEqualTo(SpaceStatus.AVAILABLE);
        assertThat(spaceRepo.countByStatus(SpaceStatus.OCCUPIED)).isEqualTo(1);
        assertThat(logsFor("京A88888")).hasSize(1);
        assertOccupancyConsistent();
    }

    @Test
    void plateCanParkAgainAfterLeaving() {
        engine.enter("沪A66666");
        clock.advance(Duration.ofHours(2));
        engine.exit("沪A66666");
        clock.advance(Duration.ofHours(2));

        EntryResult again = engine.enter("沪A66666");

        assertThat(again.getSpaceCode()).isEqualTo("A-001");
        assertThat(recordRepo.count()).isEqualTo(2);
        assertThat(recordRepo.countByExitTimeIsNull()).isEqualTo(1);
    }

    @Test
    void platesAreNormalized() {
        engine.enter("  ab123cd ");

        assertThat(recordRepo.existsByPlateNumberAndExitTimeIsNull("AB123CD")).isTrue();
        assertThat(engine.exit("AB123CD").getSpaceCode()).isEqualTo("A-001");
    }

    @Test
    void reservedSpacesAreSkipped() {
        engine.setReservation(space("A-001").getId(), SpaceStatus.RESERVED);

        assertThat(engine.enter("苏E99999").getSpaceCode()).isEqualTo("A-002");
        assertThat(space("A-001").getStatus()).isEqualTo(SpaceStatus.RESERVED);
    }

    @Test
    void occupiedSpaceCannotBeReservedOrFreedByOperator() {
        Space taken = spaceRepo.findById(engine.enter("苏E99999").getSpaceId()).orElseThrow();

        assertThatThrownBy(() -> engine.setReservation(taken.getId(), SpaceStatus.RESERVED))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> engine.setReservation(taken.getId(), SpaceStatus.AVAILABLE))
                .isInstanceOf(InvalidTransitionException.class);

        assertThat(space(taken.getCode()).getStatus()).isEqualTo(SpaceStatus.OCCUPIED);
        assertOccupancyConsistent();
    }

    @Test
    void statsAndViewsFollowTheFlow() {
        whitelist.add("粤B88888", "VIP");
        engine.enter("粤B88888");
        engine.enter("川A77777");
        engine.setReservation(space("A-050").getId(), SpaceStatus.RESERVED);
        clock.advance(Duration.ofHours(25));
        engine.exit("川A77777");

        LotStats stats = queryService.stats();
        assertThat(stats.getTotalSpaces()).isEqualTo(50);
        assertThat(stats.getOccupiedSpaces()).isEqualTo(1);
        assertThat(stats.getReservedSpaces()).isEqualTo(1);
        assertThat(stats.getAvailableSpaces()).isEqualTo(48);
        assertThat(stats.getTotalRevenue()).isEqualTo(60.0);
        assertThat(stats.getWhitelistCount()).isEqualTo(1);

        assertThat(queryService.activeVehicles())
                .singleElement()
                .satisfies(v -> {
                    assertThat(v.getPlateNumber()).isEqualTo("粤B88888");
                    assertThat(v.getSpaceCode()).isEqualTo("A-001");
                    assertThat(v.isHasPackage()).isTrue();
                });

        assertThat(queryService.recentLogs(2))
                .extracting(l -> l.getAction())
                .containsExactly(ParkingAction.EXIT, ParkingAction.ENTRY);
    }
}
