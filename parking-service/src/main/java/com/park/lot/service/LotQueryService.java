package com.park.lot.service;

import com.park.common.model.LogView;
import com.park.common.model.LotStats;
import com.park.common.model.SpaceStatus;
import com.park.common.model.SpaceView;
import com.park.common.model.VehicleView;
import com.park.common.model.WhitelistView;
import com.park.lot.entity.EventLogEntry;
import com.park.lot.entity.OccupancyRecord;
import com.park.lot.entity.Space;
import com.park.lot.entity.WhitelistEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read models for dashboards. Nothing here mutates the lot.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class LotQueryService {

    private final SpaceInventory inventory;
    private final OccupancyLedger ledger;
    private final EventLog eventLog;
    private final WhitelistRegistry whitelist;

    public LotStats stats() {
        return LotStats.builder()
                .totalSpaces(inventory.count())
                .occupiedSpaces(inventory.countByStatus(SpaceStatus.OCCUPIED))
                .reservedSpaces(inventory.countByStatus(SpaceStatus.RESERVED))
                .availableSpaces(inventory.countByStatus(SpaceStatus.AVAILABLE))
                .totalRevenue(eventLog.totalRevenue())
                .whitelistCount(whitelist.count())
                .build();
    }

    public List<SpaceView> spaces() {
        return inventory.list().stream().map(LotQueryService::toView).toList();
    }

    public List<VehicleView> activeVehicles() {
        return ledger.activeRecords().stream().map(LotQueryService::toView).toList();
    }

    public List<LogView> recentLogs(int limit) {
        return eventLog.recent(limit).stream().map(LotQueryService::toView).toList();
    }

    public List<WhitelistView> whitelist() {
        return whitelist.list().stream().map(LotQueryService::toView).toList();
    }

    static SpaceView toView(Space s) {
        return SpaceView.builder()
                .id(s.getId())
                .code(s.getCode())
                .status(s.getStatus())
                .type(s.getType())
                .build();
    }

    private static VehicleView toView(OccupancyRecord r) {
        return VehicleView.builder()
                .id(r.getId())
                .plateNumber(r.getPlateNumber())
                .hasPackage(r.isHasPackage())
                .entryTime(r.getEntryTime())
                .spaceId(r.getSpace().getId())
                .spaceCode(r.getSpace().getCode())
                .build();
    }

    private static LogView toView(EventLogEntry e) {
        return LogView.builder()
                .id(e.getId())
                .plateNumber(e.getPlateNumber())
                .action(e.getAction())
                .timestamp(e.getTimestamp())
                .amount(e.getAmount())
                .durationHalfDays(e.getDurationHalfDays())
                .build();
    }

    private static WhitelistView toView(WhitelistEntry w) {
        return WhitelistView.builder()
                .id(w.getId())
                .plateNumber(w.getPlateNumber())
                .createdAt(w.getCreatedAt())
                .notes(w.getNotes())
                .build();
    }
}
