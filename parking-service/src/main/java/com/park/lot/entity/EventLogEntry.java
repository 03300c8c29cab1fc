package com.park.lot.entity;

import com.park.common.model.ParkingAction;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "logs")
@Getter @NoArgsConstructor @AllArgsConstructor @Builder
public class EventLogEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plate_number", nullable = false, updatable = false, length = 32)
    private String plateNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 8)
    private ParkingAction action;

    @Column(name = "event_time", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(nullable = false, updatable = false)
    private Double amount;

    @Column(name = "duration_half_days", nullable = false, updatable = false)
    private long durationHalfDays;
}
