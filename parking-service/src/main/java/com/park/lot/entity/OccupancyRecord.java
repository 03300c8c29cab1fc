package com.park.lot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One visit of a vehicle. Active while exitTime is null.
 * activePlate mirrors plateNumber only while active; its unique constraint keeps
 * a second concurrent visit of the same plate out at the database level.
 */
@Entity
@Table(name = "vehicles", uniqueConstraints = @UniqueConstraint(columnNames = {"active_plate"}))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OccupancyRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plate_number", nullable = false, length = 32)
    private String plateNumber;

    @Column(name = "active_plate", unique = true, length = 32)
    private String activePlate;

    @Column(name = "has_package", nullable = false, updatable = false)
    private boolean hasPackage;

    @Column(name = "entry_time", nullable = false, updatable = false)
    private Instant entryTime;

    @Column(name = "exit_time")
    private Instant exitTime;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "space_id", nullable = false, updatable = false)
    private Space space;
}
