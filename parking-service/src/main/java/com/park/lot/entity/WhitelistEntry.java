package com.park.lot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "package_whitelist", uniqueConstraints = @UniqueConstraint(columnNames = {"plate_number"}))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WhitelistEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plate_number", nullable = false, unique = true, length = 32)
    private String plateNumber;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    private String notes;
}
