package com.park.lot.entity;

import com.park.common.model.SpaceStatus;
import com.park.common.model.SpaceType;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "spaces", uniqueConstraints = @UniqueConstraint(columnNames = {"code"}))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Space {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 16)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private SpaceType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SpaceStatus status;
}
