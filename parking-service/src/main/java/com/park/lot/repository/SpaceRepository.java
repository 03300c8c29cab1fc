package com.park.lot.repository;

import com.park.common.model.SpaceStatus;
import com.park.common.model.SpaceType;
import com.park.lot.entity.Space;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SpaceRepository extends JpaRepository<Space, Long> {
    Optional<Space> findFirstByStatusAndTypeOrderByIdAsc(SpaceStatus status, SpaceType type);

    Optional<Space> findFirstByStatusOrderByIdAsc(SpaceStatus status);

    Optional<Space> findByCode(String code);

    List<Space> findAllByOrderByIdAsc();

    long countByStatus(SpaceStatus status);
}
