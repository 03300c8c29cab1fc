package com.park.lot.exception;

import lombok.Getter;

@Getter
public class SpaceNotFoundException extends ParkingException {

    private final Long spaceId;

    public SpaceNotFoundException(Long spaceId) {
        super("SPACE_NOT_FOUND", null, "Space " + spaceId + " does not exist");
        this.spaceId = spaceId;
    }
}
