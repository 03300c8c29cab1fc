package com.park.lot.exception;

import com.park.common.model.SpaceStatus;
import lombok.Getter;

@Getter
public class InvalidTransitionException extends ParkingException {

    private final Long spaceId;

    public InvalidTransitionException(Long spaceId, SpaceStatus current, SpaceStatus target) {
        super("INVALID_TRANSITION", null,
                "Space " + spaceId + " cannot be set from " + current + " to " + target);
        this.spaceId = spaceId;
    }
}
