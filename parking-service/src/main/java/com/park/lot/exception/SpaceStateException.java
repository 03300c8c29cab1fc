package com.park.lot.exception;

import com.park.common.model.SpaceStatus;

/**
 * Occupancy flow found a space in a status it must never be in at that point,
 * e.g. releasing a space that is not occupied.
 */
public class SpaceStateException extends ParkingException {

    public SpaceStateException(String spaceCode, SpaceStatus expected, SpaceStatus actual) {
        super("SPACE_STATE_BREACH", null,
                "Space " + spaceCode + " expected " + expected + " but was " + actual);
    }
}
