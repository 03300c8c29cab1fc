package com.park.lot.exception;

import lombok.Getter;

/**
 * Root of the rejections raised by the lot components. Each one leaves the lot
 * in the state it had before the call.
 */
@Getter
public abstract class ParkingException extends RuntimeException {

    private final String errorCode;
    private final String plateNumber;

    protected ParkingException(String errorCode, String plateNumber, String message) {
        super(message);
        this.errorCode = errorCode;
        this.plateNumber = plateNumber;
    }
}
