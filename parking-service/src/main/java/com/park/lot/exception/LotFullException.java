package com.park.lot.exception;

public class LotFullException extends ParkingException {

    public LotFullException(String plateNumber) {
        super("LOT_FULL", plateNumber, "Parking lot is full, no space available");
    }
}
