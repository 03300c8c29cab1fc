package com.park.lot.exception;

public class AlreadyParkedException extends ParkingException {

    public AlreadyParkedException(String plateNumber) {
        super("ALREADY_PARKED", plateNumber, "Vehicle " + plateNumber + " is already parked");
    }
}
